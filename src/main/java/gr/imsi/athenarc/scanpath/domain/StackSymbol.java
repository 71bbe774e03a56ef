package gr.imsi.athenarc.scanpath.domain;

/**
 * Stack alphabet of the verification automaton. Every marker above {@link #BOTTOM}
 * records a level of examination that has been opened and not yet confirmed.
 */
public enum StackSymbol {
    BOTTOM("Z0"),
    RHYTHM("Rm"),
    LEAD("Lm"),
    FEATURE("Fm"),
    VERIFICATION("Vm");

    private final String code;

    StackSymbol(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a symbol from either its short code ({@code Lm}) or its enum name ({@code LEAD}).
     *
     * @throws IllegalArgumentException if the value matches neither
     */
    public static StackSymbol parse(String value) {
        String trimmed = value.trim();
        for (StackSymbol symbol : values()) {
            if (symbol.code.equals(trimmed) || symbol.name().equalsIgnoreCase(trimmed)) {
                return symbol;
            }
        }
        throw new IllegalArgumentException("Unknown stack symbol: " + value);
    }

    @Override
    public String toString() {
        return code;
    }
}
