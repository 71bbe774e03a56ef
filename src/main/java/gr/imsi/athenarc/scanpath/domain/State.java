package gr.imsi.athenarc.scanpath.domain;

/** States of the verification automaton, one per phase of an ECG reading. **/
public enum State {
    Q0("start"),         // Nothing read yet
    Q1("overview"),      // Whole-tracing overview
    Q2("rhythm"),        // Rhythm assessment
    Q3("lead"),          // Examining a single lead
    Q4("feature"),       // Examining a feature inside a lead
    Q5("verification"),  // Verification pass, unwinding pending markers
    Q6("complete");      // Verification closed by a final overview

    private final String phase;

    State(String phase) {
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }

    /**
     * Resolves a state from its enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no state has that name
     */
    public static State fromName(String name) {
        for (State state : values()) {
            if (state.name().equalsIgnoreCase(name.trim())) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown state: " + name);
    }
}
