package gr.imsi.athenarc.scanpath.domain;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Input symbols understood by the standard verification table.
 * The automaton itself treats symbols as opaque tokens; the grouping only
 * matters when the table is built.
 */
public final class EcgAlphabet {

    public static final String OPEN = "O";
    public static final String COMPARE = "C";
    public static final String ANNOTATE = "A";

    public static final String RHYTHM = "R";
    public static final String BEGIN_VERIFICATION = "V";
    public static final String CONFIRM = "✓";

    public static final List<String> LEADS = ImmutableList.of(
        "I", "II", "III", "aR", "aL", "aF",
        "V1", "V2", "V3", "V4", "V5", "V6");

    // R doubles as the rhythm symbol
    public static final List<String> FEATURES = ImmutableList.of("P", "Q", "S", "T", RHYTHM);

    public static final List<String> ACTIONS = ImmutableList.of(OPEN, COMPARE, ANNOTATE);

    public static final List<String> VERIFICATION = ImmutableList.of(BEGIN_VERIFICATION, CONFIRM);

    private static final ImmutableSet<String> ALL = ImmutableSet.<String>builder()
        .addAll(LEADS)
        .addAll(FEATURES)
        .addAll(ACTIONS)
        .addAll(VERIFICATION)
        .build();

    private EcgAlphabet() {
    }

    public static boolean isLead(String symbol) {
        return LEADS.contains(symbol);
    }

    public static boolean isFeature(String symbol) {
        return FEATURES.contains(symbol);
    }

    public static boolean contains(String symbol) {
        return ALL.contains(symbol);
    }

    public static ImmutableSet<String> all() {
        return ALL;
    }
}
