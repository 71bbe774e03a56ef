package gr.imsi.athenarc.scanpath.analysis;

import java.util.List;

import gr.imsi.athenarc.scanpath.domain.Scanpath;
import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Everything the automaton reports about one scanpath.
 */
public class ScanpathAnalysis {
    private final String id;
    private final Scanpath scanpath;
    private final boolean accepted;
    private final State finalState;
    private final List<StackSymbol> finalStack;
    private final int consumed;
    private final int maxStackDepth;
    private final double verificationCompletenessScore;

    public ScanpathAnalysis(String id, Scanpath scanpath, boolean accepted, State finalState,
                            List<StackSymbol> finalStack, int consumed, int maxStackDepth,
                            double verificationCompletenessScore) {
        this.id = id;
        this.scanpath = scanpath;
        this.accepted = accepted;
        this.finalState = finalState;
        this.finalStack = finalStack;
        this.consumed = consumed;
        this.maxStackDepth = maxStackDepth;
        this.verificationCompletenessScore = verificationCompletenessScore;
    }

    public String getId() {
        return id;
    }

    public Scanpath getScanpath() {
        return scanpath;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public VerificationOutcome getOutcome() {
        return accepted ? VerificationOutcome.COMPLETE : VerificationOutcome.INCOMPLETE;
    }

    /** State where the acceptance run stopped. */
    public State getFinalState() {
        return finalState;
    }

    /** Bottom-first stack where the acceptance run stopped. */
    public List<StackSymbol> getFinalStack() {
        return finalStack;
    }

    /** Symbols consumed before the first symbol without a move. */
    public int getConsumed() {
        return consumed;
    }

    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    public double getVerificationCompletenessScore() {
        return verificationCompletenessScore;
    }

    @Override
    public String toString() {
        return String.format("%s [%s] accepted=%s state=%s depth=%d vcs=%.2f",
            id, scanpath, accepted, finalState, maxStackDepth, verificationCompletenessScore);
    }
}
