package gr.imsi.athenarc.scanpath.pda;

import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Outcome of feeding one symbol to the engine during a trace.
 */
public class StepRecord {
    private final int position;
    private final String symbol;
    private final boolean stepped;
    private final State state;
    private final int depth;

    public StepRecord(int position, String symbol, boolean stepped, State state, int depth) {
        this.position = position;
        this.symbol = symbol;
        this.stepped = stepped;
        this.state = state;
        this.depth = depth;
    }

    public int getPosition() {
        return position;
    }

    public String getSymbol() {
        return symbol;
    }

    /** False when the automaton had no move and the configuration was left unchanged. */
    public boolean isStepped() {
        return stepped;
    }

    public State getState() {
        return state;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return String.format("%d: %s -> %s depth=%d%s", position, symbol, state, depth, stepped ? "" : " (rejected)");
    }
}
