package gr.imsi.athenarc.scanpath.pda;

import java.util.Objects;

import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * The (state, input symbol, stack top) triple a transition is selected by.
 */
public final class TransitionKey {
    private final State state;
    private final String symbol;
    private final StackSymbol stackTop;

    public TransitionKey(State state, String symbol, StackSymbol stackTop) {
        this.state = state;
        this.symbol = symbol;
        this.stackTop = stackTop;
    }

    public State getState() {
        return state;
    }

    public String getSymbol() {
        return symbol;
    }

    public StackSymbol getStackTop() {
        return stackTop;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionKey that = (TransitionKey) o;
        return state == that.state
            && Objects.equals(symbol, that.symbol)
            && stackTop == that.stackTop;
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, symbol, stackTop);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + symbol + ", " + stackTop + ")";
    }
}
