package gr.imsi.athenarc.scanpath.pda;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Run-time configuration of one automaton run: the current state and the stack.
 * The stack is kept bottom-first, so the last element is the top.
 * Owned by a single engine and never shared.
 */
public class PdaConfiguration {
    private final State initialState;
    private final StackSymbol initialStackSymbol;

    private State state;
    private final List<StackSymbol> stack = new ArrayList<>();

    public PdaConfiguration(State initialState, StackSymbol initialStackSymbol) {
        this.initialState = initialState;
        this.initialStackSymbol = initialStackSymbol;
        reset();
    }

    public void reset() {
        state = initialState;
        stack.clear();
        stack.add(initialStackSymbol);
    }

    /**
     * Pops the top and pushes {@code replacement} in order, then moves to {@code nextState}.
     * The caller has checked that the stack is not empty.
     */
    void apply(TransitionRule rule) {
        stack.remove(stack.size() - 1);
        stack.addAll(rule.getReplacement());
        state = rule.getNextState();
    }

    public State getState() {
        return state;
    }

    /** Top of the stack, or null if the stack is empty. */
    public StackSymbol top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    public boolean isStackEmpty() {
        return stack.isEmpty();
    }

    public int stackSize() {
        return stack.size();
    }

    /** Stack depth excluding the bottom marker. */
    public int depth() {
        return stack.size() - 1;
    }

    public boolean contains(StackSymbol symbol) {
        return stack.contains(symbol);
    }

    /** Bottom-first copy of the stack. */
    public List<StackSymbol> getStack() {
        return ImmutableList.copyOf(stack);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + stack + ")";
    }
}
