package gr.imsi.athenarc.scanpath.pda;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Target of a transition: the next state and the symbols that replace the popped stack top.
 * The replacement is listed bottom-first, so its last element becomes the new top.
 * An empty replacement is a plain pop.
 */
public final class TransitionRule {
    private final State nextState;
    private final ImmutableList<StackSymbol> replacement;

    public TransitionRule(State nextState, List<StackSymbol> replacement) {
        this.nextState = Preconditions.checkNotNull(nextState, "Next state cannot be null");
        this.replacement = ImmutableList.copyOf(replacement);
    }

    public static TransitionRule of(State nextState, StackSymbol... replacement) {
        return new TransitionRule(nextState, ImmutableList.copyOf(replacement));
    }

    public State getNextState() {
        return nextState;
    }

    public List<StackSymbol> getReplacement() {
        return replacement;
    }

    /** Change in stack size caused by applying this rule. */
    public int getDepthDelta() {
        return replacement.size() - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionRule that = (TransitionRule) o;
        return nextState == that.nextState && replacement.equals(that.replacement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nextState, replacement);
    }

    @Override
    public String toString() {
        return "(" + nextState + ", [" + Joiner.on(',').join(replacement) + "])";
    }
}
