package gr.imsi.athenarc.scanpath.pda;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Immutable transition function of a deterministic pushdown automaton.
 * It is a partial function: every (state, symbol, stack top) key has at most one rule,
 * and a key without a rule means there is no legal move.
 * Instances are read-only and can be shared between engines on different threads.
 */
public final class TransitionTable {

    private final ImmutableMap<TransitionKey, TransitionRule> rules;
    private final State initialState;
    private final ImmutableSet<State> acceptingStates;
    private final StackSymbol initialStackSymbol;

    private TransitionTable(Builder builder) {
        this.rules = ImmutableMap.copyOf(builder.rules);
        this.initialState = builder.initialState;
        this.acceptingStates = ImmutableSet.copyOf(builder.acceptingStates);
        this.initialStackSymbol = builder.initialStackSymbol;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the rule for a triple. A miss is a normal outcome, not an error.
     *
     * @return the rule, or empty if the automaton has no move for this triple
     */
    @NotNull
    public Optional<TransitionRule> lookup(State state, String symbol, StackSymbol stackTop) {
        if (state == null || symbol == null || stackTop == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(new TransitionKey(state, symbol, stackTop)));
    }

    public boolean contains(State state, String symbol, StackSymbol stackTop) {
        return lookup(state, symbol, stackTop).isPresent();
    }

    public Map<TransitionKey, TransitionRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public State getInitialState() {
        return initialState;
    }

    public Set<State> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(State state) {
        return acceptingStates.contains(state);
    }

    public StackSymbol getInitialStackSymbol() {
        return initialStackSymbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionTable that = (TransitionTable) o;
        return rules.equals(that.rules)
            && initialState == that.initialState
            && acceptingStates.equals(that.acceptingStates)
            && initialStackSymbol == that.initialStackSymbol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rules, initialState, acceptingStates, initialStackSymbol);
    }

    @Override
    public String toString() {
        return "TransitionTable{rules=" + rules.size()
            + ", initial=" + initialState
            + ", accepting=" + acceptingStates + "}";
    }

    /**
     * Collects rules one at a time and refuses a second rule for a key that is already mapped.
     */
    public static class Builder {
        private final Map<TransitionKey, TransitionRule> rules = new LinkedHashMap<>();
        private State initialState;
        private final Set<State> acceptingStates = new LinkedHashSet<>();
        private StackSymbol initialStackSymbol = StackSymbol.BOTTOM;

        private Builder() {
        }

        public Builder initialState(State initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder acceptingState(State state) {
            this.acceptingStates.add(Preconditions.checkNotNull(state));
            return this;
        }

        public Builder initialStackSymbol(StackSymbol initialStackSymbol) {
            this.initialStackSymbol = initialStackSymbol;
            return this;
        }

        /**
         * Adds a rule. The replacement is given bottom-first.
         *
         * @throws TransitionTableException if a rule already exists for the key
         */
        public Builder add(State state, String symbol, StackSymbol stackTop, State nextState, StackSymbol... replacement) {
            return add(new TransitionKey(state, symbol, stackTop), TransitionRule.of(nextState, replacement));
        }

        public Builder add(TransitionKey key, TransitionRule rule) {
            Preconditions.checkNotNull(key.getState(), "Transition state cannot be null");
            Preconditions.checkNotNull(key.getSymbol(), "Transition symbol cannot be null");
            Preconditions.checkNotNull(key.getStackTop(), "Transition stack top cannot be null");
            TransitionRule existing = rules.putIfAbsent(key, rule);
            if (existing != null) {
                throw new TransitionTableException("Duplicate transition for " + key
                    + ": " + existing + " and " + rule);
            }
            return this;
        }

        /**
         * @throws IllegalStateException if the initial state or the accepting states are missing
         */
        public TransitionTable build() {
            if (initialState == null) {
                throw new IllegalStateException("Cannot build TransitionTable: missing initial state");
            }
            if (acceptingStates.isEmpty()) {
                throw new IllegalStateException("Cannot build TransitionTable: missing accepting states");
            }
            Preconditions.checkState(initialStackSymbol != null, "Initial stack symbol cannot be null");
            return new TransitionTable(this);
        }
    }
}
