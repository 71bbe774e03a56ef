package gr.imsi.athenarc.scanpath.pda;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.scanpath.domain.EcgAlphabet;
import gr.imsi.athenarc.scanpath.domain.Scanpath;
import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Drives runs of a deterministic pushdown automaton over a {@link TransitionTable}.
 *
 * <p>Each analysis method starts with a reset and owns the configuration for the length of
 * the run. The engine is not thread-safe: use one engine per thread. The table can be
 * shared.</p>
 */
public class AutomatonEngine {
    private static final Logger LOG = LoggerFactory.getLogger(AutomatonEngine.class);

    /** Confirmations needed for a full score when the scanpath is not accepted. */
    static final double CONFIRMATIONS_FOR_FULL_SCORE = 6.0;

    private final TransitionTable table;
    private final PdaConfiguration configuration;

    public AutomatonEngine(TransitionTable table) {
        this.table = Preconditions.checkNotNull(table, "Transition table cannot be null");
        this.configuration = new PdaConfiguration(table.getInitialState(), table.getInitialStackSymbol());
    }

    /** Engine over the standard verification table. */
    public static AutomatonEngine standard() {
        return new AutomatonEngine(VerificationTransitions.standard());
    }

    public void reset() {
        configuration.reset();
    }

    /**
     * Feeds a single symbol.
     *
     * @return false if there is no legal move, in which case the configuration is unchanged
     */
    public boolean step(String symbol) {
        if (configuration.isStackEmpty()) {
            LOG.warn("Step on empty stack in state {}", configuration.getState());
            return false;
        }
        StackSymbol top = configuration.top();
        Optional<TransitionRule> rule = table.lookup(configuration.getState(), symbol, top);
        if (rule.isEmpty()) {
            LOG.debug("No move for ({}, {}, {})", configuration.getState(), symbol, top);
            return false;
        }
        configuration.apply(rule.get());
        return true;
    }

    public boolean accepts(String scanpath) {
        return accepts(Scanpath.parse(scanpath));
    }

    /**
     * Replays the scanpath and stops at the first symbol without a move.
     * Accepts when every symbol was consumed, the final state is accepting and the bottom
     * marker is still somewhere in the stack. Markers left above it do not matter.
     */
    public boolean accepts(Scanpath scanpath) {
        reset();
        for (String symbol : scanpath) {
            if (!step(symbol)) {
                return false;
            }
        }
        return table.isAccepting(configuration.getState())
            && configuration.contains(table.getInitialStackSymbol());
    }

    public int maxStackDepth(String scanpath) {
        return maxStackDepth(Scanpath.parse(scanpath));
    }

    /**
     * Deepest stack reached during the run, excluding the bottom marker.
     * Rejected symbols are skipped and the run goes on.
     */
    public int maxStackDepth(Scanpath scanpath) {
        reset();
        int maxDepth = 0;
        for (String symbol : scanpath) {
            step(symbol);
            maxDepth = Math.max(maxDepth, configuration.depth());
        }
        return maxDepth;
    }

    public double verificationCompletenessScore(String scanpath) {
        return verificationCompletenessScore(Scanpath.parse(scanpath));
    }

    /**
     * 1.0 for an accepted scanpath. Otherwise the number of confirmations in the raw
     * input over six, capped at 1.0.
     */
    public double verificationCompletenessScore(Scanpath scanpath) {
        if (accepts(scanpath)) {
            return 1.0;
        }
        int confirmations = scanpath.count(EcgAlphabet.CONFIRM);
        return Math.min(confirmations / CONFIRMATIONS_FOR_FULL_SCORE, 1.0);
    }

    /**
     * Replays the scanpath the way {@link #maxStackDepth(Scanpath)} does and records every step.
     */
    @NotNull
    public List<StepRecord> trace(Scanpath scanpath) {
        reset();
        List<StepRecord> records = new ArrayList<>(scanpath.size());
        for (int i = 0; i < scanpath.size(); i++) {
            String symbol = scanpath.get(i);
            boolean stepped = step(symbol);
            records.add(new StepRecord(i, symbol, stepped, configuration.getState(), configuration.depth()));
        }
        return records;
    }

    public State getCurrentState() {
        return configuration.getState();
    }

    public int getStackDepth() {
        return configuration.depth();
    }

    /** Bottom-first snapshot of the current stack. */
    public List<StackSymbol> getStack() {
        return configuration.getStack();
    }

    public Set<State> getAcceptingStates() {
        return table.getAcceptingStates();
    }

    public TransitionTable getTransitionTable() {
        return table;
    }
}
