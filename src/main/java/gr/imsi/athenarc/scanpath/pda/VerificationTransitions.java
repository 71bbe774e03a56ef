package gr.imsi.athenarc.scanpath.pda;

import static gr.imsi.athenarc.scanpath.domain.StackSymbol.BOTTOM;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.FEATURE;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.LEAD;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.RHYTHM;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.VERIFICATION;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.scanpath.domain.EcgAlphabet;
import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Builds the standard verification table, phase by phase.
 *
 * <p>A reading opens with an overview, assesses rhythm, drills down into leads and the
 * features inside them, then starts a verification pass that confirms the open levels one
 * by one and closes with a final overview. Every level opened pushes a marker; every
 * confirmation pops one. Completion is allowed with markers still pending and discharges
 * them all at once.</p>
 *
 * <p>Building has no side effects, so two calls always produce equal tables.</p>
 */
public final class VerificationTransitions {

    private static final Logger LOG = LoggerFactory.getLogger(VerificationTransitions.class);

    private VerificationTransitions() {
    }

    public static TransitionTable standard() {
        TransitionTable.Builder builder = TransitionTable.builder()
            .initialState(State.Q0)
            .acceptingState(State.Q6)
            .initialStackSymbol(BOTTOM);

        addOverview(builder);
        addRhythmAssessment(builder);
        addLeadExamination(builder);
        addFeatureExamination(builder);
        addVerificationStart(builder);
        addVerificationUnwinding(builder);
        addCompletion(builder);

        TransitionTable table = builder.build();
        LOG.debug("Built standard verification table with {} transitions", table.size());
        return table;
    }

    // ---------------------------------------------
    // Phase 1: overview, repeatable, stack untouched
    // ---------------------------------------------
    private static void addOverview(TransitionTable.Builder builder) {
        builder.add(State.Q0, EcgAlphabet.OPEN, BOTTOM, State.Q1, BOTTOM);
        builder.add(State.Q1, EcgAlphabet.OPEN, BOTTOM, State.Q1, BOTTOM);
    }

    // ---------------------------------------------
    // Phase 2: rhythm assessment opens the rhythm level
    // ---------------------------------------------
    private static void addRhythmAssessment(TransitionTable.Builder builder) {
        builder.add(State.Q1, EcgAlphabet.RHYTHM, BOTTOM, State.Q2, BOTTOM, RHYTHM);
        builder.add(State.Q2, EcgAlphabet.RHYTHM, RHYTHM, State.Q2, RHYTHM);
    }

    // ---------------------------------------------
    // Phase 3: lead-level examination
    // ---------------------------------------------
    private static void addLeadExamination(TransitionTable.Builder builder) {
        for (String lead : EcgAlphabet.LEADS) {
            builder.add(State.Q2, lead, RHYTHM, State.Q3, RHYTHM, LEAD);
            builder.add(State.Q3, lead, LEAD, State.Q3, LEAD);
            // moving on to another lead after drilling into a feature
            builder.add(State.Q4, lead, FEATURE, State.Q3, RHYTHM, LEAD);
        }
    }

    // ---------------------------------------------
    // Phase 4: feature-level examination
    // ---------------------------------------------
    private static void addFeatureExamination(TransitionTable.Builder builder) {
        for (String feature : EcgAlphabet.FEATURES) {
            builder.add(State.Q3, feature, LEAD, State.Q4, LEAD, FEATURE);
            builder.add(State.Q4, feature, FEATURE, State.Q4, FEATURE);
        }
    }

    // ---------------------------------------------
    // Phase 5: verification starts from a feature or a lead
    // ---------------------------------------------
    private static void addVerificationStart(TransitionTable.Builder builder) {
        builder.add(State.Q4, EcgAlphabet.BEGIN_VERIFICATION, FEATURE, State.Q5, FEATURE, VERIFICATION);
        builder.add(State.Q3, EcgAlphabet.BEGIN_VERIFICATION, LEAD, State.Q5, LEAD, VERIFICATION);
    }

    // ---------------------------------------------
    // Phase 6: each confirmation discharges one pending marker
    // ---------------------------------------------
    private static void addVerificationUnwinding(TransitionTable.Builder builder) {
        builder.add(State.Q5, EcgAlphabet.CONFIRM, FEATURE, State.Q5);
        builder.add(State.Q5, EcgAlphabet.CONFIRM, LEAD, State.Q5);
        builder.add(State.Q5, EcgAlphabet.CONFIRM, VERIFICATION, State.Q5);
        // rhythm spans the whole reading and is never discharged by a confirmation
        builder.add(State.Q5, EcgAlphabet.CONFIRM, RHYTHM, State.Q5, RHYTHM);

        // leads and features may be revisited freely during verification
        for (String lead : EcgAlphabet.LEADS) {
            for (StackSymbol top : new StackSymbol[] {VERIFICATION, RHYTHM, LEAD, FEATURE}) {
                builder.add(State.Q5, lead, top, State.Q5, top);
            }
        }
        for (String feature : EcgAlphabet.FEATURES) {
            for (StackSymbol top : new StackSymbol[] {VERIFICATION, FEATURE, LEAD}) {
                builder.add(State.Q5, feature, top, State.Q5, top);
            }
        }
    }

    // ---------------------------------------------
    // Phase 7: a final overview completes the reading
    // ---------------------------------------------
    private static void addCompletion(TransitionTable.Builder builder) {
        for (StackSymbol top : new StackSymbol[] {RHYTHM, BOTTOM, LEAD, FEATURE}) {
            builder.add(State.Q5, EcgAlphabet.OPEN, top, State.Q6, BOTTOM);
        }
    }
}
