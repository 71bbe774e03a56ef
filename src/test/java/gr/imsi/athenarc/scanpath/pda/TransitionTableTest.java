package gr.imsi.athenarc.scanpath.pda;

import static gr.imsi.athenarc.scanpath.domain.StackSymbol.BOTTOM;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.FEATURE;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.LEAD;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.RHYTHM;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.VERIFICATION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.scanpath.domain.EcgAlphabet;
import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

public class TransitionTableTest {

    private final TransitionTable table = VerificationTransitions.standard();

    @Test
    public void testStandardTableShape() {
        assertEquals(123, table.size());
        assertEquals(State.Q0, table.getInitialState());
        assertEquals(Set.of(State.Q6), table.getAcceptingStates());
        assertEquals(BOTTOM, table.getInitialStackSymbol());
    }

    @Test
    public void testRebuildingGivesEqualTable() {
        TransitionTable again = VerificationTransitions.standard();
        assertEquals(table, again);
        assertEquals(table.getRules(), again.getRules());
    }

    @Test
    public void testLookupReturnsBottomFirstReplacement() {
        Optional<TransitionRule> rhythm = table.lookup(State.Q1, EcgAlphabet.RHYTHM, BOTTOM);
        assertTrue(rhythm.isPresent());
        assertEquals(State.Q2, rhythm.get().getNextState());
        assertEquals(List.of(BOTTOM, RHYTHM), rhythm.get().getReplacement());
        assertEquals(1, rhythm.get().getDepthDelta());

        TransitionRule newLead = table.lookup(State.Q4, "V3", FEATURE).orElseThrow();
        assertEquals(State.Q3, newLead.getNextState());
        assertEquals(List.of(RHYTHM, LEAD), newLead.getReplacement());
    }

    @Test
    public void testConfirmationRules() {
        for (StackSymbol top : List.of(FEATURE, LEAD, VERIFICATION)) {
            TransitionRule pop = table.lookup(State.Q5, EcgAlphabet.CONFIRM, top).orElseThrow();
            assertTrue(pop.getReplacement().isEmpty());
            assertEquals(-1, pop.getDepthDelta());
        }
        TransitionRule rhythm = table.lookup(State.Q5, EcgAlphabet.CONFIRM, RHYTHM).orElseThrow();
        assertEquals(List.of(RHYTHM), rhythm.getReplacement());
        assertFalse(table.contains(State.Q5, EcgAlphabet.CONFIRM, BOTTOM));
    }

    @Test
    public void testCompletionFromEveryPendingLevelExceptVerification() {
        for (StackSymbol top : List.of(RHYTHM, BOTTOM, LEAD, FEATURE)) {
            TransitionRule rule = table.lookup(State.Q5, EcgAlphabet.OPEN, top).orElseThrow();
            assertEquals(State.Q6, rule.getNextState());
            assertEquals(List.of(BOTTOM), rule.getReplacement());
        }
        assertFalse(table.contains(State.Q5, EcgAlphabet.OPEN, VERIFICATION));
    }

    @Test
    public void testRevisitsDuringVerificationKeepTheTop() {
        assertEquals(List.of(RHYTHM), table.lookup(State.Q5, "aR", RHYTHM)
            .map(TransitionRule::getReplacement).orElseThrow());
        assertEquals(List.of(LEAD), table.lookup(State.Q5, "T", LEAD).orElseThrow().getReplacement());
        // features are not revisited while only the rhythm marker is pending
        assertFalse(table.contains(State.Q5, "T", RHYTHM));
    }

    @Test
    public void testMissesAreEmptyNotErrors() {
        assertFalse(table.lookup(State.Q0, EcgAlphabet.RHYTHM, BOTTOM).isPresent());
        assertFalse(table.lookup(State.Q6, EcgAlphabet.OPEN, BOTTOM).isPresent());
        assertFalse(table.lookup(State.Q1, "unknown", BOTTOM).isPresent());
        assertFalse(table.lookup(null, EcgAlphabet.OPEN, BOTTOM).isPresent());
        assertFalse(table.lookup(State.Q0, null, BOTTOM).isPresent());
        assertFalse(table.lookup(State.Q0, EcgAlphabet.OPEN, null).isPresent());
    }

    @Test
    public void testBuilderRejectsDuplicateKey() {
        TransitionTable.Builder builder = TransitionTable.builder()
            .initialState(State.Q0)
            .acceptingState(State.Q1)
            .add(State.Q0, "a", BOTTOM, State.Q1, BOTTOM);
        assertThrows(TransitionTableException.class,
            () -> builder.add(State.Q0, "a", BOTTOM, State.Q0, BOTTOM, LEAD));
    }

    @Test
    public void testBuilderNeedsInitialAndAcceptingStates() {
        assertThrows(IllegalStateException.class,
            () -> TransitionTable.builder().acceptingState(State.Q1).build());
        assertThrows(IllegalStateException.class,
            () -> TransitionTable.builder().initialState(State.Q0).build());
    }

    @Test
    public void testRulesAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> table.getRules().clear());
    }
}
