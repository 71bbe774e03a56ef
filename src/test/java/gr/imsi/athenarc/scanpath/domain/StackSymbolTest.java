package gr.imsi.athenarc.scanpath.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class StackSymbolTest {

    @Test
    public void testParseByCodeOrName() {
        assertEquals(StackSymbol.LEAD, StackSymbol.parse("Lm"));
        assertEquals(StackSymbol.LEAD, StackSymbol.parse("lead"));
        assertEquals(StackSymbol.BOTTOM, StackSymbol.parse(" Z0 "));
        assertThrows(IllegalArgumentException.class, () -> StackSymbol.parse("Xm"));
    }

    @Test
    public void testStateFromName() {
        assertEquals(State.Q5, State.fromName("q5"));
        assertEquals("verification", State.Q5.getPhase());
        assertThrows(IllegalArgumentException.class, () -> State.fromName("Q7"));
    }

    @Test
    public void testAlphabetGroups() {
        assertEquals(12, EcgAlphabet.LEADS.size());
        assertTrue(EcgAlphabet.isFeature(EcgAlphabet.RHYTHM));
        assertTrue(EcgAlphabet.isLead("V1"));
        assertFalse(EcgAlphabet.isLead(EcgAlphabet.BEGIN_VERIFICATION));
        assertEquals(22, EcgAlphabet.all().size());
        assertFalse(EcgAlphabet.contains("X"));
    }
}
