package gr.imsi.athenarc.scanpath.analysis;

import static gr.imsi.athenarc.scanpath.domain.StackSymbol.BOTTOM;
import static gr.imsi.athenarc.scanpath.domain.StackSymbol.RHYTHM;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.scanpath.domain.Scanpath;
import gr.imsi.athenarc.scanpath.domain.State;
import gr.imsi.athenarc.scanpath.pda.AutomatonEngine;
import gr.imsi.athenarc.scanpath.pda.VerificationTransitions;

public class ScanpathAnalyzerTest {

    private final ScanpathAnalyzer analyzer = new ScanpathAnalyzer(VerificationTransitions.standard());

    @Test
    public void testCompleteVerification() {
        ScanpathAnalysis analysis = analyzer.analyze("expert", Scanpath.parse("O R II P Q V ✓ ✓ O"));
        assertTrue(analysis.isAccepted());
        assertEquals(VerificationOutcome.COMPLETE, analysis.getOutcome());
        assertEquals(State.Q6, analysis.getFinalState());
        assertEquals(List.of(BOTTOM, RHYTHM, BOTTOM), analysis.getFinalStack());
        assertEquals(9, analysis.getConsumed());
        assertEquals(4, analysis.getMaxStackDepth());
        assertEquals(1.0, analysis.getVerificationCompletenessScore());
    }

    @Test
    public void testIncompleteVerification() {
        ScanpathAnalysis analysis = analyzer.analyze("partial", Scanpath.parse("O R II P Q V ✓"));
        assertFalse(analysis.isAccepted());
        assertEquals(VerificationOutcome.INCOMPLETE, analysis.getOutcome());
        assertEquals(State.Q5, analysis.getFinalState());
        assertEquals(7, analysis.getConsumed());
        assertEquals(4, analysis.getMaxStackDepth());
        assertEquals(1.0 / 6.0, analysis.getVerificationCompletenessScore(), 1e-12);
    }

    @Test
    public void testConsumedStopsAtFirstRejectedSymbol() {
        ScanpathAnalysis analysis = analyzer.analyze("broken", Scanpath.parse("O R X II P"));
        assertEquals(2, analysis.getConsumed());
        assertEquals(State.Q2, analysis.getFinalState());
        // the depth run carries on past the rejected symbol
        assertEquals(3, analysis.getMaxStackDepth());
    }

    @Test
    public void testAgreesWithEngine() {
        AutomatonEngine engine = AutomatonEngine.standard();
        for (String text : List.of("", "O", "O R II P Q S T V1 P Q V II ✓ V1 ✓ O", "O R II P Q V1 P", "✓ ✓ ✓")) {
            Scanpath scanpath = Scanpath.parse(text);
            ScanpathAnalysis analysis = analyzer.analyze(text, scanpath);
            assertEquals(engine.accepts(scanpath), analysis.isAccepted(), text);
            assertEquals(engine.maxStackDepth(scanpath), analysis.getMaxStackDepth(), text);
            assertEquals(engine.verificationCompletenessScore(scanpath), analysis.getVerificationCompletenessScore(), text);
        }
    }

    @Test
    public void testAnalyzeAllKeepsOrder() {
        Map<String, Scanpath> batch = new LinkedHashMap<>();
        batch.put("b", Scanpath.parse("O R II P Q"));
        batch.put("a", Scanpath.parse("O R II P Q V ✓ ✓ O"));
        List<ScanpathAnalysis> analyses = analyzer.analyzeAll(batch);
        assertEquals(2, analyses.size());
        assertEquals("b", analyses.get(0).getId());
        assertEquals("a", analyses.get(1).getId());
        assertTrue(analyses.get(1).isAccepted());
    }
}
