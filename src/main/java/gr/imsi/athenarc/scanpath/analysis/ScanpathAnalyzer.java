package gr.imsi.athenarc.scanpath.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.scanpath.domain.Scanpath;
import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;
import gr.imsi.athenarc.scanpath.pda.AutomatonEngine;
import gr.imsi.athenarc.scanpath.pda.StepRecord;
import gr.imsi.athenarc.scanpath.pda.TransitionTable;

/**
 * Runs the three automaton analyses over scanpaths. A fresh engine is created for every
 * scanpath, so one analyzer can be used from several threads as long as the table is shared
 * read-only.
 */
public class ScanpathAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(ScanpathAnalyzer.class);

    private final TransitionTable table;

    public ScanpathAnalyzer(TransitionTable table) {
        this.table = Preconditions.checkNotNull(table, "Transition table cannot be null");
    }

    public TransitionTable getTable() {
        return table;
    }

    public ScanpathAnalysis analyze(String id, Scanpath scanpath) {
        AutomatonEngine engine = new AutomatonEngine(table);

        boolean accepted = engine.accepts(scanpath);
        State finalState = engine.getCurrentState();
        List<StackSymbol> finalStack = engine.getStack();

        // the trace matches the acceptance run up to its first rejected symbol
        int consumed = scanpath.size();
        for (StepRecord record : engine.trace(scanpath)) {
            if (!record.isStepped()) {
                consumed = record.getPosition();
                break;
            }
        }

        int maxDepth = engine.maxStackDepth(scanpath);
        double score = engine.verificationCompletenessScore(scanpath);

        ScanpathAnalysis analysis = new ScanpathAnalysis(id, scanpath, accepted,
            finalState, finalStack, consumed, maxDepth, score);
        LOG.debug("Analysed {}", analysis);
        return analysis;
    }

    /**
     * Analyses scanpaths in iteration order of the map, which is taken as id to scanpath.
     */
    public List<ScanpathAnalysis> analyzeAll(Map<String, Scanpath> scanpaths) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<ScanpathAnalysis> analyses = new ArrayList<>(scanpaths.size());
        for (Map.Entry<String, Scanpath> entry : scanpaths.entrySet()) {
            analyses.add(analyze(entry.getKey(), entry.getValue()));
        }
        LOG.info("Analysed {} scanpaths in {}", analyses.size(), stopwatch);
        return analyses;
    }
}
