package gr.imsi.athenarc.scanpath;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.scanpath.analysis.AnalysisSummary;
import gr.imsi.athenarc.scanpath.analysis.ScanpathAnalysis;
import gr.imsi.athenarc.scanpath.analysis.ScanpathAnalyzer;
import gr.imsi.athenarc.scanpath.config.ScanpathConfiguration;
import gr.imsi.athenarc.scanpath.domain.Scanpath;
import gr.imsi.athenarc.scanpath.pda.AutomatonEngine;
import gr.imsi.athenarc.scanpath.pda.StepRecord;
import gr.imsi.athenarc.scanpath.pda.TransitionTable;
import gr.imsi.athenarc.scanpath.pda.TransitionTableLoader;
import gr.imsi.athenarc.scanpath.pda.VerificationTransitions;
import gr.imsi.athenarc.scanpath.report.CsvReportWriter;
import gr.imsi.athenarc.scanpath.report.JsonSummaryWriter;
import gr.imsi.athenarc.scanpath.report.ScanpathFileReader;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String RESULTS_FILE = "results.csv";
    static final String SUMMARY_FILE = "summary.json";

    @Parameter(names = "-mode", description = "Mode: 'demo' (default) runs the example scanpaths, 'classify' analyses the given inputs")
    private String mode = "demo";

    @Parameter(names = "-input", description = "File with one scanpath per line, optionally prefixed by an id and a tab")
    private String input;

    @Parameter(names = "-scanpath", description = "Scanpath given inline as whitespace-separated symbols (repeatable)")
    private List<String> scanpaths;

    @Parameter(names = "-table", description = "Transition table properties file (default: built-in verification table)")
    private String table;

    @Parameter(names = "-out", description = "Output folder for results.csv and summary.json")
    private String outFolder;

    @Parameter(names = "-trace", description = "Print every step of every scanpath")
    private boolean trace;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        int status = new Main().execute(System.out, args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parses the arguments and runs the selected mode.
     *
     * @return process exit status
     */
    int execute(PrintStream out, String... args) {
        JCommander jCommander = JCommander.newBuilder().addObject(this).programName("scanpath-pda").build();
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return 2;
        }
        if (help) {
            jCommander.usage();
            return 0;
        }
        try {
            run(out);
            return 0;
        } catch (IOException e) {
            LOG.error("I/O error: ", e);
            return 1;
        } catch (RuntimeException e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void run(PrintStream out) throws IOException {
        ScanpathConfiguration.Builder builder = ScanpathConfiguration.load().toBuilder();
        if (table != null) {
            builder.tableLocation(table);
        }
        if (outFolder != null) {
            builder.outFolder(outFolder);
        }
        ScanpathConfiguration configuration = builder.build();

        TransitionTable transitionTable = configuration.usesStandardTable()
            ? VerificationTransitions.standard()
            : TransitionTableLoader.load(configuration.getTableLocation());
        LOG.info("Using {}", transitionTable);

        switch (mode.toLowerCase(Locale.ROOT)) {
            case "demo":
                Preconditions.checkArgument(input == null && scanpaths == null,
                    "Demo mode takes no -input or -scanpath, use -mode classify");
                runDemo(transitionTable, out);
                break;
            case "classify":
                Preconditions.checkArgument(input != null || scanpaths != null,
                    "Classify mode needs -input or at least one -scanpath");
                runClassify(transitionTable, configuration, out);
                break;
            default:
                throw new IllegalArgumentException("Unknown mode: " + mode + ". Supported modes are: demo, classify");
        }
    }

    private void runDemo(TransitionTable transitionTable, PrintStream out) {
        AutomatonEngine engine = new AutomatonEngine(transitionTable);
        String rule = "=".repeat(60);
        out.println(rule);
        out.println("ECG Verification PDA - Demo");
        out.println(rule);

        printExample(engine, out, "[Example 1] Complete Verification (Expert)", "O R II P Q V ✓ ✓ O");
        printExample(engine, out, "[Example 2] No Verification (Novice)", "O R II P Q");
        printExample(engine, out, "[Example 3] Started Verification (Incomplete)", "O R II P Q V ✓");

        Scanpath deep = Scanpath.parse("O R II P Q S T");
        out.println();
        out.println("[Example 4] Deep Hierarchical Reasoning");
        out.println("Scanpath: " + deep);
        out.println("Max Stack Depth: " + engine.maxStackDepth(deep));
        out.println();
        out.println(rule);
    }

    private void printExample(AutomatonEngine engine, PrintStream out, String title, String text) {
        Scanpath scanpath = Scanpath.parse(text);
        out.println();
        out.println(title);
        out.println("Scanpath: " + scanpath);
        out.println("Accepted: " + engine.accepts(scanpath));
        out.println("Max Stack Depth: " + engine.maxStackDepth(scanpath));
        out.println(String.format(Locale.ROOT, "VCS Score: %.2f", engine.verificationCompletenessScore(scanpath)));
        if (trace) {
            printTrace(engine, scanpath, out);
        }
    }

    private void runClassify(TransitionTable transitionTable, ScanpathConfiguration configuration,
                             PrintStream out) throws IOException {
        Map<String, Scanpath> batch = new LinkedHashMap<>();
        if (input != null) {
            batch.putAll(ScanpathFileReader.read(Paths.get(input)));
        }
        if (scanpaths != null) {
            for (int i = 0; i < scanpaths.size(); i++) {
                String id = "arg" + (i + 1);
                Preconditions.checkArgument(!batch.containsKey(id), "Duplicate scanpath id %s", id);
                batch.put(id, Scanpath.parse(scanpaths.get(i)));
            }
        }

        ScanpathAnalyzer analyzer = new ScanpathAnalyzer(transitionTable);
        List<ScanpathAnalysis> analyses = analyzer.analyzeAll(batch);
        AutomatonEngine engine = trace ? new AutomatonEngine(transitionTable) : null;
        for (ScanpathAnalysis analysis : analyses) {
            out.println(String.format(Locale.ROOT, "%s\t%s\tdepth=%d\tvcs=%.2f\t%s",
                analysis.getId(), analysis.getOutcome(), analysis.getMaxStackDepth(),
                analysis.getVerificationCompletenessScore(), analysis.getScanpath()));
            if (engine != null) {
                printTrace(engine, analysis.getScanpath(), out);
            }
        }

        AnalysisSummary summary = AnalysisSummary.of(analyses);
        out.println(summary);

        if (configuration.getOutFolder() != null) {
            Path outPath = Paths.get(configuration.getOutFolder());
            Files.createDirectories(outPath);
            new CsvReportWriter(configuration.getCsvDelimiter()).write(analyses, outPath.resolve(RESULTS_FILE));
            JsonSummaryWriter.write(summary, outPath.resolve(SUMMARY_FILE).toFile());
        }
    }

    private void printTrace(AutomatonEngine engine, Scanpath scanpath, PrintStream out) {
        for (StepRecord record : engine.trace(scanpath)) {
            out.println("  " + record);
        }
    }
}
