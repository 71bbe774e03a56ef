package gr.imsi.athenarc.scanpath.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.scanpath.analysis.ScanpathAnalysis;

/**
 * Writes one CSV row per analysed scanpath.
 */
public class CsvReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvReportWriter.class);

    static final String[] HEADERS = {"id", "scanpath", "accepted", "outcome", "final_state",
        "max_stack_depth", "vcs", "consumed"};

    private final char delimiter;

    public CsvReportWriter() {
        this(',');
    }

    public CsvReportWriter(char delimiter) {
        this.delimiter = delimiter;
    }

    public void write(List<ScanpathAnalysis> analyses, Path outFile) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
            write(analyses, writer);
        }
        LOG.info("Wrote {} rows to: {}", analyses.size(), outFile);
    }

    public void write(List<ScanpathAnalysis> analyses, Writer writer) {
        CsvWriterSettings csvWriterSettings = new CsvWriterSettings();
        csvWriterSettings.getFormat().setDelimiter(delimiter);
        CsvWriter csvWriter = new CsvWriter(writer, csvWriterSettings);

        csvWriter.writeHeaders(HEADERS);
        for (ScanpathAnalysis analysis : analyses) {
            csvWriter.addValue(analysis.getId());
            csvWriter.addValue(analysis.getScanpath().toString());
            csvWriter.addValue(analysis.isAccepted());
            csvWriter.addValue(analysis.getOutcome());
            csvWriter.addValue(analysis.getFinalState());
            csvWriter.addValue(analysis.getMaxStackDepth());
            csvWriter.addValue(analysis.getVerificationCompletenessScore());
            csvWriter.addValue(analysis.getConsumed());
            csvWriter.writeValuesToRow();
        }
        csvWriter.flush();
    }
}
