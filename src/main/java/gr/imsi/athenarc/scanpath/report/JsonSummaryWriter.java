package gr.imsi.athenarc.scanpath.report;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import gr.imsi.athenarc.scanpath.analysis.AnalysisSummary;

public class JsonSummaryWriter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSummaryWriter.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static void write(AnalysisSummary summary, File outFile) throws IOException {
        mapper.writeValue(outFile, summary);
        LOG.info("Summary written to: {}", outFile.getAbsolutePath());
    }

    public static String toJson(AnalysisSummary summary) throws IOException {
        return mapper.writeValueAsString(summary);
    }
}
