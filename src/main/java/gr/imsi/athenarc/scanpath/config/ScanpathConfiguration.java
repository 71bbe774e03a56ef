package gr.imsi.athenarc.scanpath.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for a classification run, read from {@code application.properties}.
 * Command-line flags override these values.
 */
public class ScanpathConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(ScanpathConfiguration.class);

    public static final String TABLE_PROPERTY = "pda.table";
    public static final String OUT_PROPERTY = "report.out";
    public static final String DELIMITER_PROPERTY = "report.csv.delimiter";

    private final String tableLocation;
    private final String outFolder;
    private final char csvDelimiter;

    private ScanpathConfiguration(Builder builder) {
        this.tableLocation = builder.tableLocation;
        this.outFolder = builder.outFolder;
        this.csvDelimiter = builder.csvDelimiter;
    }

    /** Table file to load, or null for the built-in table. */
    public String getTableLocation() { return tableLocation; }
    /** Folder for report files, or null when reports are not written. */
    public String getOutFolder() { return outFolder; }
    public char getCsvDelimiter() { return csvDelimiter; }

    public boolean usesStandardTable() {
        return tableLocation == null;
    }

    public Builder toBuilder() {
        return new Builder()
            .tableLocation(tableLocation)
            .outFolder(outFolder)
            .csvDelimiter(csvDelimiter);
    }

    /**
     * Reads {@code /application.properties} from the classpath. A missing file gives the defaults.
     *
     * @throws IOException if the file exists but cannot be read
     */
    public static ScanpathConfiguration load() throws IOException {
        Properties properties = new Properties();
        try (InputStream input = ScanpathConfiguration.class.getResourceAsStream("/application.properties")) {
            if (input == null) {
                LOG.warn("Unable to find application.properties in resources, using defaults.");
                return new Builder().build();
            }
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
        }
        return fromProperties(properties);
    }

    public static ScanpathConfiguration fromProperties(Properties properties) {
        Builder builder = new Builder()
            .tableLocation(properties.getProperty(TABLE_PROPERTY));
        String out = properties.getProperty(OUT_PROPERTY);
        if (out != null && !out.isBlank()) {
            builder.outFolder(out.trim());
        }
        String delimiter = properties.getProperty(DELIMITER_PROPERTY);
        if (delimiter != null && !delimiter.isEmpty()) {
            if (delimiter.length() != 1) {
                throw new IllegalArgumentException(DELIMITER_PROPERTY + " must be a single character: " + delimiter);
            }
            builder.csvDelimiter(delimiter.charAt(0));
        }
        return builder.build();
    }

    public static class Builder {
        private String tableLocation;
        private String outFolder;
        private char csvDelimiter = ',';

        public Builder tableLocation(String tableLocation) {
            this.tableLocation = tableLocation == null || tableLocation.isBlank() ? null : tableLocation.trim();
            return this;
        }
        public Builder outFolder(String outFolder) { this.outFolder = outFolder; return this; }
        public Builder csvDelimiter(char csvDelimiter) { this.csvDelimiter = csvDelimiter; return this; }

        public ScanpathConfiguration build() {
            return new ScanpathConfiguration(this);
        }
    }
}
