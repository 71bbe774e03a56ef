package gr.imsi.athenarc.scanpath.report;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.scanpath.domain.Scanpath;

/**
 * Reads a batch of scanpaths, one per line. A line may start with an id followed by a tab;
 * otherwise its 1-based line number is used as id. Blank lines and {@code #} comments are skipped.
 */
public class ScanpathFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(ScanpathFileReader.class);

    public static Map<String, Scanpath> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Scanpath> scanpaths = read(reader);
            LOG.info("Read {} scanpaths from: {}", scanpaths.size(), path);
            return scanpaths;
        }
    }

    public static Map<String, Scanpath> read(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        Map<String, Scanpath> scanpaths = new LinkedHashMap<>();
        String line;
        int lineNumber = 0;
        while ((line = buffered.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String id = String.valueOf(lineNumber);
            String text = line;
            int tab = line.indexOf('\t');
            if (tab >= 0) {
                id = line.substring(0, tab).strip();
                text = line.substring(tab + 1);
            }
            Preconditions.checkArgument(!id.isEmpty(), "Empty scanpath id at line %s", lineNumber);
            Preconditions.checkArgument(!scanpaths.containsKey(id),
                "Duplicate scanpath id %s at line %s", id, lineNumber);
            scanpaths.put(id, Scanpath.parse(text));
        }
        return scanpaths;
    }
}
