package gr.imsi.athenarc.scanpath.pda;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

import gr.imsi.athenarc.scanpath.domain.StackSymbol;
import gr.imsi.athenarc.scanpath.domain.State;

/**
 * Loads a transition table from a properties file.
 *
 * <pre>
 * initial=Q0
 * accepting=Q6
 * bottom=Z0
 * transition.Q1.R.Z0=Q2:Z0,Rm
 * transition.Q5.✓.Fm=Q5:
 * </pre>
 *
 * A transition key is {@code transition.<state>.<symbol>.<stack top>}; the value is the next
 * state and the bottom-first replacement separated by a colon. Files are read as UTF-8.
 */
public class TransitionTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TransitionTableLoader.class);

    static final String TRANSITION_PREFIX = "transition.";

    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

    /**
     * Load a table from a file, falling back to the classpath when no such file exists.
     *
     * @throws IOException if neither the file nor the classpath resource can be read
     */
    public static TransitionTable load(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.exists(path)) {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                TransitionTable table = fromReader(reader);
                LOG.info("Loaded {} transitions from: {}", table.size(), location);
                return table;
            }
        }
        String resource = location.startsWith("/") ? location : "/" + location;
        try (InputStream is = TransitionTableLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Transition table not found: " + location);
            }
            TransitionTable table = fromReader(new InputStreamReader(is, StandardCharsets.UTF_8));
            LOG.info("Loaded {} transitions from classpath: {}", table.size(), location);
            return table;
        }
    }

    public static TransitionTable fromReader(Reader reader) throws IOException {
        Properties properties = new Properties();
        properties.load(reader);
        return fromProperties(properties);
    }

    /**
     * @throws TransitionTableException if an entry cannot be parsed or two entries share a key
     */
    public static TransitionTable fromProperties(Properties properties) {
        TransitionTable.Builder builder = TransitionTable.builder();

        String initial = properties.getProperty("initial");
        if (initial == null || initial.isBlank()) {
            throw new TransitionTableException("Missing property: initial");
        }
        builder.initialState(parseState("initial", initial));

        String accepting = properties.getProperty("accepting");
        if (accepting == null || accepting.isBlank()) {
            throw new TransitionTableException("Missing property: accepting");
        }
        for (String state : COMMA.split(accepting)) {
            builder.acceptingState(parseState("accepting", state));
        }

        String bottom = properties.getProperty("bottom");
        if (bottom != null && !bottom.isBlank()) {
            builder.initialStackSymbol(parseStackSymbol("bottom", bottom));
        }

        // sorted, so duplicate errors come out in a stable order
        int count = 0;
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            if (!key.startsWith(TRANSITION_PREFIX)) {
                continue;
            }
            builder.add(parseKey(key), parseRule(key, properties.getProperty(key)));
            count++;
        }
        LOG.debug("Parsed {} transition entries", count);
        return builder.build();
    }

    static TransitionKey parseKey(String key) {
        String body = key.substring(TRANSITION_PREFIX.length());
        int first = body.indexOf('.');
        int last = body.lastIndexOf('.');
        if (first <= 0 || last <= first + 1 || last == body.length() - 1) {
            throw new TransitionTableException("Invalid transition key: " + key);
        }
        State state = parseState(key, body.substring(0, first));
        String symbol = body.substring(first + 1, last);
        StackSymbol top = parseStackSymbol(key, body.substring(last + 1));
        return new TransitionKey(state, symbol, top);
    }

    static TransitionRule parseRule(String key, String value) {
        int colon = value.indexOf(':');
        if (colon < 0) {
            throw new TransitionTableException("Invalid transition value for " + key + ": " + value
                + " (expected <state>:<symbols>)");
        }
        State next = parseState(key, value.substring(0, colon));
        List<StackSymbol> replacement = new ArrayList<>();
        for (String code : COMMA.split(value.substring(colon + 1))) {
            replacement.add(parseStackSymbol(key, code));
        }
        return new TransitionRule(next, replacement);
    }

    private static State parseState(String key, String value) {
        try {
            return State.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new TransitionTableException("Invalid state in " + key + ": " + value, e);
        }
    }

    private static StackSymbol parseStackSymbol(String key, String value) {
        try {
            return StackSymbol.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TransitionTableException("Invalid stack symbol in " + key + ": " + value, e);
        }
    }
}
