package gr.imsi.athenarc.scanpath.domain;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * An ordered, finite sequence of input symbols recorded while reading an ECG.
 */
public final class Scanpath implements Iterable<String> {

    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace())
        .omitEmptyStrings()
        .trimResults();

    private static final Scanpath EMPTY = new Scanpath(ImmutableList.of());

    private final ImmutableList<String> symbols;

    private Scanpath(ImmutableList<String> symbols) {
        this.symbols = symbols;
    }

    /**
     * Tokenizes whitespace-delimited text. Blank text gives an empty scanpath.
     */
    public static Scanpath parse(String text) {
        Preconditions.checkNotNull(text, "Scanpath text cannot be null");
        return new Scanpath(ImmutableList.copyOf(WHITESPACE.split(text)));
    }

    /**
     * Wraps an already tokenized sequence. No tokenization is applied.
     */
    public static Scanpath of(List<String> symbols) {
        Preconditions.checkNotNull(symbols, "Scanpath symbols cannot be null");
        return new Scanpath(ImmutableList.copyOf(symbols));
    }

    public static Scanpath of(String... symbols) {
        return new Scanpath(ImmutableList.copyOf(symbols));
    }

    public static Scanpath empty() {
        return EMPTY;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public String get(int index) {
        return symbols.get(index);
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /** Number of occurrences of {@code symbol} in the raw sequence. */
    public int count(String symbol) {
        int count = 0;
        for (String s : symbols) {
            if (s.equals(symbol)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Iterator<String> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scanpath other = (Scanpath) o;
        return symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols);
    }

    @Override
    public String toString() {
        return Joiner.on(' ').join(symbols);
    }
}
