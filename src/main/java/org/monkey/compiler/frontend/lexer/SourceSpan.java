package org.monkey.compiler.frontend.lexer;

import java.util.Objects;

/**
 * A read-only view of a region of the source text.
 * <p>
 * Tokens carry their lexeme as a span instead of a copied string, so scanning an identifier
 * allocates nothing for its text. The span keeps a reference to the whole source; callers that
 * hold on to tokens keep the source reachable for as long as they do.
 */
public final class SourceSpan implements CharSequence {

    private final String source;
    private final int start;
    private final int end;

    private SourceSpan(String source, int start, int end) {
        this.source = source;
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a span over {@code source} from {@code start} (inclusive) to {@code end} (exclusive).
     *
     * @param source The complete source text.
     * @param start  The offset of the first character.
     * @param end    The offset just past the last character.
     * @return The span.
     * @throws IndexOutOfBoundsException if the range does not lie within the source.
     */
    public static SourceSpan of(String source, int start, int end) {
        Objects.requireNonNull(source, "source");
        Objects.checkFromToIndex(start, end, source.length());
        return new SourceSpan(source, start, end);
    }

    /** @return The source text this span points into. */
    public String source() {
        return source;
    }

    /** @return The offset of the first character of the span. */
    public int start() {
        return start;
    }

    /** @return The offset just past the last character of the span. */
    public int end() {
        return end;
    }

    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public int length() {
        return end - start;
    }

    @Override
    public char charAt(int index) {
        Objects.checkIndex(index, length());
        return source.charAt(start + index);
    }

    @Override
    public SourceSpan subSequence(int from, int to) {
        Objects.checkFromToIndex(from, to, length());
        return new SourceSpan(source, start + from, start + to);
    }

    /**
     * Compares the characters of this span with another character sequence.
     *
     * @param other The sequence to compare with.
     * @return {@code true} if both contain the same characters.
     */
    public boolean contentEquals(CharSequence other) {
        if (other == null || other.length() != length()) {
            return false;
        }
        for (int i = 0; i < length(); i++) {
            if (source.charAt(start + i) != other.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan other)) return false;
        return length() == other.length()
                && source.regionMatches(start, other.source, other.start, length());
    }

    /**
     * Same value as {@code toString().hashCode()}, computed without materializing the text.
     */
    @Override
    public int hashCode() {
        int h = 0;
        for (int i = start; i < end; i++) {
            h = 31 * h + source.charAt(i);
        }
        return h;
    }

    @Override
    public String toString() {
        return source.substring(start, end);
    }
}
