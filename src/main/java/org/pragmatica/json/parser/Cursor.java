package org.pragmatica.json.parser;

import org.pragmatica.json.tree.SourceLocation;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable view over the unparsed rest of a text.
 *
 * <p>Consuming input never changes a cursor; it derives a new one. Holding on to an
 * earlier cursor is all that backtracking needs. Offsets are UTF-16 indexes into
 * the original text and only ever move by whole code points.
 */
public final class Cursor {

    private final String text;
    private final int offset;
    private final int depth;

    private Cursor(String text, int offset, int depth) {
        this.text = text;
        this.offset = offset;
        this.depth = depth;
    }

    public static Cursor of(String text) {
        return new Cursor(Objects.requireNonNull(text, "text"), 0, 0);
    }

    // === Position ===

    public int offset() {
        return offset;
    }

    public boolean isAtEnd() {
        return offset >= text.length();
    }

    public SourceLocation location() {
        return SourceLocation.locate(text, offset);
    }

    // === Character Access ===

    /**
     * Next code point, without consuming it.
     */
    public OptionalInt peek() {
        return isAtEnd()
               ? OptionalInt.empty()
               : OptionalInt.of(text.codePointAt(offset));
    }

    /**
     * Cursor {@code n} code points further, or empty if fewer than {@code n} remain.
     */
    public Optional<Cursor> advance(int n) {
        if (n < 0) {
            return Optional.empty();
        }
        int position = offset;
        for (int i = 0; i < n; i++) {
            if (position >= text.length()) {
                return Optional.empty();
            }
            position += Character.charCount(text.codePointAt(position));
        }
        return Optional.of(new Cursor(text, position, depth));
    }

    /**
     * Cursor past {@code prefix} if the remaining text starts with it.
     */
    public Optional<Cursor> skip(String prefix) {
        return text.startsWith(prefix, offset)
               ? Optional.of(new Cursor(text, offset + prefix.length(), depth))
               : Optional.empty();
    }

    public String remaining() {
        return text.substring(offset);
    }

    /**
     * Text consumed between {@code start} and this cursor.
     */
    public String consumedSince(Cursor start) {
        return text.substring(start.offset, offset);
    }

    // === Nesting ===

    public int depth() {
        return depth;
    }

    public Cursor enter() {
        return new Cursor(text, offset, depth + 1);
    }

    public Cursor leave() {
        return new Cursor(text, offset, depth - 1);
    }

    @Override
    public String toString() {
        var rest = remaining();
        return "Cursor@" + offset + "[" + (rest.length() > 16 ? rest.substring(0, 16) + "..." : rest) + "]";
    }
}
