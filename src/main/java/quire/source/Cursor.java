// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.source;

import java.nio.file.Path;
import java.util.List;
import quire.util.annotation.Nullable;

/**
 * A backtracking reader over the whole text of one source file.
 * <p>
 * The text is held in memory in its entirety, so any position can be saved with {@link #mark()} and returned to with
 * {@link #rewind(int)}. Grammar rules rely on this: each rule marks the position, attempts to match, and rewinds on
 * failure so that the next alternative starts from the same place.
 * <p>
 * A character preceded by an odd number of backslashes is <dfn>escaped</dfn>. The {@code check} and {@code match}
 * methods never treat an escaped character as special.
 */
public final class Cursor {
    /**
     * Initializes a cursor over the given text, positioned at its start.
     * <p>
     * Windows line endings are normalized to line feeds, and a final line feed is appended if the text lacks one, so
     * that every line, including the last, is terminated.
     *
     * @param path The file the text was read from, used in source locations. May be {@code null}.
     */
    public Cursor(final String text, final @Nullable Path path) {
        final var normalized = text.replace("\r\n", "\n");
        this.text = normalized.endsWith("\n") ? normalized : (normalized + '\n');
        this.path = path;
    }

    /**
     * Returns the source file this cursor reads, if any.
     */
    public @Nullable Path path() {
        return path;
    }

    /**
     * Returns the current position, to be passed to {@link #rewind(int)} later.
     */
    public int mark() {
        return index;
    }

    /**
     * Moves back, or forward, to a position previously returned by {@link #mark()}.
     */
    public void rewind(final int mark) {
        assert mark >= 0 && mark <= text.length() : "Mark out of range: " + mark;
        index = mark;
    }

    /**
     * Returns {@code true} iff all input has been consumed.
     */
    public boolean atEnd() {
        return index >= text.length();
    }

    /**
     * Returns the character at the current position.
     *
     * @throws IndexOutOfBoundsException if the end of input has been reached.
     */
    public char current() {
        if (atEnd()) {
            throw new IndexOutOfBoundsException("Read past the end of input at " + location());
        }
        return text.charAt(index);
    }

    /**
     * Moves to the next character.
     *
     * @return {@code false} iff the cursor was already at the end of input, in which case it does not move.
     */
    public boolean advance() {
        if (atEnd()) {
            return false;
        }
        index += 1;
        return true;
    }

    /**
     * Returns {@code true} iff the current character is escaped by a backslash.
     */
    public boolean isEscaped() {
        return isEscapedAt(index);
    }

    /**
     * Returns {@code true} iff the current character is an unescaped {@code c}.
     */
    public boolean checkChar(final char c) {
        return !atEnd() && text.charAt(index) == c && !isEscapedAt(index);
    }

    /**
     * Consumes the current character if it is an unescaped {@code c}.
     */
    public boolean matchChar(final char c) {
        if (checkChar(c)) {
            index += 1;
            return true;
        }
        return false;
    }

    /**
     * Returns {@code true} iff the current character is an unescaped member of {@code chars}.
     */
    public boolean checkAny(final String chars) {
        return !atEnd() && chars.indexOf(text.charAt(index)) >= 0 && !isEscapedAt(index);
    }

    /**
     * Consumes the current character if it is an unescaped member of {@code chars}.
     *
     * @return The consumed character, or {@code null} if nothing was consumed.
     */
    public @Nullable Character matchAny(final String chars) {
        if (checkAny(chars)) {
            final var c = text.charAt(index);
            index += 1;
            return c;
        }
        return null;
    }

    /**
     * Returns {@code true} iff the input continues with {@code sequence}, with its first character unescaped.
     */
    public boolean checkSequence(final String sequence) {
        return text.startsWith(sequence, index) && !isEscapedAt(index);
    }

    /**
     * Consumes {@code sequence} if the input continues with it.
     */
    public boolean matchSequence(final String sequence) {
        if (checkSequence(sequence)) {
            index += sequence.length();
            return true;
        }
        return false;
    }

    /**
     * Returns {@code true} iff the input continues with any of the given sequences.
     */
    public boolean checkAnySequence(final List<String> sequences) {
        for (final var sequence : sequences) {
            if (checkSequence(sequence)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} iff the current character is a line feed.
     */
    public boolean checkLinebreak() {
        return !atEnd() && text.charAt(index) == '\n';
    }

    /**
     * Consumes characters up to, but not including, the first unescaped member of {@code stops}.
     * <p>
     * If a member of {@code errors} or the end of input comes first, the position is restored and {@code null} is
     * returned. Error characters are recognized whether escaped or not.
     *
     * @return The consumed text, possibly empty, or {@code null} on failure.
     */
    public @Nullable String scanUntil(final String stops, final String errors) {
        final var start = index;
        while (!atEnd()) {
            final var c = text.charAt(index);
            if (stops.indexOf(c) >= 0 && !isEscapedAt(index)) {
                return text.substring(start, index);
            }
            if (errors.indexOf(c) >= 0) {
                break;
            }
            index += 1;
        }
        index = start;
        return null;
    }

    /**
     * Consumes characters up to, but not including, the first unescaped occurrence of {@code stop}.
     * <p>
     * Fails like {@link #scanUntil(String, String)} if a member of {@code errors} or the end of input comes first.
     */
    public @Nullable String scanUntilSequence(final String stop, final String errors) {
        final var start = index;
        while (!atEnd()) {
            if (checkSequence(stop)) {
                return text.substring(start, index);
            }
            if (errors.indexOf(text.charAt(index)) >= 0) {
                break;
            }
            index += 1;
        }
        index = start;
        return null;
    }

    /**
     * Skips spaces, tabs and carriage returns.
     *
     * @return The number of characters skipped.
     */
    public int skipInlineWhitespace() {
        final var start = index;
        while (!atEnd() && inlineWhitespace.indexOf(text.charAt(index)) >= 0) {
            index += 1;
        }
        return index - start;
    }

    /**
     * Skips all whitespace, line feeds included.
     */
    public void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(index))) {
            index += 1;
        }
    }

    /**
     * Skips the rest of the current line, leaving the cursor on its line feed.
     */
    public void skipToLinebreak() {
        while (!atEnd() && text.charAt(index) != '\n') {
            index += 1;
        }
    }

    /**
     * Returns the text between two positions.
     */
    public String slice(final int from, final int to) {
        return text.substring(from, to);
    }

    /**
     * Returns the source location of the current position.
     */
    public SourceLocation location() {
        return location(index);
    }

    /**
     * Returns the source location of the given position.
     */
    public SourceLocation location(final int position) {
        final var clamped = Math.min(position, text.length());
        var line = 1;
        var lineStart = 0;
        for (var i = 0; i < clamped; i += 1) {
            if (text.charAt(i) == '\n') {
                line += 1;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(path, line, clamped - lineStart + 1);
    }

    private boolean isEscapedAt(final int position) {
        var backslashes = 0;
        for (var i = position - 1; i >= 0 && text.charAt(i) == escape; i -= 1) {
            backslashes += 1;
        }
        return backslashes % 2 == 1;
    }

    /**
     * The escape character.
     */
    public static final char escape = '\\';
    private static final String inlineWhitespace = " \t\r";

    private final String text;
    private final @Nullable Path path;
    private int index = 0;
}
