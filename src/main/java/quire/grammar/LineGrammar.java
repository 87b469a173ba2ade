// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import quire.references.DownloadRegistry;
import quire.source.Cursor;
import quire.tree.BibEntry;
import quire.tree.Inline;
import quire.tree.Line;
import quire.util.annotation.Nullable;

/**
 * The rules for whole lines: rulers, centered lines, bibliography definitions and lines of text.
 */
abstract sealed class LineGrammar extends InlineGrammar permits BlockGrammar {
    LineGrammar(final Cursor cursor, final DownloadRegistry downloads) {
        super(cursor, downloads);
    }

    /**
     * Parses one line, consuming its line feed if the line ends there.
     *
     * @return The line, or {@code null} at the end of input.
     */
    final @Nullable Line parseLine(final Scope scope) {
        if (cursor.atEnd()) {
            return null;
        }
        final var ruler = parseRuler();
        if (ruler != null) {
            return ruler;
        }
        final var centered = parseCentered(scope);
        if (centered != null) {
            return centered;
        }
        final var bibEntry = parseBibEntry();
        if (bibEntry != null) {
            return bibEntry;
        }
        return parseTextLine(scope);
    }

    private @Nullable Line parseRuler() {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        if (!cursor.matchSequence(Tokens.ruler)) {
            cursor.rewind(start);
            return null;
        }
        cursor.skipToLinebreak();
        cursor.matchChar(Tokens.linebreak);
        return new Line.Ruler();
    }

    private @Nullable Line parseCentered(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchSequence(Tokens.centered)) {
            return null;
        }
        cursor.skipInlineWhitespace();
        final var text = parseTextLine(scope);
        if (text == null || text.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        return new Line.Centered(text);
    }

    /**
     * Parses {@code [key]: url} or {@code [key]: [field=value, ...]}.
     */
    private @Nullable Line parseBibEntry() {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        if (!cursor.matchChar(Tokens.metadataOpen)) {
            cursor.rewind(start);
            return null;
        }
        final var key = cursor.scanUntil(String.valueOf(Tokens.metadataClose), " \n");
        if (key == null || key.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        if (!cursor.matchChar(Tokens.bibEntryData)) {
            cursor.rewind(start);
            return null;
        }
        cursor.skipInlineWhitespace();
        final var fields = new LinkedHashMap<String, String>();
        final var metadata = parseMetadata();
        if (metadata != null) {
            metadata.entries().forEach((name, value) -> fields.put(name, value.asText()));
        } else {
            final var url = cursor.scanUntil("\n", "");
            if (url == null || url.isBlank()) {
                cursor.rewind(start);
                return null;
            }
            fields.put(BibEntry.urlField, url.trim());
        }
        cursor.skipToLinebreak();
        cursor.matchChar(Tokens.linebreak);
        return new Line.BibEntryLine(new BibEntry(key, fields));
    }

    /**
     * Parses a line of formatted text, consuming its line feed if the text ends there. The text also ends before a
     * break character of the scope, which is left unconsumed.
     *
     * @return The line, possibly empty, or {@code null} at the end of input.
     */
    final Line.@Nullable Text parseTextLine(final Scope scope) {
        if (cursor.atEnd()) {
            return null;
        }
        final var parts = new ArrayList<Inline>();
        while (true) {
            final var inline = parseInline(scope);
            if (inline == null) {
                break;
            }
            parts.add(inline);
        }
        cursor.matchChar(Tokens.linebreak);
        return new Line.Text(parts);
    }
}
