// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import java.util.ArrayList;
import java.util.List;
import quire.assembly.ListHierarchy;
import quire.references.DownloadRegistry;
import quire.source.Cursor;
import quire.tree.Block;
import quire.tree.Header;
import quire.tree.Inline;
import quire.tree.Line;
import quire.tree.ListItem;
import quire.util.annotation.Nullable;
import quire.util.condition.ConditionContext;

/**
 * The block-level grammar, and the entry point for parsing the text of one file.
 * <p>
 * Sections are nested while parsing: after its header, a section parses blocks into itself until it meets a heading
 * no deeper than its own, an import, or input it cannot parse. Imports are only allowed outside sections, so an
 * import directive closes every open section before it is handled.
 */
public final class BlockGrammar extends LineGrammar {
    /**
     * Initializes a new grammar reading from the given cursor.
     *
     * @param downloads Receives the images found in the text.
     * @param importer  Handles the import directives found in the text.
     */
    public BlockGrammar(final Cursor cursor, final DownloadRegistry downloads, final ImportDirectiveHandler importer) {
        super(cursor, downloads);
        this.importer = importer;
    }

    /**
     * Parses blocks until the end of input.
     * <p>
     * If some input cannot be parsed as any block, a {@link BlockParseErrorCondition} is signaled and the rest of the
     * input is skipped; the blocks parsed up to that point are still returned.
     */
    public List<Block> parseAll() {
        final var blocks = new ArrayList<Block>();
        while (true) {
            if (parseBlock(Scope.topLevel()) instanceof Outcome.Parsed parsed) {
                blocks.add(parsed.block());
                continue;
            }
            skipBlankLines();
            if (!cursor.atEnd()) {
                ConditionContext.signal(new BlockParseErrorCondition("Unable to parse block", cursor.location()));
            }
            return blocks;
        }
    }

    @Override
    Outcome parseBlock(final Scope scope) {
        skipBlankLines();
        if (cursor.atEnd() || cursor.checkAny(scope.blockBreaks())) {
            return Outcome.noMatch;
        }

        final var section = parseSection(scope);
        if (!(section instanceof Outcome.NoMatch)) {
            return section;
        }
        final var list = parseList(scope);
        if (list != null) {
            return new Outcome.Parsed(list);
        }
        final var table = parseTable(scope);
        if (table != null) {
            return new Outcome.Parsed(table);
        }
        final var code = parseFenced(Tokens.codeFence);
        if (code != null) {
            final var language = code.get(0).trim();
            return new Outcome.Parsed(new Block.CodeBlock(language, code.get(1)));
        }
        final var math = parseFenced(Tokens.mathFence);
        if (math != null) {
            return new Outcome.Parsed(new Block.MathBlock((math.get(0) + math.get(1)).trim()));
        }
        final var quote = parseQuote(scope);
        if (quote != null) {
            return new Outcome.Parsed(quote);
        }
        final var importOutcome = parseImport(scope);
        if (!(importOutcome instanceof Outcome.NoMatch)) {
            return importOutcome;
        }
        final var placeholder = parsePlaceholderBlock();
        if (placeholder != null) {
            return new Outcome.Parsed(placeholder);
        }
        final var paragraph = parseParagraph(scope);
        if (paragraph != null) {
            return new Outcome.Parsed(paragraph);
        }
        return Outcome.noMatch;
    }

    private Outcome parseSection(final Scope scope) {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        var size = 0;
        while (cursor.matchChar(Tokens.hash)) {
            size += 1;
        }
        if (size == 0) {
            cursor.rewind(start);
            return Outcome.noMatch;
        }
        final var metadata = parseMetadata();
        if (cursor.skipInlineWhitespace() == 0) {
            cursor.rewind(start);
            return Outcome.noMatch;
        }
        if (size <= scope.sectionSize()) {
            cursor.rewind(start);
            return Outcome.closeSection;
        }

        final var titleStart = cursor.mark();
        final var title = parseLine(scope);
        if (title == null) {
            cursor.rewind(start);
            return Outcome.noMatch;
        }
        final var anchor = cursor.slice(titleStart, cursor.mark()).replaceAll("\\s", "");
        final var section = new Block.Section(size, new Header(title, anchor), metadata);

        final var childScope = scope.withSection(size);
        while (parseBlock(childScope) instanceof Outcome.Parsed parsed) {
            section.append(parsed.block());
        }
        return new Outcome.Parsed(section);
    }

    private Block.@Nullable ListBlock parseList(final Scope scope) {
        final var items = new ArrayList<ListItem>();
        while (true) {
            final var item = parseListItem(scope);
            if (item == null) {
                break;
            }
            items.add(item);
        }
        if (items.isEmpty()) {
            return null;
        }
        return new Block.ListBlock(items.get(0).isOrdered(), ListHierarchy.build(items));
    }

    /**
     * Parses a list item: indentation, a marker, whitespace and a line of text. The marker is one of
     * {@code - + * o}, a single digit, or digits followed by a period.
     */
    private @Nullable ListItem parseListItem(final Scope scope) {
        final var start = cursor.mark();
        final var level = cursor.skipInlineWhitespace();
        var ordered = false;
        if (cursor.matchAny(Tokens.listMarkers) == null) {
            var digits = 0;
            while (!cursor.atEnd() && isDigit(cursor.current())) {
                cursor.advance();
                digits += 1;
            }
            final var period = cursor.matchChar(Tokens.listOrderedSuffix);
            if (digits == 0 || (digits > 1 && !period)) {
                cursor.rewind(start);
                return null;
            }
            ordered = true;
        }
        if (cursor.skipInlineWhitespace() == 0 || cursor.checkChar('-')) {
            cursor.rewind(start);
            return null;
        }
        final var text = parseLine(scope);
        if (text == null) {
            cursor.rewind(start);
            return null;
        }
        return new ListItem(text, level, ordered);
    }

    private Block.@Nullable Table parseTable(final Scope scope) {
        final var header = parseRow(scope);
        if (header == null) {
            return null;
        }
        if (!parseSeparatorRow()) {
            return new Block.Table(header, List.of());
        }
        final var rows = new ArrayList<Block.Table.Row>();
        while (true) {
            final var row = parseRow(scope);
            if (row == null) {
                break;
            }
            rows.add(row);
        }
        return new Block.Table(header, rows);
    }

    private Block.Table.@Nullable Row parseRow(final Scope scope) {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        if (!cursor.matchChar(Tokens.pipe) || cursor.checkChar(Tokens.pipe)) {
            cursor.rewind(start);
            return null;
        }
        final var cellScope = scope.withInlineBreak(Tokens.pipe);
        final var cells = new ArrayList<Line>();
        while (true) {
            cursor.skipInlineWhitespace();
            if (cursor.atEnd() || cursor.checkLinebreak()) {
                break;
            }
            final var parts = new ArrayList<Inline>();
            while (true) {
                final var inline = parseInline(cellScope);
                if (inline == null) {
                    break;
                }
                parts.add(inline);
            }
            cells.add(new Line.Text(trimTrailingWhitespace(parts)));
            if (!cursor.matchChar(Tokens.pipe)) {
                break;
            }
        }
        if (cells.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        cursor.skipToLinebreak();
        cursor.matchChar(Tokens.linebreak);
        return new Block.Table.Row(cells);
    }

    /**
     * Parses a row such as {@code |---|:-:|}, consisting only of pipes, dashes, colons and whitespace.
     */
    private boolean parseSeparatorRow() {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        if (!cursor.checkChar(Tokens.pipe) && !cursor.checkChar('-')) {
            cursor.rewind(start);
            return false;
        }
        var dashes = 0;
        while (!cursor.atEnd() && !cursor.checkLinebreak()) {
            final var c = cursor.current();
            if (c == '-') {
                dashes += 1;
            } else if (c != Tokens.pipe && c != ':' && Tokens.inlineWhitespace.indexOf(c) < 0) {
                cursor.rewind(start);
                return false;
            }
            cursor.advance();
        }
        if (dashes == 0) {
            cursor.rewind(start);
            return false;
        }
        cursor.matchChar(Tokens.linebreak);
        return true;
    }

    /**
     * Parses a block between two occurrences of {@code fence}, the first at the start of a line.
     *
     * @return The text on the line of the opening fence and the content up to the closing fence, or {@code null}.
     */
    private @Nullable List<String> parseFenced(final String fence) {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        if (!cursor.matchSequence(fence)) {
            cursor.rewind(start);
            return null;
        }
        final var sameLine = cursor.scanUntilSequence(fence, "\n");
        if (sameLine != null) {
            cursor.matchSequence(fence);
            cursor.skipToLinebreak();
            cursor.matchChar(Tokens.linebreak);
            return List.of("", sameLine);
        }
        final var firstLine = cursor.scanUntil("\n", "");
        if (firstLine == null) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        final var content = cursor.scanUntilSequence(fence, "");
        if (content == null) {
            cursor.rewind(start);
            return null;
        }
        cursor.matchSequence(fence);
        cursor.skipToLinebreak();
        cursor.matchChar(Tokens.linebreak);
        final var trimmed = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        return List.of(firstLine, trimmed);
    }

    private Block.@Nullable Quote parseQuote(final Scope scope) {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        final var metadata = parseMetadata();
        if (metadata != null) {
            cursor.skipInlineWhitespace();
            cursor.matchChar(Tokens.linebreak);
        }
        final var lines = new ArrayList<Line>();
        while (true) {
            final var lineStart = cursor.mark();
            cursor.skipInlineWhitespace();
            if (!cursor.matchChar(Tokens.quoteStart) || !(cursor.checkAny(Tokens.inlineWhitespace)
                || cursor.checkLinebreak())) {
                cursor.rewind(lineStart);
                break;
            }
            cursor.skipInlineWhitespace();
            final var text = parseTextLine(scope);
            if (text == null) {
                break;
            }
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        if (lines.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        return new Block.Quote(metadata, lines);
    }

    private Outcome parseImport(final Scope scope) {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        if (!cursor.matchSequence(Tokens.importStart)) {
            cursor.rewind(start);
            return Outcome.noMatch;
        }
        final var path = cursor.scanUntil(String.valueOf(Tokens.metadataClose), "\n");
        if (path == null || path.isBlank() || scope.templateVariables()) {
            cursor.rewind(start);
            return Outcome.noMatch;
        }
        if (scope.sectionSize() > 0) {
            cursor.rewind(start);
            return Outcome.closeSection;
        }
        cursor.advance();
        final var metadata = parseMetadata();
        cursor.skipToLinebreak();
        cursor.matchChar(Tokens.linebreak);
        return new Outcome.Parsed(importer.handle(path.trim(), metadata, cursor.location(start)));
    }

    private Block.@Nullable PlaceholderBlock parsePlaceholderBlock() {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        final var placeholder = parsePlaceholder();
        if (placeholder == null) {
            cursor.rewind(start);
            return null;
        }
        cursor.skipInlineWhitespace();
        if (!cursor.matchChar(Tokens.linebreak) && !cursor.atEnd()) {
            cursor.rewind(start);
            return null;
        }
        return new Block.PlaceholderBlock(placeholder);
    }

    /**
     * Parses consecutive lines up to a blank line or a line that starts another block.
     */
    private Block.@Nullable Paragraph parseParagraph(final Scope scope) {
        final var start = cursor.mark();
        final var lines = new ArrayList<Line>();
        while (!cursor.atEnd()) {
            if (!lines.isEmpty() && (atBlankLine() || startsOtherBlock(scope))) {
                break;
            }
            final var line = parseLine(scope);
            if (line == null || (line instanceof Line.Text text && text.isEmpty())) {
                break;
            }
            lines.add(line);
        }
        if (lines.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        return new Block.Paragraph(lines);
    }

    private boolean startsOtherBlock(final Scope scope) {
        final var start = cursor.mark();
        try {
            cursor.skipInlineWhitespace();
            if (cursor.checkAny(scope.blockBreaks()) || cursor.checkAnySequence(Tokens.blockStarts)) {
                return true;
            }
            cursor.rewind(start);
            return parseListItem(scope) != null || parsePlaceholderBlock() != null;
        } finally {
            cursor.rewind(start);
        }
    }

    private boolean atBlankLine() {
        final var start = cursor.mark();
        cursor.skipInlineWhitespace();
        final var blank = cursor.atEnd() || cursor.checkLinebreak();
        cursor.rewind(start);
        return blank;
    }

    private void skipBlankLines() {
        while (true) {
            final var lineStart = cursor.mark();
            cursor.skipInlineWhitespace();
            if (!cursor.matchChar(Tokens.linebreak)) {
                cursor.rewind(lineStart);
                return;
            }
        }
    }

    private static List<Inline> trimTrailingWhitespace(final List<Inline> parts) {
        if (parts.isEmpty() || !(parts.get(parts.size() - 1) instanceof Inline.Plain plain)) {
            return parts;
        }
        final var trimmed = plain.value().stripTrailing();
        final var result = new ArrayList<>(parts.subList(0, parts.size() - 1));
        if (!trimmed.isEmpty()) {
            result.add(new Inline.Plain(trimmed));
        }
        return result;
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private final ImportDirectiveHandler importer;
}
