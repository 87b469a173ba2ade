// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import quire.grammar.BlockGrammar;
import quire.parser.Parser;
import quire.parser.ParserOptions;
import quire.references.DownloadRegistry;
import quire.source.Cursor;
import quire.tree.Block;
import quire.tree.Document;
import quire.tree.Inline;
import quire.tree.Line;
import static org.assertj.core.api.Assertions.assertThat;

final class ParseSupport {
    private ParseSupport() {
    }

    static ParserOptions options() {
        return ParserOptions.defaults().withAutoIncludes(false).withClock(fixedClock);
    }

    static Document parseText(final String text) {
        return Parser.parseText(text, options());
    }

    /**
     * Runs only the grammar, with imports replaced by nothing.
     */
    static List<Block> parseBlocks(final String text) {
        final var grammar = new BlockGrammar(
            new Cursor(text, null),
            new DownloadRegistry(),
            (path, metadata, location) -> Block.Null.INSTANCE
        );
        return grammar.parseAll();
    }

    /**
     * Parses a single line of text and returns its inline elements.
     */
    static List<Inline> parseInlines(final String line) {
        final var blocks = parseBlocks(line);
        assertThat(blocks).hasSize(1).first().isInstanceOf(Block.Paragraph.class);
        final var paragraph = (Block.Paragraph) blocks.get(0);
        assertThat(paragraph.lines()).hasSize(1).first().isInstanceOf(Line.Text.class);
        return ((Line.Text) paragraph.lines().get(0)).parts();
    }

    /**
     * Concatenates the plain text of the given inline elements, descending into formatting.
     */
    static String plainText(final List<Inline> inlines) {
        final var builder = new StringBuilder();
        for (final var inline : inlines) {
            if (inline instanceof Inline.Plain plain) {
                builder.append(plain.value());
            } else if (inline instanceof Inline.Bold bold) {
                builder.append(plainText(bold.value()));
            } else if (inline instanceof Inline.Italic italic) {
                builder.append(plainText(italic.value()));
            } else if (inline instanceof Inline.Underlined underlined) {
                builder.append(plainText(underlined.value()));
            } else if (inline instanceof Inline.Striked striked) {
                builder.append(plainText(striked.value()));
            }
        }
        return builder.toString();
    }

    static String lineText(final Line line) {
        assertThat(line).isInstanceOf(Line.Text.class);
        return plainText(((Line.Text) line).parts());
    }

    static final Clock fixedClock = Clock.fixed(Instant.parse("2021-03-04T05:06:07Z"), ZoneOffset.UTC);
}
