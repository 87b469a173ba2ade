// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import quire.util.annotation.Nullable;

/**
 * A top-level or section-level unit of a document.
 */
public sealed interface Block extends Element {
    /**
     * A titled region introduced by {@code #} markers.
     * <p>
     * The heading size is the number of markers; smaller sizes are shallower. In an assembled tree every section nested
     * in another has a strictly greater size, though not necessarily greater by exactly one.
     */
    final class Section implements Block {
        public Section(final int size, final Header header, final @Nullable Metadata metadata) {
            assert size >= 1 : "Section size must be positive";
            this.size = size;
            this.header = header;
            this.metadata = metadata;
        }

        public int size() {
            return size;
        }

        public Header header() {
            return header;
        }

        public @Nullable Metadata metadata() {
            return metadata;
        }

        public List<Block> children() {
            return Collections.unmodifiableList(children);
        }

        public void append(final Block block) {
            children.add(block);
        }

        /**
         * Returns {@code true} iff the section is flagged {@code toc-hidden}.
         */
        public boolean isHiddenInTableOfContents() {
            return metadata != null && metadata.flag("toc-hidden");
        }

        @Override
        public String toString() {
            return "Section[" + size + ", " + header.anchor() + ", " + children + "]";
        }

        private final int size;
        private final Header header;
        private final @Nullable Metadata metadata;
        private final List<Block> children = new ArrayList<>();
    }

    /**
     * Consecutive lines of text.
     */
    record Paragraph(List<Line> lines) implements Block {
        public Paragraph {
            lines = List.copyOf(lines);
        }
    }

    /**
     * A list; ordered iff its first item's marker was a number.
     */
    record ListBlock(boolean ordered, List<ListItem> items) implements Block {
        public ListBlock {
            items = List.copyOf(items);
        }
    }

    /**
     * A table with a header row and zero or more body rows.
     */
    record Table(Row header, List<Row> rows) implements Block {
        public Table {
            rows = List.copyOf(rows);
        }

        public record Row(List<Line> cells) {
            public Row {
                cells = List.copyOf(cells);
            }
        }
    }

    /**
     * A fenced code block; the code is kept verbatim.
     *
     * @param language The language tag after the opening fence, possibly empty.
     */
    record CodeBlock(String language, String code) implements Block {
    }

    /**
     * A {@code $$$} fenced formula, kept verbatim.
     */
    record MathBlock(String expression) implements Block {
    }

    /**
     * Lines starting with {@code >}, optionally preceded by metadata.
     */
    record Quote(@Nullable Metadata metadata, List<Line> lines) implements Block {
        public Quote {
            lines = List.copyOf(lines);
        }
    }

    /**
     * An import of another document, replaced by that document's blocks once all imports have been parsed.
     *
     * @param path     The absolute path of the imported file.
     * @param document The cell the import task fills with the parsed document.
     */
    record Import(Path path, Deferred<Document> document) implements Block {
    }

    /**
     * A placeholder standing alone on its line.
     */
    record PlaceholderBlock(Placeholder placeholder) implements Block {
    }

    /**
     * Blocks produced by expanding a template that holds more than one block.
     */
    record Fragment(List<Block> blocks) implements Block {
        public Fragment {
            blocks = List.copyOf(blocks);
        }
    }

    /**
     * A directive that produced no content, such as a stylesheet import.
     */
    enum Null implements Block {
        INSTANCE
    }
}
