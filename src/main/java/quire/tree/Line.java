// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.List;

/**
 * A single line of a paragraph, quote, list item, header or table cell.
 */
public sealed interface Line extends Element {
    /**
     * A line of formatted text.
     */
    record Text(List<Inline> parts) implements Line {
        public Text {
            parts = List.copyOf(parts);
        }

        public boolean isEmpty() {
            return parts.isEmpty();
        }
    }

    /**
     * A {@code - - -} horizontal ruler.
     */
    record Ruler() implements Line {
    }

    /**
     * A {@code ||text} centered line.
     */
    record Centered(Text text) implements Line {
    }

    /**
     * A {@code [key]: url} or {@code [key]: [metadata]} bibliography definition.
     */
    record BibEntryLine(BibEntry entry) implements Line {
    }

    /**
     * A link to an anchor within the document, as produced for table of contents entries.
     */
    record RefLink(Line description, String reference) implements Line {
    }

    /**
     * A line that is itself a link target, as produced for bibliography and glossary listings.
     */
    record Anchor(String key, Line inner) implements Line {
    }
}
