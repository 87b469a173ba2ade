// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.List;
import quire.references.PendingDownload;
import quire.util.annotation.Nullable;

/**
 * The formatted parts of a line of text.
 */
public sealed interface Inline extends Element {
    record Plain(String value) implements Inline {
    }

    record Bold(List<Inline> value) implements Inline {
        public Bold {
            value = List.copyOf(value);
        }
    }

    record Italic(List<Inline> value) implements Inline {
        public Italic {
            value = List.copyOf(value);
        }
    }

    record Underlined(List<Inline> value) implements Inline {
        public Underlined {
            value = List.copyOf(value);
        }
    }

    record Striked(List<Inline> value) implements Inline {
        public Striked {
            value = List.copyOf(value);
        }
    }

    record Superscript(List<Inline> value) implements Inline {
        public Superscript {
            value = List.copyOf(value);
        }
    }

    /**
     * Inline code; its content is kept verbatim.
     */
    record Monospace(String value) implements Inline {
    }

    /**
     * A {@code [description](url)} link. The description is {@code null} when the brackets were empty or absent.
     */
    record Url(@Nullable String description, String url) implements Inline {
    }

    /**
     * A {@code ![description](url)} image, registered with the document's downloads for an external fetcher.
     */
    record Image(Url url, @Nullable Metadata metadata, PendingDownload download) implements Inline {
    }

    record PlaceholderRef(Placeholder placeholder) implements Inline {
    }

    /**
     * A {@code [ ]} or {@code [x]} checkbox.
     */
    record Checkbox(boolean checked) implements Inline {
    }

    /**
     * A {@code :name:} emoji.
     *
     * @param name  The alias as written.
     * @param value The emoji itself.
     */
    record Emoji(String name, String value) implements Inline {
    }

    /**
     * A {@code §[color]text} span.
     */
    record Colored(String color, Inline value) implements Inline {
    }

    /**
     * A {@code $$expression$$} inline formula, kept verbatim.
     */
    record Math(String expression) implements Inline {
    }

    record BibRef(BibReference reference) implements Inline {
    }

    record GlossaryRef(GlossaryReference reference) implements Inline {
    }

    record TemplateVar(TemplateVariable variable) implements Inline {
    }

    /**
     * An {@code &name;} character reference, stored without the ampersand and semicolon.
     */
    record CharacterCode(String code) implements Inline {
    }

    /**
     * One of the arrow ligatures.
     */
    enum Arrow implements Inline {
        BIG_LEFT_RIGHT("<==>", "⇔"),
        LEFT_RIGHT("<-->", "↔"),
        BIG_RIGHT("==>", "⇒"),
        RIGHT("-->", "→"),
        BIG_LEFT("<==", "⇐"),
        LEFT("<--", "←");

        Arrow(final String source, final String symbol) {
            this.source = source;
            this.symbol = symbol;
        }

        /**
         * Returns the character sequence that produces this arrow.
         */
        public String source() {
            return source;
        }

        /**
         * Returns the arrow character a renderer should display when smart arrows are enabled.
         */
        public String symbol() {
            return symbol;
        }

        private final String source;
        private final String symbol;
    }
}
