// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.List;
import quire.util.annotation.Nullable;

/**
 * Walks a tree in document order, reporting placeholders, references, bibliography definitions and template variables
 * to an {@link ElementVisitor}.
 * <p>
 * The walk descends into metadata, including templates stored in metadata, but not into the computed content of
 * placeholders.
 */
public final class ElementWalker {
    private ElementWalker(final ElementVisitor visitor) {
        this.visitor = visitor;
    }

    /**
     * Walks the given blocks.
     */
    public static void walk(final List<Block> blocks, final ElementVisitor visitor) {
        new ElementWalker(visitor).blocks(blocks);
    }

    /**
     * Walks the given metadata.
     */
    public static void walk(final Metadata metadata, final ElementVisitor visitor) {
        new ElementWalker(visitor).metadata(metadata);
    }

    private void blocks(final List<Block> blocks) {
        for (final var block : blocks) {
            block(block);
        }
    }

    private void block(final Block block) {
        if (block instanceof Block.Section section) {
            metadata(section.metadata());
            line(section.header().title());
            blocks(section.children());
        } else if (block instanceof Block.Paragraph paragraph) {
            lines(paragraph.lines());
        } else if (block instanceof Block.ListBlock list) {
            items(list.items());
        } else if (block instanceof Block.Table table) {
            lines(table.header().cells());
            for (final var row : table.rows()) {
                lines(row.cells());
            }
        } else if (block instanceof Block.Quote quote) {
            metadata(quote.metadata());
            lines(quote.lines());
        } else if (block instanceof Block.PlaceholderBlock placeholder) {
            placeholder(placeholder.placeholder());
        } else if (block instanceof Block.Fragment fragment) {
            blocks(fragment.blocks());
        }
    }

    private void items(final List<ListItem> items) {
        for (final var item : items) {
            line(item.text());
            items(item.children());
        }
    }

    private void lines(final List<Line> lines) {
        for (final var line : lines) {
            line(line);
        }
    }

    private void line(final Line line) {
        if (line instanceof Line.Text text) {
            inlines(text.parts());
        } else if (line instanceof Line.Centered centered) {
            inlines(centered.text().parts());
        } else if (line instanceof Line.BibEntryLine entry) {
            visitor.visitBibEntry(entry.entry());
        } else if (line instanceof Line.RefLink link) {
            line(link.description());
        } else if (line instanceof Line.Anchor anchor) {
            line(anchor.inner());
        }
    }

    private void inlines(final List<Inline> inlines) {
        for (final var inline : inlines) {
            inline(inline);
        }
    }

    private void inline(final Inline inline) {
        if (inline instanceof Inline.Bold bold) {
            inlines(bold.value());
        } else if (inline instanceof Inline.Italic italic) {
            inlines(italic.value());
        } else if (inline instanceof Inline.Underlined underlined) {
            inlines(underlined.value());
        } else if (inline instanceof Inline.Striked striked) {
            inlines(striked.value());
        } else if (inline instanceof Inline.Superscript superscript) {
            inlines(superscript.value());
        } else if (inline instanceof Inline.Colored colored) {
            inline(colored.value());
        } else if (inline instanceof Inline.Image image) {
            metadata(image.metadata());
        } else if (inline instanceof Inline.PlaceholderRef placeholder) {
            placeholder(placeholder.placeholder());
        } else if (inline instanceof Inline.BibRef reference) {
            visitor.visitBibReference(reference.reference());
        } else if (inline instanceof Inline.GlossaryRef reference) {
            visitor.visitGlossaryReference(reference.reference());
        } else if (inline instanceof Inline.TemplateVar variable) {
            visitor.visitTemplateVariable(variable.variable());
        }
    }

    private void placeholder(final Placeholder placeholder) {
        visitor.visitPlaceholder(placeholder);
        metadata(placeholder.metadata());
    }

    private void metadata(final @Nullable Metadata metadata) {
        if (metadata == null) {
            return;
        }
        for (final var value : metadata.entries().values()) {
            if (value instanceof MetadataValue.PlaceholderValue placeholder) {
                placeholder(placeholder.placeholder());
            } else if (value instanceof MetadataValue.TemplateValue template) {
                blocks(template.template().content());
            }
        }
    }

    private final ElementVisitor visitor;
}
