// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import quire.tree.Block;
import quire.tree.Element;
import quire.tree.Header;
import quire.tree.Inline;
import quire.tree.Line;
import quire.tree.ListItem;
import quire.tree.Metadata;
import quire.tree.MetadataValue;
import quire.tree.Template;
import quire.tree.TemplateVariable;

/**
 * Expands templates.
 * <p>
 * Expansion binds the template's variables, copies the template's content with every variable replaced by a frozen
 * copy holding its current value, then resets the variables, leaving the template ready for the next expansion.
 * Variables without a replacement stay unbound in the copy.
 */
final class TemplateExpander {
    private TemplateExpander() {
    }

    /**
     * Expands a template with the entries of {@code replacements}, keyed by variable name.
     *
     * @return A text line if the template is a single line of text, the block if it is a single block, otherwise a
     * {@link Block.Fragment}.
     */
    static Element expand(final Template template, final Map<String, Inline> replacements) {
        try {
            for (final var variable : template.variables()) {
                final var replacement = replacements.get(variable.name());
                if (replacement != null) {
                    variable.bind(replacement);
                }
            }
            final var content = copyBlocks(template.content());
            if (content.size() == 1) {
                final var block = content.get(0);
                if (block instanceof Block.Paragraph paragraph && paragraph.lines().size() == 1) {
                    return paragraph.lines().get(0);
                }
                return block;
            }
            return new Block.Fragment(content);
        } finally {
            for (final var variable : template.variables()) {
                variable.reset();
            }
        }
    }

    /**
     * Converts placeholder metadata into template replacements.
     */
    static Map<String, Inline> replacementsFrom(final Metadata metadata) {
        final var result = new LinkedHashMap<String, Inline>();
        metadata.entries().forEach((name, value) -> {
            if (value instanceof MetadataValue.PlaceholderValue placeholder) {
                result.put(name, new Inline.PlaceholderRef(placeholder.placeholder()));
            } else {
                result.put(name, new Inline.Plain(value.asText()));
            }
        });
        return result;
    }

    private static List<Block> copyBlocks(final List<Block> blocks) {
        final var result = new ArrayList<Block>(blocks.size());
        for (final var block : blocks) {
            result.add(copy(block));
        }
        return result;
    }

    private static Block copy(final Block block) {
        if (block instanceof Block.Section section) {
            final var result = new Block.Section(
                section.size(),
                new Header(copy(section.header().title()), section.header().anchor()),
                section.metadata()
            );
            for (final var child : section.children()) {
                result.append(copy(child));
            }
            return result;
        } else if (block instanceof Block.Paragraph paragraph) {
            return new Block.Paragraph(copyLines(paragraph.lines()));
        } else if (block instanceof Block.ListBlock list) {
            return new Block.ListBlock(list.ordered(), copyItems(list.items()));
        } else if (block instanceof Block.Table table) {
            final var rows = new ArrayList<Block.Table.Row>(table.rows().size());
            for (final var row : table.rows()) {
                rows.add(new Block.Table.Row(copyLines(row.cells())));
            }
            return new Block.Table(new Block.Table.Row(copyLines(table.header().cells())), rows);
        } else if (block instanceof Block.Quote quote) {
            return new Block.Quote(quote.metadata(), copyLines(quote.lines()));
        } else if (block instanceof Block.Fragment fragment) {
            return new Block.Fragment(copyBlocks(fragment.blocks()));
        }
        // The remaining blocks hold no template variables.
        return block;
    }

    private static List<ListItem> copyItems(final List<ListItem> items) {
        final var result = new ArrayList<ListItem>(items.size());
        for (final var item : items) {
            final var copied = new ListItem(copy(item.text()), item.level(), item.isOrdered());
            for (final var child : copyItems(item.children())) {
                copied.append(child);
            }
            result.add(copied);
        }
        return result;
    }

    private static List<Line> copyLines(final List<Line> lines) {
        final var result = new ArrayList<Line>(lines.size());
        for (final var line : lines) {
            result.add(copy(line));
        }
        return result;
    }

    private static Line copy(final Line line) {
        if (line instanceof Line.Text text) {
            return copy(text);
        } else if (line instanceof Line.Centered centered) {
            return new Line.Centered(copy(centered.text()));
        } else if (line instanceof Line.RefLink link) {
            return new Line.RefLink(copy(link.description()), link.reference());
        } else if (line instanceof Line.Anchor anchor) {
            return new Line.Anchor(anchor.key(), copy(anchor.inner()));
        }
        return line;
    }

    private static Line.Text copy(final Line.Text text) {
        return new Line.Text(copyInlines(text.parts()));
    }

    private static List<Inline> copyInlines(final List<Inline> inlines) {
        final var result = new ArrayList<Inline>(inlines.size());
        for (final var inline : inlines) {
            result.add(copy(inline));
        }
        return result;
    }

    private static Inline copy(final Inline inline) {
        if (inline instanceof Inline.TemplateVar variable) {
            return new Inline.TemplateVar(freeze(variable.variable()));
        } else if (inline instanceof Inline.Bold bold) {
            return new Inline.Bold(copyInlines(bold.value()));
        } else if (inline instanceof Inline.Italic italic) {
            return new Inline.Italic(copyInlines(italic.value()));
        } else if (inline instanceof Inline.Underlined underlined) {
            return new Inline.Underlined(copyInlines(underlined.value()));
        } else if (inline instanceof Inline.Striked striked) {
            return new Inline.Striked(copyInlines(striked.value()));
        } else if (inline instanceof Inline.Superscript superscript) {
            return new Inline.Superscript(copyInlines(superscript.value()));
        } else if (inline instanceof Inline.Colored colored) {
            return new Inline.Colored(colored.color(), copy(colored.value()));
        }
        return inline;
    }

    private static TemplateVariable freeze(final TemplateVariable variable) {
        final var frozen = new TemplateVariable(variable.prefix(), variable.name(), variable.suffix());
        final var value = variable.value();
        if (value != null) {
            frozen.bind(value);
        }
        return frozen;
    }
}
