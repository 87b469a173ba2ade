// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.ArrayList;
import java.util.List;
import quire.tree.BibEntry;
import quire.tree.Block;
import quire.tree.GlossaryEntry;
import quire.tree.Inline;
import quire.tree.Line;
import quire.tree.ListItem;

/**
 * Builds the lists the {@code toc}, {@code bibliography} and {@code glossary} placeholders resolve to.
 */
final class Listings {
    private Listings() {
    }

    /**
     * Builds a table of contents from the sections among {@code blocks}, recursively. Sections flagged
     * {@code toc-hidden} are left out together with their subsections.
     */
    static Block.ListBlock tableOfContents(final List<Block> blocks, final boolean ordered) {
        return new Block.ListBlock(ordered, contentsItems(blocks, 0, ordered));
    }

    private static List<ListItem> contentsItems(final List<Block> blocks, final int level, final boolean ordered) {
        final var items = new ArrayList<ListItem>();
        for (final var block : blocks) {
            if (block instanceof Block.Section section && !section.isHiddenInTableOfContents()) {
                final var header = section.header();
                final var item = new ListItem(new Line.RefLink(header.title(), header.anchor()), level, ordered);
                for (final var child : contentsItems(section.children(), level + 1, ordered)) {
                    item.append(child);
                }
                items.add(item);
            }
        }
        return items;
    }

    /**
     * Lists the cited bibliography entries in citation order, each anchored at its key.
     */
    static Block.ListBlock bibliography(final List<BibEntry> entries) {
        final var items = new ArrayList<ListItem>(entries.size());
        for (final var entry : entries) {
            final var parts = new ArrayList<Inline>();
            final var description = new ArrayList<String>();
            entry.fields().forEach((name, value) -> {
                if (!name.equals(BibEntry.urlField)) {
                    description.add(value);
                }
            });
            if (!description.isEmpty()) {
                parts.add(new Inline.Plain(String.join(", ", description)));
            }
            final var url = entry.field(BibEntry.urlField);
            if (url != null) {
                if (!parts.isEmpty()) {
                    parts.add(new Inline.Plain(" "));
                }
                parts.add(new Inline.Url(null, url));
            }
            items.add(new ListItem(new Line.Anchor(entry.key(), new Line.Text(parts)), 0, true));
        }
        return new Block.ListBlock(true, items);
    }

    /**
     * Lists the used glossary entries, each anchored at its short form.
     */
    static Block.ListBlock glossary(final List<GlossaryEntry> entries) {
        final var items = new ArrayList<ListItem>(entries.size());
        for (final var entry : entries) {
            final var text = new Line.Text(List.of(
                new Inline.Bold(List.of(new Inline.Plain(entry.shortForm()))),
                new Inline.Plain(" - " + entry.longForm() + ": " + entry.description())
            ));
            items.add(new ListItem(new Line.Anchor(entry.shortForm(), text), 0, false));
        }
        return new Block.ListBlock(false, items);
    }
}
