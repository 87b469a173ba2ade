// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.assembly;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import quire.tree.Block;
import quire.util.annotation.Nullable;

/**
 * Re-nests sections in a sequence of top-level blocks, as needed after imported documents, parsed with no open
 * sections of their own, are spliced in after a section of the importer.
 */
public final class SectionNester {
    private SectionNester() {
    }

    /**
     * Nests the given blocks.
     * <p>
     * A section no deeper than the last top-level section starts a new top-level section. A deeper one is grafted into
     * the last top-level section: into its most recent child section whose size lies strictly between the two, if
     * there is one, recursively, otherwise directly. Any other block following a top-level section is appended to it.
     * Nothing is ever dropped.
     *
     * @return The new top-level blocks.
     */
    @CheckReturnValue
    public static List<Block> nest(final List<Block> blocks) {
        final var result = new ArrayList<Block>(blocks.size());
        Block.@Nullable Section open = null;
        for (final var block : blocks) {
            if (block instanceof Block.Section section) {
                if (open == null || section.size() <= open.size()) {
                    result.add(section);
                    open = section;
                } else {
                    graft(open, section);
                }
            } else if (open != null) {
                open.append(block);
            } else {
                result.add(block);
            }
        }
        return result;
    }

    private static void graft(final Block.Section parent, final Block.Section section) {
        if (section.size() > parent.size() + 1) {
            final var children = parent.children();
            for (var i = children.size() - 1; i >= 0; i -= 1) {
                if (children.get(i) instanceof Block.Section child
                    && child.size() > parent.size()
                    && child.size() < section.size()) {
                    graft(child, section);
                    return;
                }
            }
        }
        parent.append(section);
    }
}
