// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.assembly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import quire.tree.ListItem;

/**
 * Builds a forest of list items from the flat sequence in which they appear, using their indentation levels.
 */
public final class ListHierarchy {
    private ListHierarchy() {
    }

    /**
     * Nests the given items, which must have no children yet.
     * <p>
     * Each item becomes a child of the nearest preceding open item that is shallower than it. An item with no such
     * predecessor that is followed by a shallower item becomes a child of that following item, so no item is ever
     * dropped and every child is deeper than its parent.
     *
     * @return The root items, in order.
     */
    @CheckReturnValue
    public static List<ListItem> build(final List<ListItem> items) {
        final var roots = new ArrayList<ListItem>();
        if (items.isEmpty()) {
            return roots;
        }
        // Levels strictly increase from the bottom of the stack to its top.
        final var stack = new ArrayDeque<ListItem>();
        stack.push(items.get(0));
        for (final var item : items.subList(1, items.size())) {
            while (!stack.isEmpty()) {
                final var top = stack.pop();
                if (top.level() > item.level()) {
                    final var below = stack.peek();
                    if (below != null) {
                        below.append(top);
                    } else {
                        item.append(top);
                    }
                } else if (top.level() == item.level()) {
                    final var below = stack.peek();
                    if (below != null) {
                        below.append(top);
                    } else {
                        roots.add(top);
                    }
                    break;
                } else {
                    stack.push(top);
                    break;
                }
            }
            stack.push(item);
        }
        while (stack.size() > 1) {
            final var top = stack.pop();
            stack.element().append(top);
        }
        roots.add(stack.pop());
        return roots;
    }
}
