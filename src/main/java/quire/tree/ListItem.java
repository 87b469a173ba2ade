// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An item of a {@link Block.ListBlock}.
 * <p>
 * In a finished list, every child's level is strictly greater than its parent's.
 */
public final class ListItem {
    /**
     * Initializes a new item with no children.
     *
     * @param level   The indentation of the item's marker, in characters.
     * @param ordered Whether the marker was a number.
     */
    public ListItem(final Line text, final int level, final boolean ordered) {
        this.text = text;
        this.level = level;
        this.ordered = ordered;
    }

    public Line text() {
        return text;
    }

    public int level() {
        return level;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public List<ListItem> children() {
        return Collections.unmodifiableList(children);
    }

    public void append(final ListItem child) {
        children.add(child);
    }

    @Override
    public String toString() {
        return "ListItem[" + level + ", " + text + ", " + children + "]";
    }

    private final Line text;
    private final int level;
    private final boolean ordered;
    private final List<ListItem> children = new ArrayList<>();
}
