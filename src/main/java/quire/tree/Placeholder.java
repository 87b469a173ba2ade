// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.Locale;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import quire.util.annotation.Nullable;

/**
 * A {@code [[name]]} placeholder, whose content is only computed once the whole document is known.
 * <p>
 * The same object appears in the tree and in the document's placeholder registry.
 */
public final class Placeholder {
    public Placeholder(final String name, final @Nullable Metadata metadata) {
        this.name = name;
        this.metadata = metadata;
    }

    /**
     * Returns the name as written.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the lower-cased name under which the placeholder is looked up.
     */
    public String key() {
        return name.toLowerCase(Locale.ROOT);
    }

    public @Nullable Metadata metadata() {
        return metadata;
    }

    /**
     * Returns the cell holding the computed content.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The cell is shared with whatever resolves it")
    public Deferred<Element> value() {
        return value;
    }

    @Override
    public String toString() {
        return "Placeholder[" + name + ", " + value + "]";
    }

    private final String name;
    private final @Nullable Metadata metadata;
    private final Deferred<Element> value = new Deferred<>();
}
