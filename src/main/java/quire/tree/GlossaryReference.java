// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A {@code ~key} glossary reference, or {@code ~~key} to always display the long form.
 */
public final class GlossaryReference {
    public GlossaryReference(final String key, final boolean forceLong) {
        this.key = key;
        this.forceLong = forceLong;
    }

    public String key() {
        return key;
    }

    public boolean forceLong() {
        return forceLong;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The cell is shared with whatever resolves it")
    public Deferred<Use> use() {
        return use;
    }

    /**
     * Returns the text to display: {@code long (short)} for a long-form use, the short form otherwise, or the fallback
     * of an unresolved reference.
     */
    public String display() {
        final var value = use.value();
        if (value != null) {
            final var entry = value.entry();
            return value.longForm() ? (entry.longForm() + " (" + entry.shortForm() + ")") : entry.shortForm();
        }
        final var fallback = use.fallback();
        return (fallback == null) ? key : fallback;
    }

    @Override
    public String toString() {
        return "GlossaryReference[" + key + ", " + use + "]";
    }

    private final String key;
    private final boolean forceLong;
    private final Deferred<Use> use = new Deferred<>();

    /**
     * What a resolved glossary reference points to.
     *
     * @param entry    The referenced entry.
     * @param longForm Whether this use displays the long form, as the first use of each entry does.
     */
    public record Use(GlossaryEntry entry, boolean longForm) {
    }
}
