// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A {@code [^key]} citation.
 */
public final class BibReference {
    public BibReference(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The cell is shared with whatever resolves it")
    public Deferred<Citation> citation() {
        return citation;
    }

    /**
     * Returns the text to display: the resolved citation, or the fallback of an unresolved one.
     */
    public String display() {
        final var value = citation.value();
        if (value != null) {
            return value.display();
        }
        final var fallback = citation.fallback();
        return (fallback == null) ? key : fallback;
    }

    @Override
    public String toString() {
        return "BibReference[" + key + ", " + citation + "]";
    }

    private final String key;
    private final Deferred<Citation> citation = new Deferred<>();
}
