// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import quire.tree.GlossaryEntry;
import quire.tree.GlossaryReference;

/**
 * Holds glossary definitions and assigns them to glossary references. Thread-safe.
 * <p>
 * The first reference to an entry displays its long form; later ones display the short form unless written
 * {@code ~~key}.
 */
public final class GlossaryManager {
    /**
     * Adds a definition. A later definition with the same short form replaces an earlier one.
     */
    public synchronized void define(final GlossaryEntry entry) {
        entries.put(entry.shortForm(), entry);
    }

    /**
     * Settles every given reference that is not settled yet, in order. A reference to an undefined entry is displayed
     * as written.
     */
    public synchronized void assign(final List<GlossaryReference> references) {
        for (final var reference : references) {
            final var cell = reference.use();
            if (cell.isSettled()) {
                continue;
            }
            final var entry = entries.get(reference.key());
            if (entry == null) {
                cell.markUnresolved("~" + reference.key());
                continue;
            }
            final var firstUse = used.add(entry.shortForm());
            cell.resolve(new GlossaryReference.Use(entry, firstUse || reference.forceLong()));
        }
    }

    /**
     * Returns the entries referenced at least once, sorted by short form.
     */
    public synchronized List<GlossaryEntry> usedEntries() {
        return used.stream()
            .map(entries::get)
            .sorted(Comparator.comparing(GlossaryEntry::shortForm))
            .toList();
    }

    private final Map<String, GlossaryEntry> entries = new HashMap<>();
    private final Set<String> used = new HashSet<>();
}
