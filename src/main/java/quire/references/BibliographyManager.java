// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import quire.tree.BibEntry;
import quire.tree.BibReference;
import quire.tree.Citation;
import quire.util.annotation.Nullable;

/**
 * Holds bibliography definitions and assigns them to citations. Thread-safe.
 * <p>
 * Entries are numbered in the order they are first cited.
 */
public final class BibliographyManager {
    /**
     * Text displayed in place of a citation whose key has no definition.
     */
    public static final String unresolvedDisplay = "citation needed";

    /**
     * Adds a definition. A later definition with the same key replaces an earlier one.
     */
    public synchronized void define(final BibEntry entry) {
        entries.put(entry.key(), entry);
    }

    /**
     * Returns the definition with the given key, if any.
     */
    public synchronized @Nullable BibEntry lookup(final String key) {
        return entries.get(key);
    }

    /**
     * Settles every given citation that is not settled yet, in order.
     *
     * @param displayPattern How to display a citation, see {@link DisplayTemplate}.
     */
    public synchronized void assign(final List<BibReference> references, final String displayPattern) {
        for (final var reference : references) {
            final var cell = reference.citation();
            if (cell.isSettled()) {
                continue;
            }
            final var entry = entries.get(reference.key());
            if (entry == null) {
                cell.markUnresolved(unresolvedDisplay);
                continue;
            }
            final var number = numbers.computeIfAbsent(entry.key(), key -> numbers.size() + 1);
            final var values = new HashMap<>(entry.fields());
            values.put("key", entry.key());
            values.put("number", Integer.toString(number));
            cell.resolve(new Citation(entry, number, DisplayTemplate.render(displayPattern, values)));
        }
    }

    /**
     * Returns the cited entries, in citation number order.
     */
    public synchronized List<BibEntry> citedEntries() {
        final var result = new ArrayList<BibEntry>(numbers.size());
        for (final var key : numbers.keySet()) {
            result.add(entries.get(key));
        }
        return result;
    }

    private final Map<String, BibEntry> entries = new HashMap<>();
    // Insertion order is citation order.
    private final Map<String, Integer> numbers = new LinkedHashMap<>();
}
