// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import quire.util.annotation.Nullable;

/**
 * A bibliography entry, defined by a {@code [key]: ...} line or loaded from a bibliography file.
 *
 * @param key    The key citations refer to.
 * @param fields Descriptive fields such as {@code url}, {@code title} or {@code author}.
 */
public record BibEntry(String key, Map<String, String> fields) {
    /**
     * The field holding the URL of a {@code [key]: url} definition.
     */
    public static final String urlField = "url";

    public BibEntry {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public @Nullable String field(final String name) {
        return fields.get(name);
    }
}
