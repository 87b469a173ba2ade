// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import quire.util.annotation.Nullable;

/**
 * A bracketed {@code [key=value, flag]} block attached to a section, quote, image, import or placeholder.
 *
 * @param entries The entries, in source order.
 */
public record Metadata(Map<String, MetadataValue> entries) {
    public Metadata {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Returns the value stored under {@code key}, if any.
     */
    public @Nullable MetadataValue get(final String key) {
        return entries.get(key);
    }

    /**
     * Returns {@code true} iff {@code key} holds the boolean {@code true}.
     */
    public boolean flag(final String key) {
        return entries.get(key) instanceof MetadataValue.Bool bool && bool.value();
    }

    /**
     * Returns the display text of the value stored under {@code key}, if any.
     */
    public @Nullable String text(final String key) {
        final var value = entries.get(key);
        return (value == null) ? null : value.asText();
    }
}
