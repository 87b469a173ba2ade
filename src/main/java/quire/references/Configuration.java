// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import quire.util.annotation.Nullable;

/**
 * A thread-safe store of typed configuration values.
 * <p>
 * Values come from the defaults, from configuration files imported by documents, from {@code [[set:key]]}
 * definitions, and from the caller. Keys are case-insensitive. Each operation is atomic on its own; no caller holds a
 * lock across several.
 */
public final class Configuration {
    /**
     * Creates an empty configuration.
     */
    public Configuration() {
    }

    /**
     * Creates a configuration holding the default values.
     */
    public static Configuration withDefaults() {
        final var configuration = new Configuration();
        configuration.set(ConfigKeys.bibRefDisplay, new ConfigValue.Text("{{number}}"));
        configuration.set(ConfigKeys.language, new ConfigValue.Text("en"));
        configuration.set(ConfigKeys.ignoredImports, new ConfigValue.ListValue(List.of()));
        configuration.set(ConfigKeys.includedStylesheets, new ConfigValue.ListValue(List.of("style.css")));
        configuration.set(ConfigKeys.includedConfigs, new ConfigValue.ListValue(List.of()));
        configuration.set(ConfigKeys.includedBibliography, new ConfigValue.ListValue(List.of("Bibliography.toml")));
        configuration.set(ConfigKeys.includedGlossary, new ConfigValue.ListValue(List.of("Glossary.toml")));
        configuration.set(ConfigKeys.smartArrows, new ConfigValue.Bool(true));
        return configuration;
    }

    /**
     * Returns the value stored under {@code key}, if any.
     */
    public @Nullable ConfigValue get(final String key) {
        return values.get(normalize(key));
    }

    /**
     * Stores a value, replacing any previous one.
     */
    public void set(final String key, final ConfigValue value) {
        values.put(normalize(key), value);
    }

    /**
     * Stores a value unless one is already present.
     *
     * @return {@code true} iff the value was stored.
     */
    public boolean setIfAbsent(final String key, final ConfigValue value) {
        return values.putIfAbsent(normalize(key), value) == null;
    }

    /**
     * Stores every given value, replacing previous ones.
     */
    public void merge(final Map<String, ConfigValue> newValues) {
        newValues.forEach(this::set);
    }

    /**
     * Returns the display text of the value stored under {@code key}, if any.
     */
    public @Nullable String text(final String key) {
        final var value = get(key);
        return (value == null) ? null : value.asText();
    }

    /**
     * Returns the value stored under {@code key} as a list of strings. A text value is split at commas.
     */
    public List<String> strings(final String key) {
        final var value = get(key);
        if (value instanceof ConfigValue.ListValue list) {
            return list.values();
        } else if (value instanceof ConfigValue.Text text) {
            return Arrays.stream(text.value().split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
        }
        return List.of();
    }

    /**
     * Returns the boolean stored under {@code key}, or {@code defaultValue} if there is no boolean.
     */
    public boolean flag(final String key, final boolean defaultValue) {
        return (get(key) instanceof ConfigValue.Bool bool) ? bool.value() : defaultValue;
    }

    private static String normalize(final String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    private final Map<String, ConfigValue> values = new ConcurrentHashMap<>();
}
