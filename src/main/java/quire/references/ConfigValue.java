// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.List;
import quire.tree.MetadataValue;
import quire.tree.Placeholder;
import quire.tree.Template;

/**
 * A typed configuration value.
 */
public sealed interface ConfigValue {
    /**
     * Returns the value as display text. Templates and placeholders yield an empty string.
     */
    String asText();

    /**
     * Converts a metadata value, as given to a {@code [[set:key]]} definition.
     */
    static ConfigValue fromMetadata(final MetadataValue value) {
        if (value instanceof MetadataValue.Text text) {
            return new Text(text.value());
        } else if (value instanceof MetadataValue.Bool bool) {
            return new Bool(bool.value());
        } else if (value instanceof MetadataValue.IntegerValue integer) {
            return new IntegerValue(integer.value());
        } else if (value instanceof MetadataValue.FloatValue floatValue) {
            return new FloatValue(floatValue.value());
        } else if (value instanceof MetadataValue.PlaceholderValue placeholder) {
            return new PlaceholderValue(placeholder.placeholder());
        } else if (value instanceof MetadataValue.TemplateValue template) {
            return new TemplateValue(template.template());
        }
        throw new IllegalArgumentException("Unknown metadata value: " + value);
    }

    record Text(String value) implements ConfigValue {
        @Override
        public String asText() {
            return value;
        }
    }

    record Bool(boolean value) implements ConfigValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record IntegerValue(long value) implements ConfigValue {
        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements ConfigValue {
        @Override
        public String asText() {
            return Double.toString(value);
        }
    }

    /**
     * A list of strings, as read from a TOML array.
     */
    record ListValue(List<String> values) implements ConfigValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public String asText() {
            return String.join(", ", values);
        }
    }

    /**
     * A template, expanded with the metadata of the placeholder that refers to it.
     */
    record TemplateValue(Template template) implements ConfigValue {
        @Override
        public String asText() {
            return "";
        }
    }

    /**
     * A placeholder, displayed wherever the key is used.
     */
    record PlaceholderValue(Placeholder placeholder) implements ConfigValue {
        @Override
        public String asText() {
            return "";
        }
    }
}
