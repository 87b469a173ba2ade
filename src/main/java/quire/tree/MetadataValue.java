// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

/**
 * A typed value in a {@link Metadata} block.
 */
public sealed interface MetadataValue {
    /**
     * Returns the value as display text. Placeholders and templates have no text of their own and yield an empty
     * string.
     */
    String asText();

    /**
     * A string, either quoted or a bare word that is not a boolean or a number.
     */
    record Text(String value) implements MetadataValue {
        @Override
        public String asText() {
            return value;
        }
    }

    /**
     * A boolean; a bare flag such as {@code [toc-hidden]} is {@code true}.
     */
    record Bool(boolean value) implements MetadataValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record IntegerValue(long value) implements MetadataValue {
        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements MetadataValue {
        @Override
        public String asText() {
            return Double.toString(value);
        }
    }

    record PlaceholderValue(Placeholder placeholder) implements MetadataValue {
        @Override
        public String asText() {
            return "";
        }
    }

    record TemplateValue(Template template) implements MetadataValue {
        @Override
        public String asText() {
            return "";
        }
    }
}
