// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import quire.tree.BibEntry;
import quire.tree.GlossaryEntry;
import quire.util.condition.ConditionContext;

/**
 * Reads the TOML files a document can import: configuration, bibliography and glossary files.
 * <p>
 * Malformed entries are skipped after signaling a {@link DefinitionErrorCondition}. A file that cannot be read or is
 * not valid TOML at all makes the method throw {@link IOException}.
 */
public final class TomlDefinitions {
    private TomlDefinitions() {
    }

    /**
     * Reads a configuration file.
     * <p>
     * Tables only group keys: {@code [imports] ignored-imports = [...]} sets the key {@code ignored-imports}.
     */
    public static Map<String, ConfigValue> readConfiguration(final Path file) throws IOException {
        final var result = new LinkedHashMap<String, ConfigValue>();
        flattenInto(result, readRoot(file));
        return result;
    }

    /**
     * Reads a bibliography file, in which every table is an entry keyed by its name:
     * <pre>
     * [knuth84]
     * title = "Literate Programming"
     * author = "Donald E. Knuth"
     * </pre>
     */
    public static List<BibEntry> readBibliography(final Path file) throws IOException {
        final var result = new ArrayList<BibEntry>();
        final var fields = readRoot(file).fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            if (!field.getValue().isObject()) {
                ConditionContext.signal(new DefinitionErrorCondition(
                    "Bibliography entry " + field.getKey() + " is not a table", file));
                continue;
            }
            final var values = new LinkedHashMap<String, String>();
            final var entryFields = field.getValue().fields();
            while (entryFields.hasNext()) {
                final var entryField = entryFields.next();
                values.put(entryField.getKey(), text(entryField.getValue()));
            }
            result.add(new BibEntry(field.getKey(), values));
        }
        return result;
    }

    /**
     * Reads a glossary file, in which every table is an entry keyed by its short form and requires the fields
     * {@code long} and {@code description}.
     */
    public static List<GlossaryEntry> readGlossary(final Path file) throws IOException {
        final var result = new ArrayList<GlossaryEntry>();
        final var fields = readRoot(file).fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            final var longForm = field.getValue().get(longField);
            final var description = field.getValue().get(descriptionField);
            if (longForm == null || !longForm.isValueNode()) {
                ConditionContext.signal(new DefinitionErrorCondition(
                    "Glossary entry " + field.getKey() + " is missing the field '" + longField + "'", file));
            } else if (description == null || !description.isValueNode()) {
                ConditionContext.signal(new DefinitionErrorCondition(
                    "Glossary entry " + field.getKey() + " is missing the field '" + descriptionField + "'", file));
            } else {
                result.add(new GlossaryEntry(field.getKey(), longForm.asText(), description.asText()));
            }
        }
        return result;
    }

    private static JsonNode readRoot(final Path file) throws IOException {
        return mapper.readTree(file.toFile());
    }

    private static void flattenInto(final Map<String, ConfigValue> result, final JsonNode table) {
        final var fields = table.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            final var value = field.getValue();
            if (value.isObject()) {
                flattenInto(result, value);
            } else {
                result.put(field.getKey(), configValue(value));
            }
        }
    }

    private static ConfigValue configValue(final JsonNode value) {
        if (value.isArray()) {
            final var items = new ArrayList<String>(value.size());
            for (final var item : value) {
                items.add(text(item));
            }
            return new ConfigValue.ListValue(items);
        } else if (value.isBoolean()) {
            return new ConfigValue.Bool(value.booleanValue());
        } else if (value.isIntegralNumber()) {
            return new ConfigValue.IntegerValue(value.longValue());
        } else if (value.isFloatingPointNumber()) {
            return new ConfigValue.FloatValue(value.doubleValue());
        }
        return new ConfigValue.Text(value.asText());
    }

    private static String text(final JsonNode value) {
        if (value.isArray()) {
            final var items = new ArrayList<String>(value.size());
            for (final var item : value) {
                items.add(text(item));
            }
            return String.join(", ", items);
        }
        return value.asText();
    }

    private static final String longField = "long";
    private static final String descriptionField = "description";
    private static final TomlMapper mapper = new TomlMapper();
}
