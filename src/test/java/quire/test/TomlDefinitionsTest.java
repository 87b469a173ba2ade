// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import quire.parser.Diagnostics;
import quire.references.ConfigValue;
import quire.references.DefinitionErrorCondition;
import quire.references.TomlDefinitions;
import quire.tree.BibEntry;
import quire.tree.GlossaryEntry;
import quire.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.entry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class TomlDefinitionsTest {
    @Test
    void configurationTablesAreFlattened(final @TempDir Path directory) throws IOException {
        final var file = write(directory, "config.toml",
            "title = \"Notes\"\n" +
            "\n" +
            "[imports]\n" +
            "ignored-imports = [\"draft.md\", \"old.md\"]\n" +
            "\n" +
            "[numbers]\n" +
            "count = 3\n" +
            "ratio = 0.5\n" +
            "enabled = false\n"
        );
        final var configuration = TomlDefinitions.readConfiguration(file);
        assertThat(configuration).containsExactly(
            entry("title", new ConfigValue.Text("Notes")),
            entry("ignored-imports", new ConfigValue.ListValue(List.of("draft.md", "old.md"))),
            entry("count", new ConfigValue.IntegerValue(3)),
            entry("ratio", new ConfigValue.FloatValue(0.5)),
            entry("enabled", new ConfigValue.Bool(false))
        );
    }

    @Test
    void bibliographyEntriesAreTables(final @TempDir Path directory) throws IOException {
        final var file = write(directory, "refs.bib.toml",
            "stray = \"not an entry\"\n" +
            "\n" +
            "[knuth84]\n" +
            "title = \"Literate Programming\"\n" +
            "author = [\"Donald E. Knuth\"]\n" +
            "year = 1984\n"
        );
        final List<BibEntry> entries;
        try (final var handler = new Handler(diagnostics)) {
            handler.use();
            entries = TomlDefinitions.readBibliography(file);
        }
        assertThat(entries).hasSize(1);
        final var knuth = entries.get(0);
        assertThat(knuth.key()).isEqualTo("knuth84");
        assertThat(knuth.fields()).containsExactly(
            entry("title", "Literate Programming"),
            entry("author", "Donald E. Knuth"),
            entry("year", "1984")
        );
        final var errors = diagnostics.conditionsOf(DefinitionErrorCondition.class);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).file()).isEqualTo(file);
        assertThat(errors.get(0).message()).contains("stray");
    }

    @Test
    void glossaryEntriesNeedBothFields(final @TempDir Path directory) throws IOException {
        final var file = write(directory, "Glossary.toml",
            "[HTML]\n" +
            "long = \"Hypertext Markup Language\"\n" +
            "description = \"The markup language of the web\"\n" +
            "\n" +
            "[CSS]\n" +
            "long = \"Cascading Style Sheets\"\n" +
            "\n" +
            "[JS]\n" +
            "description = \"A scripting language\"\n"
        );
        final List<GlossaryEntry> entries;
        try (final var handler = new Handler(diagnostics)) {
            handler.use();
            entries = TomlDefinitions.readGlossary(file);
        }
        assertThat(entries).containsExactly(
            new GlossaryEntry("HTML", "Hypertext Markup Language", "The markup language of the web")
        );
        assertThat(diagnostics.conditionsOf(DefinitionErrorCondition.class))
            .extracting(DefinitionErrorCondition::message)
            .containsExactly(
                "Glossary entry CSS is missing the field 'description'",
                "Glossary entry JS is missing the field 'long'"
            );
    }

    @Test
    void invalidTomlIsAnIOException(final @TempDir Path directory) throws IOException {
        final var file = write(directory, "broken.toml", "[unclosed\nkey = \n");
        assertThatExceptionOfType(IOException.class).isThrownBy(() -> TomlDefinitions.readConfiguration(file));
    }

    @Test
    void missingFileIsAnIOException(final @TempDir Path directory) {
        final var file = directory.resolve("absent.toml");
        assertThatExceptionOfType(IOException.class).isThrownBy(() -> TomlDefinitions.readGlossary(file));
    }

    private static Path write(final Path directory, final String name, final String content) throws IOException {
        final var file = directory.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private final Diagnostics diagnostics = new Diagnostics();
}
