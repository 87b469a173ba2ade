// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import quire.imports.ImportErrorCondition;
import quire.imports.ImportResolver;
import quire.parser.Diagnostics;
import quire.parser.Parser;
import quire.parser.ParserOptions;
import quire.references.ConfigKeys;
import quire.references.ConfigValue;
import quire.references.DefinitionErrorCondition;
import quire.references.PendingDownload;
import quire.tree.Block;
import quire.tree.Document;
import quire.tree.Inline;
import quire.tree.Line;
import quire.util.condition.ConditionContext;
import quire.util.condition.Handler;
import quire.util.condition.UnhandledErrorError;
import quire.util.condition.exception.IOExceptionCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static quire.test.ParseSupport.lineText;

final class ImportTest {
    @Test
    void importedDocumentIsSplicedIntoPrecedingSection(@TempDir final Path directory) throws IOException {
        final var root = write(directory, "root.md", "# Intro\n\nintro text\n\n<[chapter.md]\n\n# End\n");
        final var chapter = write(directory, "chapter.md", "## Chapter\n\nchapter text\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(document.blocks()).hasSize(2);
        final var intro = (Block.Section) document.blocks().get(0);
        assertThat(intro.header().anchor()).isEqualTo("Intro");
        assertThat(intro.children()).hasSize(2);
        assertThat(intro.children().get(0)).isInstanceOf(Block.Paragraph.class);
        final var chapterSection = (Block.Section) intro.children().get(1);
        assertThat(chapterSection.header().anchor()).isEqualTo("Chapter");
        assertThat(paragraphText(chapterSection.children().get(0))).isEqualTo("chapter text");
        assertThat(((Block.Section) document.blocks().get(1)).header().anchor()).isEqualTo("End");
        assertThat(document.sources()).containsExactly(normalized(root), normalized(chapter));
    }

    @Test
    void nestedImportsAreSplicedInOrder(@TempDir final Path directory) throws IOException {
        final var root = write(directory, "root.md", "first\n\n<[sub/middle.md]\n\nlast\n");
        write(directory, "sub/middle.md", "middle\n\n<[leaf.md]\n");
        write(directory, "sub/leaf.md", "leaf\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(document.blocks()).extracting(ImportTest::paragraphText)
            .containsExactly("first", "middle", "leaf", "last");
        assertThat(document.sources()).hasSize(3);
    }

    @Test
    void importCycleIsReportedAndRestIsKept(@TempDir final Path directory) throws IOException {
        final var a = write(directory, "a.md", "Start of A\n\n<[b.md]\n");
        write(directory, "b.md", "Start of B\n\n<[a.md]\n\nEnd of B\n");
        final var document = parse(a, ParseSupport.options());

        assertThat(document.blocks()).extracting(ImportTest::paragraphText)
            .containsExactly("Start of A", "Start of B", "End of B");
        final var errors = diagnostics.conditionsOf(ImportErrorCondition.class);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).path()).isEqualTo(normalized(a));
        assertThat(errors.get(0).message()).startsWith("Cyclic or repeated import");
    }

    @Test
    void repeatedImportIsReported(@TempDir final Path directory) throws IOException {
        final var root = write(directory, "root.md", "<[c.md]\n<[c.md]\n");
        write(directory, "c.md", "C\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(document.blocks()).extracting(ImportTest::paragraphText).containsExactly("C");
        assertThat(diagnostics.conditionsOf(ImportErrorCondition.class)).hasSize(1);
    }

    @Test
    void missingFileIsReported(@TempDir final Path directory) throws IOException {
        final var root = write(directory, "root.md", "<[missing.md]\n\nstill here\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(document.blocks()).extracting(ImportTest::paragraphText).containsExactly("still here");
        final var errors = diagnostics.conditionsOf(ImportErrorCondition.class);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).message()).isEqualTo("Imported file does not exist");
        assertThat(errors.get(0).location()).isNotNull();
        assertThat(errors.get(0).location().line()).isEqualTo(1);
        assertThat(diagnostics.entries().get(0).describe()).startsWith("warning: Imported file does not exist");
    }

    @Test
    void configurationFileSetsValuesAndIgnoredImports(@TempDir final Path directory) throws IOException {
        write(directory, "settings.toml",
            "[meta]\n" +
            "author = \"Ada\"\n" +
            "\n" +
            "[imports]\n" +
            "ignored-imports = [\"skip.md\"]\n"
        );
        final var root = write(directory, "root.md", "<[settings.toml]\n<[skip.md]\n\nBy [[author]]\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(document.blocks()).hasSize(1);
        final var parts = ((Line.Text) ((Block.Paragraph) document.blocks().get(0)).lines().get(0)).parts();
        final var author = ((Inline.PlaceholderRef) parts.get(1)).placeholder();
        assertThat(author.value().value()).isEqualTo(new Inline.Plain("Ada"));
    }

    @Test
    void bibliographyFileResolvesCitations(@TempDir final Path directory) throws IOException {
        write(directory, "refs.bib.toml",
            "[lamport]\n" +
            "title = \"LaTeX\"\n" +
            "author = \"Leslie Lamport\"\n"
        );
        final var root = write(directory, "root.md", "<[refs.bib.toml]\n\nSee[^lamport] and[^nobody].\n");
        final var options = ParseSupport.options()
            .withConfiguration(ConfigKeys.bibRefDisplay, new ConfigValue.Text("{{author}} [{{number}}]"));
        final var document = parse(root, options);

        final var parts = ((Line.Text) ((Block.Paragraph) document.blocks().get(0)).lines().get(0)).parts();
        final var lamport = ((Inline.BibRef) parts.get(1)).reference();
        final var nobody = ((Inline.BibRef) parts.get(3)).reference();
        assertThat(lamport.display()).isEqualTo("Leslie Lamport [1]");
        assertThat(lamport.citation().value()).isNotNull();
        assertThat(lamport.citation().value().number()).isEqualTo(1);
        assertThat(nobody.display()).isEqualTo("citation needed");
        assertThat(document.shared().bibliography().citedEntries()).extracting(entry -> entry.key())
            .containsExactly("lamport");
    }

    @Test
    void glossaryIsIncludedAutomatically(@TempDir final Path directory) throws IOException {
        write(directory, "Glossary.toml",
            "[HTML]\n" +
            "long = \"Hypertext Markup Language\"\n" +
            "description = \"The markup language of the web\"\n"
        );
        final var root = write(directory, "root.md", "~HTML first, ~HTML again, ~~HTML forced, ~nope.\n");
        final var document = parse(root, ParserOptions.defaults().withClock(ParseSupport.fixedClock));

        assertThat(diagnostics.isEmpty()).isTrue();
        final var parts = ((Line.Text) ((Block.Paragraph) document.blocks().get(0)).lines().get(0)).parts();
        assertThat(parts).filteredOn(part -> part instanceof Inline.GlossaryRef)
            .extracting(part -> ((Inline.GlossaryRef) part).reference().display())
            .containsExactly(
                "Hypertext Markup Language (HTML)",
                "HTML",
                "Hypertext Markup Language (HTML)",
                "~nope"
            );
        assertThat(document.sources()).contains(normalized(directory.resolve("Glossary.toml")));
    }

    @Test
    void automaticIncludesCanBeDisabled(@TempDir final Path directory) throws IOException {
        write(directory, "Glossary.toml",
            "[HTML]\n" +
            "long = \"Hypertext Markup Language\"\n" +
            "description = \"The markup language of the web\"\n"
        );
        final var root = write(directory, "root.md", "~HTML\n");
        final var document = parse(root, ParseSupport.options());

        final var parts = ((Line.Text) ((Block.Paragraph) document.blocks().get(0)).lines().get(0)).parts();
        assertThat(((Inline.GlossaryRef) parts.get(0)).reference().display()).isEqualTo("~HTML");
    }

    @Test
    void stylesheetImportIsRegistered(@TempDir final Path directory) throws IOException {
        final var stylesheet = write(directory, "theme.css", "body { color: black; }\n");
        final var root = write(directory, "root.md", "<[theme.css]\n\ntext\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(document.stylesheets()).extracting(PendingDownload::source)
            .containsExactly(normalized(stylesheet).toString());
        assertThat(document.blocks()).hasSize(1);
    }

    @Test
    void handlerCanSkipImport(@TempDir final Path directory) throws IOException {
        write(directory, "terms.toml",
            "[BAD]\n" +
            "description = \"No long form\"\n" +
            "\n" +
            "[HTML]\n" +
            "long = \"Hypertext Markup Language\"\n" +
            "description = \"The markup language of the web\"\n"
        );
        final var root = write(directory, "root.md", "<[terms.toml][type=glossary]\n\n~HTML\n");

        final Document document;
        try (final var handler = new Handler(signaled -> {
            if (signaled.condition() instanceof DefinitionErrorCondition) {
                final var restart = ConditionContext.findRestart(ImportResolver.skipImportRestart);
                if (restart != null) {
                    restart.unwindTo();
                }
            }
        })) {
            handler.use();
            document = parse(root, ParseSupport.options());
        }

        assertThat(diagnostics.conditionsOf(DefinitionErrorCondition.class)).hasSize(1);
        final var parts = ((Line.Text) ((Block.Paragraph) document.blocks().get(0)).lines().get(0)).parts();
        assertThat(((Inline.GlossaryRef) parts.get(0)).reference().display()).isEqualTo("~HTML");
    }

    @Test
    void malformedGlossaryEntryIsSkipped(@TempDir final Path directory) throws IOException {
        write(directory, "terms.toml",
            "[BAD]\n" +
            "description = \"No long form\"\n" +
            "\n" +
            "[HTML]\n" +
            "long = \"Hypertext Markup Language\"\n" +
            "description = \"The markup language of the web\"\n"
        );
        final var root = write(directory, "root.md", "<[terms.toml][type=glossary]\n\n~HTML\n");
        final var document = parse(root, ParseSupport.options());

        assertThat(diagnostics.conditionsOf(DefinitionErrorCondition.class)).hasSize(1);
        final var parts = ((Line.Text) ((Block.Paragraph) document.blocks().get(0)).lines().get(0)).parts();
        assertThat(((Inline.GlossaryRef) parts.get(0)).reference().display())
            .isEqualTo("Hypertext Markup Language (HTML)");
    }

    @Test
    void unreadableRootFileIsFatal(@TempDir final Path directory) {
        final var missing = directory.resolve("missing.md");
        final var error = catchThrowableOfType(
            () -> Parser.parseFile(missing, ParseSupport.options()),
            UnhandledErrorError.class
        );
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(IOExceptionCondition.class);
    }

    private Document parse(final Path root, final ParserOptions options) {
        try (final var handler = new Handler(diagnostics)) {
            handler.use();
            return Parser.parseFile(root, options);
        }
    }

    private static Path write(final Path directory, final String name, final String content) throws IOException {
        final var path = directory.resolve(name);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return path;
    }

    private static Path normalized(final Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String paragraphText(final Block block) {
        assertThat(block).isInstanceOf(Block.Paragraph.class);
        return lineText(((Block.Paragraph) block).lines().get(0));
    }

    private final Diagnostics diagnostics = new Diagnostics();
}
