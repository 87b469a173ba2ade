// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.imports;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import quire.grammar.ImportDirectiveHandler;
import quire.references.ConfigKeys;
import quire.references.PendingDownload;
import quire.references.TomlDefinitions;
import quire.source.SourceLocation;
import quire.tree.Block;
import quire.tree.Deferred;
import quire.tree.Document;
import quire.tree.Metadata;
import quire.util.UnreachableCodeReachedError;
import quire.util.annotation.Nullable;
import quire.util.condition.ConditionContext;

/**
 * Handles the import directives of one file.
 * <p>
 * Relative paths are resolved against the directory of the importing file. Files whose name is listed under
 * {@link ConfigKeys#ignoredImports} are skipped silently. A file that does not exist, or that already takes part in
 * the parse, which covers both cyclic and repeated imports, is reported with an {@link ImportErrorCondition} and
 * dropped.
 * <p>
 * Document imports run as tasks of the session's task group, each under a {@value #skipImportRestart} restart so a
 * handler can abandon a failing import. Other kinds of imports are loaded immediately.
 */
public final class ImportResolver implements ImportDirectiveHandler {
    /**
     * Name of the restart established around every import.
     */
    public static final String skipImportRestart = "skip-import";

    /**
     * Initializes a new resolver for the imports of the given file.
     *
     * @param file The importing file, or {@code null} for text given directly.
     */
    public ImportResolver(final @Nullable Path file, final ImportSession session) {
        final var parent = (file == null) ? null : file.toAbsolutePath().getParent();
        this.directory = (parent == null) ? Path.of("").toAbsolutePath() : parent;
        this.session = session;
    }

    @Override
    public Block handle(final String path, final @Nullable Metadata metadata, final SourceLocation location) {
        final var resolved = resolve(path, location);
        if (resolved == null || isIgnored(resolved)) {
            return Block.Null.INSTANCE;
        }
        if (!Files.isRegularFile(resolved)) {
            ConditionContext.signal(new ImportErrorCondition("Imported file does not exist", resolved, location));
            return Block.Null.INSTANCE;
        }
        if (!session.claim(resolved)) {
            ConditionContext.signal(new ImportErrorCondition(
                "Cyclic or repeated import, the file is already part of the document", resolved, location));
            return Block.Null.INSTANCE;
        }

        final var kind = ImportKind.of(resolved, metadata);
        if (kind == ImportKind.DOCUMENT) {
            return importDocument(resolved, location);
        }
        ConditionContext.withRestart(skipImportRestart, restart -> {
            load(kind, resolved, location);
            return null;
        });
        return Block.Null.INSTANCE;
    }

    /**
     * Loads the files named by the {@code included-*} configuration keys that exist next to the importing file and
     * are not part of the parse yet: configuration files first, then stylesheets, bibliographies and glossaries.
     */
    public void applyAutoIncludes() {
        includeAll(ConfigKeys.includedConfigs, ImportKind.CONFIG);
        includeAll(ConfigKeys.includedStylesheets, ImportKind.STYLESHEET);
        includeAll(ConfigKeys.includedBibliography, ImportKind.BIBLIOGRAPHY);
        includeAll(ConfigKeys.includedGlossary, ImportKind.GLOSSARY);
    }

    private void includeAll(final String key, final ImportKind kind) {
        for (final var name : session.shared().configuration().strings(key)) {
            final var resolved = resolve(name, null);
            if (resolved != null && Files.isRegularFile(resolved) && session.claim(resolved)) {
                ConditionContext.withRestart(skipImportRestart, restart -> {
                    load(kind, resolved, null);
                    return null;
                });
            }
        }
    }

    private Block importDocument(final Path path, final SourceLocation location) {
        final var cell = new Deferred<Document>();
        session.tasks().submit(() -> "Importing " + path, () -> ConditionContext.withRestart(
            skipImportRestart,
            restart -> {
                final String text;
                try {
                    text = Files.readString(path);
                } catch (final IOException e) {
                    ConditionContext.signal(new ImportErrorCondition(
                        "Unable to read imported file (" + e.getMessage() + ")", path, location));
                    return null;
                }
                cell.resolve(DocumentParser.parse(text, path, false, session));
                return null;
            }
        ));
        return new Block.Import(path, cell);
    }

    private void load(final ImportKind kind, final Path path, final @Nullable SourceLocation location) {
        final var shared = session.shared();
        try {
            switch (kind) {
                case STYLESHEET -> shared.downloads().register(path.toString(), PendingDownload.Kind.STYLESHEET);
                case BIBLIOGRAPHY -> TomlDefinitions.readBibliography(path).forEach(shared.bibliography()::define);
                case CONFIG -> shared.configuration().merge(TomlDefinitions.readConfiguration(path));
                case GLOSSARY -> TomlDefinitions.readGlossary(path).forEach(shared.glossary()::define);
                case DOCUMENT -> throw new UnreachableCodeReachedError("Documents are imported by a task");
            }
        } catch (final IOException e) {
            ConditionContext.signal(new ImportErrorCondition(
                "Unable to read imported file (" + e.getMessage() + ")", path, location));
        }
    }

    private @Nullable Path resolve(final String path, final @Nullable SourceLocation location) {
        try {
            return directory.resolve(path).toAbsolutePath().normalize();
        } catch (final InvalidPathException e) {
            ConditionContext.signal(
                new ImportErrorCondition("Invalid import path '" + path + "'", directory, location));
            return null;
        }
    }

    private boolean isIgnored(final Path path) {
        final var fileName = path.getFileName();
        return fileName != null
            && session.shared().configuration().strings(ConfigKeys.ignoredImports).contains(fileName.toString());
    }

    private final Path directory;
    private final ImportSession session;
}
