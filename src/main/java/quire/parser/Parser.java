// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import quire.assembly.Splicer;
import quire.imports.DocumentParser;
import quire.imports.ImportResolver;
import quire.imports.ImportSession;
import quire.references.ReferenceResolver;
import quire.references.SharedState;
import quire.tree.Document;
import quire.util.TaskGroup;
import quire.util.Trace;
import quire.util.annotation.Nullable;
import quire.util.condition.ConditionContext;
import quire.util.condition.exception.IOExceptionCondition;

/**
 * Parses documents.
 * <p>
 * A parse runs the grammar over the root text, which submits a task for every document import; imported documents
 * submit their own imports the same way. Once every task has finished, the automatic includes are loaded, the imports
 * are spliced into place, and a single {@link ReferenceResolver} pass settles every placeholder, citation and
 * glossary reference.
 * <p>
 * Only failing to read the root file is fatal. Everything else, such as unparseable input or failed imports, is
 * signaled as a warning and leaves the affected part out of the document.
 */
public final class Parser {
    private Parser() {
    }

    /**
     * Parses a file with default options.
     */
    public static Document parseFile(final Path path) {
        return parseFile(path, ParserOptions.defaults());
    }

    /**
     * Parses a file.
     * <p>
     * If the file cannot be read, a fatal {@link IOExceptionCondition} is signaled.
     */
    public static Document parseFile(final Path path, final ParserOptions options) {
        final var absolute = path.toAbsolutePath().normalize();
        final String text;
        try {
            text = Files.readString(absolute);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition("Unable to read " + absolute, e));
        }
        return parse(text, absolute, options);
    }

    /**
     * Parses text that does not come from a file. Imports are resolved against the working directory.
     */
    public static Document parseText(final String text, final ParserOptions options) {
        return parse(text, null, options);
    }

    private static Document parse(final String text, final @Nullable Path path, final ParserOptions options) {
        final var providedExecutor = options.executor();
        if (providedExecutor != null) {
            return parse(text, path, options, providedExecutor);
        }
        final var executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));
        try {
            return parse(text, path, options, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Document parse(
        final String text,
        final @Nullable Path path,
        final ParserOptions options,
        final ExecutorService executor
    ) {
        try (final var trace = new Trace(() -> "Parsing document " + ((path == null) ? "from text" : path))) {
            trace.use();
            final var shared = SharedState.create();
            shared.configuration().merge(options.configuration());
            final var tasks = new TaskGroup(executor);
            final var session = new ImportSession(shared, tasks);
            if (path != null) {
                session.claim(path);
            }

            final var document = DocumentParser.parse(text, path, true, session);
            tasks.awaitAll();
            if (options.autoIncludes()) {
                new ImportResolver(path, session).applyAutoIncludes();
            }
            Splicer.splice(document);
            document.recordSources(session.sources());
            new ReferenceResolver(options.clock()).resolve(document);
            return document;
        }
    }
}
