// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.imports;

import java.nio.file.Path;
import java.util.ArrayList;
import quire.grammar.BlockGrammar;
import quire.source.Cursor;
import quire.tree.Document;
import quire.tree.ElementVisitor;
import quire.tree.ElementWalker;
import quire.tree.Placeholder;
import quire.util.Trace;
import quire.util.annotation.Nullable;

/**
 * Parses the text of one file into a document, submitting the file's document imports to the session's task group.
 */
public final class DocumentParser {
    private DocumentParser() {
    }

    /**
     * Parses one file.
     * <p>
     * The returned document still contains its imports; they are filled in by the import tasks and spliced once the
     * whole parse has joined. Its placeholder registry holds the placeholders of this file only.
     *
     * @param path The file the text was read from, or {@code null} for text given directly. Relative imports are
     *             resolved against the file's directory, or against the working directory if there is no file.
     * @param root Whether this is the document the parse started from.
     */
    public static Document parse(
        final String text,
        final @Nullable Path path,
        final boolean root,
        final ImportSession session
    ) {
        try (final var trace = new Trace(() -> "Parsing " + ((path == null) ? "the input text" : path))) {
            trace.use();
            final var cursor = new Cursor(text, path);
            final var importer = new ImportResolver(path, session);
            final var grammar = new BlockGrammar(cursor, session.shared().downloads(), importer);
            final var document = new Document(root, path, grammar.parseAll(), session.shared());
            final var placeholders = new ArrayList<Placeholder>();
            ElementWalker.walk(document.blocks(), new ElementVisitor() {
                @Override
                public void visitPlaceholder(final Placeholder placeholder) {
                    placeholders.add(placeholder);
                }
            });
            document.registerPlaceholders(placeholders);
            return document;
        }
    }
}
