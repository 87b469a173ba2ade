// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import quire.references.PendingDownload;
import quire.references.SharedState;
import quire.util.annotation.Nullable;

/**
 * A parsed document: the root document given to the parser, or a child document produced by one import.
 * <p>
 * A child shares its {@link SharedState} with the root. Once the root document is returned by the parser, its blocks
 * include the spliced content of every import and its deferred cells are all settled.
 */
public final class Document {
    /**
     * Initializes a new document.
     *
     * @param root   Whether this is the document the parse started from.
     * @param path   The file the document was read from, or {@code null} for text given directly.
     * @param blocks The top-level blocks, in source order.
     * @param shared The state shared with every other document of the same parse.
     */
    public Document(
        final boolean root,
        final @Nullable Path path,
        final List<Block> blocks,
        final SharedState shared
    ) {
        this.root = root;
        this.path = path;
        this.blocks = new ArrayList<>(blocks);
        this.shared = shared;
    }

    public boolean isRoot() {
        return root;
    }

    public @Nullable Path path() {
        return path;
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Replaces the top-level blocks, as done when imports are spliced in.
     */
    public void replaceBlocks(final List<Block> newBlocks) {
        blocks.clear();
        blocks.addAll(newBlocks);
    }

    /**
     * Returns the placeholder registry: every placeholder occurring in this document and in the documents spliced into
     * it.
     */
    public List<Placeholder> placeholders() {
        return Collections.unmodifiableList(placeholders);
    }

    public void registerPlaceholders(final List<Placeholder> newPlaceholders) {
        placeholders.addAll(newPlaceholders);
    }

    public SharedState shared() {
        return shared;
    }

    /**
     * Returns the stylesheets imported anywhere in the parse, for an external collaborator to fetch.
     */
    public List<PendingDownload> stylesheets() {
        return shared.downloads().ofKind(PendingDownload.Kind.STYLESHEET);
    }

    /**
     * Returns every file that took part in the parse: the root file and all imported ones. Only filled in on the root
     * document.
     */
    public List<Path> sources() {
        return Collections.unmodifiableList(sources);
    }

    public void recordSources(final List<Path> paths) {
        sources.clear();
        sources.addAll(paths);
    }

    @Override
    public String toString() {
        return "Document[" + (root ? "root" : "child") + ", " + path + ", " + blocks + "]";
    }

    private final boolean root;
    private final @Nullable Path path;
    private final List<Block> blocks;
    private final List<Placeholder> placeholders = new ArrayList<>();
    private final SharedState shared;
    private final List<Path> sources = new ArrayList<>();
}
