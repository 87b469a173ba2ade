// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import quire.source.SourceLocation;
import quire.tree.Block;
import quire.tree.Metadata;
import quire.util.annotation.Nullable;

/**
 * Acts on the {@code <[path]} directives the grammar finds.
 */
@FunctionalInterface
public interface ImportDirectiveHandler {
    /**
     * Handles an import directive.
     *
     * @param path     The path as written.
     * @param metadata The metadata following the directive, if any.
     * @param location Where the directive is.
     * @return The block standing for the import in the tree: a {@link Block.Import} for a document import,
     * {@link Block.Null} otherwise.
     */
    Block handle(String path, @Nullable Metadata metadata, SourceLocation location);
}
