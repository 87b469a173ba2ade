// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.assembly;

import java.util.ArrayList;
import quire.tree.Block;
import quire.tree.Document;

/**
 * Replaces the imports of a document with the content of the imported documents.
 */
public final class Splicer {
    private Splicer() {
    }

    /**
     * Splices every import of {@code document}, recursively, then re-nests its sections with {@link SectionNester}.
     * <p>
     * An import whose document was parsed is replaced by that document's top-level blocks, and the imported
     * document's placeholders are added to the importer's registry. An import whose document never arrived, because
     * the import failed, is dropped, as are {@link Block.Null} blocks. Must only be called once every import task has
     * finished.
     */
    public static void splice(final Document document) {
        final var blocks = new ArrayList<Block>(document.blocks().size());
        for (final var block : document.blocks()) {
            if (block instanceof Block.Import importBlock) {
                final var imported = importBlock.document().value();
                if (imported != null) {
                    splice(imported);
                    blocks.addAll(imported.blocks());
                    document.registerPlaceholders(imported.placeholders());
                }
            } else if (block != Block.Null.INSTANCE) {
                blocks.add(block);
            }
        }
        document.replaceBlocks(SectionNester.nest(blocks));
    }
}
