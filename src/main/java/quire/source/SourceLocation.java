// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.source;

import java.nio.file.Path;
import quire.util.annotation.Nullable;

/**
 * A position in a source file.
 *
 * @param path   The file, or {@code null} for text that did not come from a file.
 * @param line   The 1-based line number.
 * @param column The 1-based column number.
 */
public record SourceLocation(@Nullable Path path, int line, int column) {
    /**
     * Formats the location as {@code path:line:column}, or {@code line:column} without a path.
     */
    @Override
    public String toString() {
        return (path == null) ? (line + ":" + column) : (path + ":" + line + ":" + column);
    }
}
