// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.imports;

import java.nio.file.Path;
import quire.source.SourceLocation;
import quire.util.annotation.Nullable;
import quire.util.condition.Condition;

/**
 * A condition indicating that an import could not be performed: the file does not exist, is already being imported
 * elsewhere in the same parse, or could not be read. The import is dropped; the rest of the importing document is
 * unaffected.
 */
public final class ImportErrorCondition extends Condition {
    ImportErrorCondition(final String message, final Path path, final @Nullable SourceLocation location) {
        super(message);
        this.path = path;
        this.location = location;
    }

    /**
     * Returns the absolute path of the imported file.
     */
    public Path path() {
        return path;
    }

    /**
     * Returns the location of the import directive, or {@code null} for an automatic include.
     */
    public @Nullable SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return (location == null)
            ? (message() + ": " + path)
            : (message() + ": " + path + "\n\t--> " + location);
    }

    private final Path path;
    private final @Nullable SourceLocation location;
}
