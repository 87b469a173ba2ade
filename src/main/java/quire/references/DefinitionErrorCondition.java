// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.nio.file.Path;
import quire.util.condition.Condition;

/**
 * A condition indicating that an entry of a bibliography, glossary or configuration file was malformed and skipped.
 */
public final class DefinitionErrorCondition extends Condition {
    DefinitionErrorCondition(final String message, final Path file) {
        super(message);
        this.file = file;
    }

    /**
     * Returns the file containing the malformed entry.
     */
    public Path file() {
        return file;
    }

    @Override
    public String detailedMessage() {
        return message() + "\n\t--> " + file;
    }

    private final Path file;
}
