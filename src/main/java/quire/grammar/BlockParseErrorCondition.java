// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import quire.source.SourceLocation;
import quire.util.condition.Condition;

/**
 * A condition indicating that no block could be parsed at some position of a file. The rest of that file is skipped.
 */
public final class BlockParseErrorCondition extends Condition {
    BlockParseErrorCondition(final String message, final SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + "\n\t--> " + location;
    }

    private final SourceLocation location;
}
