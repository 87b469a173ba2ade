// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import quire.tree.Block;

/**
 * The result of attempting to parse a block.
 */
sealed interface Outcome {
    /**
     * No block could be parsed here. The cursor is where it was before the attempt.
     */
    Outcome noMatch = new NoMatch();

    /**
     * The innermost open section has to be closed before the input at the cursor can be parsed: a heading no deeper
     * than that section was found, or an import, which is only allowed outside sections. Each enclosing section closes
     * in turn until one can accept the input.
     */
    Outcome closeSection = new CloseSection();

    record Parsed(Block block) implements Outcome {
    }

    record NoMatch() implements Outcome {
    }

    record CloseSection() implements Outcome {
    }
}
