// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The recursive-descent grammar turning the text of one file into blocks.
 * <p>
 * The grammar is layered: {@link quire.grammar.InlineGrammar} handles formatting within a line,
 * {@link quire.grammar.LineGrammar} whole lines and {@link quire.grammar.BlockGrammar} blocks. Every rule marks the
 * cursor position, attempts a match, and rewinds on failure, so alternatives are tried from the same position until
 * one matches.
 */
@NonNullByDefault
package quire.grammar;

import quire.util.annotation.NonNullByDefault;
