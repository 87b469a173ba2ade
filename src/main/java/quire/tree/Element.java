// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

/**
 * Any node of the document tree: a {@link Block}, a {@link Line} or an {@link Inline}.
 */
public sealed interface Element permits Block, Line, Inline {
}
