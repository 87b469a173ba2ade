// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The document tree produced by the parser.
 * <p>
 * Blocks, lines and inlines form sealed hierarchies of mostly immutable records. The exceptions are sections and list
 * items, whose children are attached while the tree is assembled, and the deferred cells shared between a tree node and
 * the registry that resolves it.
 */
@NonNullByDefault
package quire.tree;

import quire.util.annotation.NonNullByDefault;
