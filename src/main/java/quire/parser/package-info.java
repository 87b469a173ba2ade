// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The entry point: parses a file or a string into a fully resolved {@link quire.tree.Document}.
 * <p>
 * Problems found while parsing are signaled as conditions; install a {@link quire.parser.Diagnostics} handler to
 * collect them.
 */
@NonNullByDefault
package quire.parser;

import quire.util.annotation.NonNullByDefault;
