// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Rebuilds the final nesting of sections and lists, and splices imported documents into their importers.
 */
@NonNullByDefault
package quire.assembly;

import quire.util.annotation.NonNullByDefault;
