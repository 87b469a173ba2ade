// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Random-access, backtracking access to source text.
 */
@NonNullByDefault
package quire.source;

import quire.util.annotation.NonNullByDefault;
