// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used to report parse diagnostics without aborting the parse.
 */
@NonNullByDefault
package quire.util.condition;

import quire.util.annotation.NonNullByDefault;
