// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * State shared by all documents of one parse, and the pass that resolves placeholders, citations and glossary
 * references once every import has been parsed.
 */
@NonNullByDefault
package quire.references;

import quire.util.annotation.NonNullByDefault;
