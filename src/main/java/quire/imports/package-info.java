// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Handles {@code <[path]} import directives.
 * <p>
 * Documents are parsed concurrently: every document import becomes a task of the parse's
 * {@link quire.util.TaskGroup}, which the root parse joins before splicing. Configuration, bibliography, glossary and
 * stylesheet imports are handled at once on the thread that finds them.
 */
@NonNullByDefault
package quire.imports;

import quire.util.annotation.NonNullByDefault;
