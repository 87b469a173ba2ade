// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

/**
 * What a resolved {@link BibReference} points to.
 *
 * @param entry   The cited entry.
 * @param number  The 1-based position of the entry in order of first citation.
 * @param display The text to display at the citation.
 */
public record Citation(BibEntry entry, int number, String display) {
}
