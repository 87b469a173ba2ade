// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

/**
 * The title of a section.
 *
 * @param title  The title line.
 * @param anchor The link target: the title's source text with all whitespace removed. Not guaranteed to be unique.
 */
public record Header(Line title, String anchor) {
}
