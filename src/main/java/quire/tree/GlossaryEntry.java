// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

/**
 * A glossary entry loaded from a glossary file.
 *
 * @param shortForm   The abbreviation, which is also the key references use.
 * @param longForm    The spelled-out term.
 * @param description A description of the term.
 */
public record GlossaryEntry(String shortForm, String longForm, String description) {
}
