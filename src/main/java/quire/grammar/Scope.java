// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

/**
 * The context a grammar rule runs in. Immutable: nested constructs derive a new scope instead of modifying the
 * enclosing one, so nothing needs to be undone when a rule fails.
 *
 * @param inlineBreaks      Characters at which inline parsing stops, such as the cell delimiter inside a table row.
 * @param blockBreaks       Characters at which block parsing stops, such as the end of a template.
 * @param templateVariables Whether {@code {prefix{name}suffix}} variables are recognized.
 * @param sectionSize       The heading size of the innermost open section, or 0 if none is open.
 */
record Scope(String inlineBreaks, String blockBreaks, boolean templateVariables, int sectionSize) {
    /**
     * The scope of a file's top level.
     */
    static Scope topLevel() {
        return topLevel;
    }

    /**
     * The scope inside a {@code %...%} template.
     */
    static Scope template() {
        return template;
    }

    Scope withInlineBreak(final char c) {
        return (inlineBreaks.indexOf(c) >= 0)
            ? this
            : new Scope(inlineBreaks + c, blockBreaks, templateVariables, sectionSize);
    }

    Scope withSection(final int size) {
        return new Scope(inlineBreaks, blockBreaks, templateVariables, size);
    }

    private static final Scope topLevel = new Scope("", "", false, 0);
    private static final Scope template = new Scope(
        String.valueOf(Tokens.template),
        String.valueOf(Tokens.template),
        true,
        0
    );
}
