// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

/**
 * Receives the nodes of interest found by {@link ElementWalker}. Every method does nothing by default.
 */
public interface ElementVisitor {
    default void visitPlaceholder(final Placeholder placeholder) {
    }

    default void visitBibReference(final BibReference reference) {
    }

    default void visitBibEntry(final BibEntry entry) {
    }

    default void visitGlossaryReference(final GlossaryReference reference) {
    }

    default void visitTemplateVariable(final TemplateVariable variable) {
    }
}
