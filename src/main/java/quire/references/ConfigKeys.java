// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

/**
 * Names of the configuration keys the parser itself reads.
 */
public final class ConfigKeys {
    private ConfigKeys() {
    }

    /**
     * How a citation is displayed; {@code {{number}}}, {@code {{key}}} and entry fields are replaced.
     */
    public static final String bibRefDisplay = "bib-ref-display";
    public static final String language = "language";
    /**
     * File names whose imports are skipped silently.
     */
    public static final String ignoredImports = "ignored-imports";
    public static final String includedStylesheets = "included-stylesheets";
    public static final String includedConfigs = "included-configs";
    public static final String includedBibliography = "included-bibliography";
    public static final String includedGlossary = "included-glossary";
    /**
     * Whether renderers should display arrow ligatures as arrow characters.
     */
    public static final String smartArrows = "smart-arrows";
}
