// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

/**
 * The objects shared by the root document and every imported one. All of them are thread-safe, since import tasks use
 * them concurrently.
 */
public record SharedState(
    Configuration configuration,
    BibliographyManager bibliography,
    GlossaryManager glossary,
    DownloadRegistry downloads
) {
    /**
     * Creates fresh shared state with a default configuration.
     */
    public static SharedState create() {
        return new SharedState(
            Configuration.withDefaults(),
            new BibliographyManager(),
            new GlossaryManager(),
            new DownloadRegistry()
        );
    }
}
