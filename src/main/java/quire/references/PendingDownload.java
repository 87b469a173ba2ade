// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

/**
 * A resource an external collaborator should fetch. The parser only records it.
 *
 * @param source The path or URL as written in the document, or the resolved path for imported stylesheets.
 * @param kind   What the resource is used for.
 */
public record PendingDownload(String source, Kind kind) {
    public enum Kind {
        IMAGE,
        STYLESHEET,
    }
}
