// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.imports;

import java.nio.file.Path;
import java.util.Locale;
import quire.tree.Metadata;
import quire.util.annotation.Nullable;

/**
 * What an imported file is used for.
 */
public enum ImportKind {
    DOCUMENT,
    STYLESHEET,
    BIBLIOGRAPHY,
    CONFIG,
    GLOSSARY;

    /**
     * Determines the kind of an import from the {@code type} metadata entry if it names a known kind, otherwise from
     * the file name: {@code .bib.toml} is a bibliography, {@code .css} a stylesheet, any other {@code .toml} a
     * configuration file, anything else a document.
     */
    public static ImportKind of(final Path path, final @Nullable Metadata metadata) {
        final var type = (metadata == null) ? null : metadata.text(typeKey);
        if (type != null) {
            final var byType = switch (type.toLowerCase(Locale.ROOT)) {
                case "document" -> DOCUMENT;
                case "stylesheet" -> STYLESHEET;
                case "bibliography" -> BIBLIOGRAPHY;
                case "config", "manifest" -> CONFIG;
                case "glossary" -> GLOSSARY;
                default -> null;
            };
            if (byType != null) {
                return byType;
            }
        }
        final var fileName = path.getFileName();
        final var name = (fileName == null) ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".bib.toml")) {
            return BIBLIOGRAPHY;
        } else if (name.endsWith(".css")) {
            return STYLESHEET;
        } else if (name.endsWith(".toml")) {
            return CONFIG;
        }
        return DOCUMENT;
    }

    private static final String typeKey = "type";
}
