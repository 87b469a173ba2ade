// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import java.util.List;

/**
 * Characters and character sequences with a meaning in the markup.
 */
final class Tokens {
    private Tokens() {
    }

    static final char linebreak = '\n';
    static final char hash = '#';
    static final char pipe = '|';
    static final char quoteStart = '>';
    static final char metadataOpen = '[';
    static final char metadataClose = ']';
    static final char metadataAssign = '=';
    static final char metadataSeparator = ',';
    static final char template = '%';
    static final char variableOpen = '{';
    static final char variableClose = '}';
    static final char italic = '*';
    static final char underline = '_';
    static final char superscript = '^';
    static final char monospace = '`';
    static final char glossary = '~';
    static final char emoji = ':';
    static final char imageStart = '!';
    static final char descriptionOpen = '[';
    static final char descriptionClose = ']';
    static final char urlOpen = '(';
    static final char urlClose = ')';
    static final char checkboxOpen = '[';
    static final char checkboxClose = ']';
    static final char characterCodeStart = '&';
    static final char characterCodeEnd = ';';
    static final char bibEntryData = ':';
    static final char listOrderedSuffix = '.';

    static final String bold = "**";
    static final String striked = "~~";
    static final String ruler = "- - -";
    static final String centered = "||";
    static final String codeFence = "```";
    static final String mathFence = "$$$";
    static final String inlineMath = "$$";
    static final String importStart = "<[";
    static final String placeholderOpen = "[[";
    static final String placeholderClose = "]]";
    static final String bibReferenceOpen = "[^";
    static final String colorOpen = "§[";

    static final String inlineWhitespace = " \t\r";
    static final String quotes = "\"'";
    static final String listMarkers = "-+*o";
    static final String checked = "xX";

    /**
     * Characters at which plain text stops, so that the construct they may start gets a chance to match.
     */
    static final String inlineSpecials = "`~_*[!(^:§&";

    /**
     * Line beginnings that end a paragraph because a different block starts there.
     */
    static final List<String> blockStarts = List.of(
        "#",
        "- ",
        codeFence,
        mathFence,
        "|",
        ">",
        importStart,
        centered
    );
}
