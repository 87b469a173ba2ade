// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;
import com.vdurmont.emoji.EmojiManager;
import quire.references.DownloadRegistry;
import quire.references.PendingDownload;
import quire.source.Cursor;
import quire.tree.BibReference;
import quire.tree.Block;
import quire.tree.ElementVisitor;
import quire.tree.ElementWalker;
import quire.tree.GlossaryReference;
import quire.tree.Inline;
import quire.tree.Metadata;
import quire.tree.MetadataValue;
import quire.tree.Placeholder;
import quire.tree.Template;
import quire.tree.TemplateVariable;
import quire.util.annotation.Nullable;

/**
 * The rules for formatted text within a line, plus metadata and templates, which may appear inline.
 * <p>
 * Every rule either returns its result with the cursor after the matched text, or returns {@code null} with the
 * cursor where it was. Plain text is the last alternative and always consumes at least one character, so
 * {@link #parseInline(Scope)} only fails at the end of a line or at a break character of the scope.
 */
abstract sealed class InlineGrammar permits LineGrammar {
    InlineGrammar(final Cursor cursor, final DownloadRegistry downloads) {
        this.cursor = cursor;
        this.downloads = downloads;
    }

    /**
     * Parses one block in the given scope. Needed here because templates contain blocks.
     */
    abstract Outcome parseBlock(Scope scope);

    /**
     * Parses one inline element.
     */
    final @Nullable Inline parseInline(final Scope scope) {
        if (cursor.atEnd() || cursor.checkLinebreak() || cursor.checkAny(scope.inlineBreaks())) {
            return null;
        }
        depth += 1;
        try {
            if (depth > maxDepth) {
                return parsePlain(scope);
            }
            final var result = parseConstruct(scope);
            return (result != null) ? result : parsePlain(scope);
        } finally {
            depth -= 1;
        }
    }

    private @Nullable Inline parseConstruct(final Scope scope) {
        if (scope.templateVariables()) {
            final var variable = parseTemplateVariable();
            if (variable != null) {
                return new Inline.TemplateVar(variable);
            }
        }
        for (final var rule : rules) {
            final var result = rule.apply(scope);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private @Nullable Inline parseImage(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.imageStart)) {
            return null;
        }
        final var url = parseLink(true);
        if (url == null) {
            cursor.rewind(start);
            return null;
        }
        final var metadata = parseMetadata();
        return new Inline.Image(url, metadata, downloads.register(url.url(), PendingDownload.Kind.IMAGE));
    }

    private @Nullable Inline parseUrl(final Scope scope) {
        return parseLink(false);
    }

    /**
     * Parses {@code [description](url)}, or also a bare {@code (url)} if {@code descriptionOptional}.
     */
    private Inline.@Nullable Url parseLink(final boolean descriptionOptional) {
        final var start = cursor.mark();
        @Nullable String description = null;
        if (cursor.matchChar(Tokens.descriptionOpen)) {
            final var text = cursor.scanUntil(String.valueOf(Tokens.descriptionClose), "\n");
            if (text == null) {
                cursor.rewind(start);
                return null;
            }
            cursor.advance();
            description = text.isBlank() ? null : text;
        } else if (!descriptionOptional) {
            return null;
        }
        if (!cursor.matchChar(Tokens.urlOpen)) {
            cursor.rewind(start);
            return null;
        }
        cursor.skipInlineWhitespace();
        final var url = cursor.scanUntil(String.valueOf(Tokens.urlClose), "\n");
        if (url == null || url.isBlank()) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        return new Inline.Url(description, url.trim());
    }

    private @Nullable Inline parsePlaceholderRef(final Scope scope) {
        final var placeholder = parsePlaceholder();
        return (placeholder == null) ? null : new Inline.PlaceholderRef(placeholder);
    }

    /**
     * Parses a {@code [[name]]} placeholder with optional metadata.
     */
    final @Nullable Placeholder parsePlaceholder() {
        final var start = cursor.mark();
        if (!cursor.matchSequence(Tokens.placeholderOpen)) {
            return null;
        }
        final var name = cursor.scanUntilSequence(Tokens.placeholderClose, "\n");
        if (name == null || name.isBlank()) {
            cursor.rewind(start);
            return null;
        }
        cursor.matchSequence(Tokens.placeholderClose);
        return new Placeholder(name.trim(), parseMetadata());
    }

    private @Nullable Inline parseBold(final Scope scope) {
        final var body = parseDelimited(Tokens.bold, Tokens.bold, scope);
        return (body == null) ? null : new Inline.Bold(body);
    }

    private @Nullable Inline parseItalic(final Scope scope) {
        final var delimiter = String.valueOf(Tokens.italic);
        final var body = parseDelimited(delimiter, delimiter, scope);
        return (body == null) ? null : new Inline.Italic(body);
    }

    private @Nullable Inline parseUnderlined(final Scope scope) {
        final var delimiter = String.valueOf(Tokens.underline);
        final var body = parseDelimited(delimiter, delimiter, scope);
        return (body == null) ? null : new Inline.Underlined(body);
    }

    private @Nullable Inline parseStriked(final Scope scope) {
        final var body = parseDelimited(Tokens.striked, Tokens.striked, scope);
        return (body == null) ? null : new Inline.Striked(body);
    }

    private @Nullable Inline parseSuperscript(final Scope scope) {
        final var delimiter = String.valueOf(Tokens.superscript);
        final var body = parseDelimited(delimiter, delimiter, scope);
        return (body == null) ? null : new Inline.Superscript(body);
    }

    /**
     * Parses a non-empty sequence of inline elements between {@code open} and {@code close} on the same line.
     */
    private @Nullable List<Inline> parseDelimited(final String open, final String close, final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchSequence(open)) {
            return null;
        }
        final var body = new ArrayList<Inline>();
        while (true) {
            if (!body.isEmpty() && cursor.matchSequence(close)) {
                return body;
            }
            final var inline = parseInline(scope);
            if (inline == null) {
                cursor.rewind(start);
                return null;
            }
            body.add(inline);
        }
    }

    private @Nullable Inline parseMonospace(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.monospace)) {
            return null;
        }
        final var code = cursor.scanUntil(String.valueOf(Tokens.monospace), "\n");
        if (code == null) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        return new Inline.Monospace(code);
    }

    private @Nullable Inline parseGlossaryRef(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.glossary)) {
            return null;
        }
        final var forceLong = cursor.matchChar(Tokens.glossary);
        final var keyStart = cursor.mark();
        while (!cursor.atEnd() && isGlossaryKeyChar(cursor.current())) {
            cursor.advance();
        }
        if (cursor.mark() == keyStart) {
            cursor.rewind(start);
            return null;
        }
        return new Inline.GlossaryRef(new GlossaryReference(cursor.slice(keyStart, cursor.mark()), forceLong));
    }

    private @Nullable Inline parseCheckbox(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.checkboxOpen)) {
            return null;
        }
        final var checked = cursor.matchAny(Tokens.checked) != null;
        if ((checked || cursor.matchChar(' ')) && cursor.matchChar(Tokens.checkboxClose)) {
            return new Inline.Checkbox(checked);
        }
        cursor.rewind(start);
        return null;
    }

    private @Nullable Inline parseEmoji(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.emoji)) {
            return null;
        }
        final var name = cursor.scanUntil(String.valueOf(Tokens.emoji), " \t\n");
        if (name == null || name.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        final var emoji = EmojiManager.getForAlias(name);
        if (emoji == null) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        return new Inline.Emoji(name, emoji.getUnicode());
    }

    private @Nullable Inline parseColored(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchSequence(Tokens.colorOpen)) {
            return null;
        }
        final var color = cursor.scanUntil(String.valueOf(Tokens.metadataClose), " \n;");
        if (color == null || color.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        final var value = parseInline(scope);
        if (value == null) {
            cursor.rewind(start);
            return null;
        }
        return new Inline.Colored(color, value);
    }

    private @Nullable Inline parseBibRef(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchSequence(Tokens.bibReferenceOpen)) {
            return null;
        }
        final var key = cursor.scanUntil(String.valueOf(Tokens.metadataClose), " \n");
        if (key == null || key.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        return new Inline.BibRef(new BibReference(key));
    }

    private @Nullable Inline parseMath(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchSequence(Tokens.inlineMath)) {
            return null;
        }
        final var expression = cursor.scanUntilSequence(Tokens.inlineMath, "\n");
        if (expression == null || expression.isBlank()) {
            cursor.rewind(start);
            return null;
        }
        cursor.matchSequence(Tokens.inlineMath);
        return new Inline.Math(expression);
    }

    private @Nullable Inline parseCharacterCode(final Scope scope) {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.characterCodeStart)) {
            return null;
        }
        final var code = cursor.scanUntil(String.valueOf(Tokens.characterCodeEnd), " \t\n&");
        if (code == null || !characterCodePattern.matcher(code).matches()) {
            cursor.rewind(start);
            return null;
        }
        cursor.advance();
        return new Inline.CharacterCode(code);
    }

    private @Nullable Inline parseArrow(final Scope scope) {
        for (final var arrow : Inline.Arrow.values()) {
            if (cursor.matchSequence(arrow.source())) {
                return arrow;
            }
        }
        return null;
    }

    private @Nullable TemplateVariable parseTemplateVariable() {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.variableOpen)) {
            return null;
        }
        final var prefix = cursor.scanUntil(String.valueOf(Tokens.variableOpen), "\n");
        if (prefix != null) {
            cursor.advance();
            final var name = cursor.scanUntil(String.valueOf(Tokens.variableClose), "\n");
            if (name != null && !name.isBlank()) {
                cursor.advance();
                final var suffix = cursor.scanUntil(String.valueOf(Tokens.variableClose), "\n");
                if (suffix != null) {
                    cursor.advance();
                    return new TemplateVariable(prefix, name.trim(), suffix);
                }
            }
        }
        cursor.rewind(start);
        return null;
    }

    /**
     * Parses plain text: at least one character, up to the next character that may start another construct.
     * Backslash escapes are removed.
     */
    private @Nullable Inline parsePlain(final Scope scope) {
        final var text = new StringBuilder();
        var first = true;
        while (!cursor.atEnd() && !cursor.checkLinebreak()) {
            if (!first && stopsPlainText(scope)) {
                break;
            }
            first = false;
            final var c = cursor.current();
            cursor.advance();
            if (c == Cursor.escape && !cursor.atEnd() && !cursor.checkLinebreak()) {
                text.append(cursor.current());
                cursor.advance();
            } else {
                text.append(c);
            }
        }
        return text.isEmpty() ? null : new Inline.Plain(text.toString());
    }

    private boolean stopsPlainText(final Scope scope) {
        if (cursor.checkAny(Tokens.inlineSpecials) || cursor.checkAny(scope.inlineBreaks())) {
            return true;
        }
        if (scope.templateVariables() && cursor.checkChar(Tokens.variableOpen)) {
            return true;
        }
        if (cursor.checkSequence(Tokens.inlineMath)) {
            return true;
        }
        for (final var arrow : Inline.Arrow.values()) {
            if (cursor.checkSequence(arrow.source())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses a {@code [name=value, flag]} metadata block.
     * <p>
     * Values are placeholders, templates, quoted strings, or bare words typed as booleans, integers, floating-point
     * numbers or text, in that order of preference. A name without a value is the boolean {@code true}. Anything
     * malformed, including an empty block, makes the whole block fail to parse.
     */
    final @Nullable Metadata parseMetadata() {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.metadataOpen) || cursor.checkChar(Tokens.metadataOpen)) {
            cursor.rewind(start);
            return null;
        }
        final var entries = new LinkedHashMap<String, MetadataValue>();
        while (true) {
            cursor.skipInlineWhitespace();
            if (cursor.matchChar(Tokens.metadataClose)) {
                break;
            }
            if (!entries.isEmpty() && !cursor.matchChar(Tokens.metadataSeparator)) {
                cursor.rewind(start);
                return null;
            }
            cursor.skipInlineWhitespace();
            final var name = scanMetadataWord();
            if (name.isEmpty()) {
                cursor.rewind(start);
                return null;
            }
            cursor.skipInlineWhitespace();
            if (!cursor.matchChar(Tokens.metadataAssign)) {
                entries.put(name, new MetadataValue.Bool(true));
                continue;
            }
            cursor.skipInlineWhitespace();
            final var value = parseMetadataValue();
            if (value == null) {
                cursor.rewind(start);
                return null;
            }
            entries.put(name, value);
        }
        if (entries.isEmpty()) {
            cursor.rewind(start);
            return null;
        }
        return new Metadata(entries);
    }

    private @Nullable MetadataValue parseMetadataValue() {
        final var placeholder = parsePlaceholder();
        if (placeholder != null) {
            return new MetadataValue.PlaceholderValue(placeholder);
        }
        final var template = parseTemplate();
        if (template != null) {
            return new MetadataValue.TemplateValue(template);
        }
        final var quote = cursor.matchAny(Tokens.quotes);
        if (quote != null) {
            final var text = cursor.scanUntil(String.valueOf(quote.charValue()), "\n");
            if (text == null) {
                return null;
            }
            cursor.advance();
            return new MetadataValue.Text(unescape(text));
        }
        final var word = scanMetadataWord().trim();
        if (word.isEmpty()) {
            return null;
        }
        return typedValue(word);
    }

    private String scanMetadataWord() {
        final var start = cursor.mark();
        while (!cursor.atEnd()
            && !cursor.checkLinebreak()
            && !cursor.checkChar(Tokens.metadataClose)
            && !cursor.checkChar(Tokens.metadataSeparator)
            && !cursor.checkChar(Tokens.metadataAssign)) {
            cursor.advance();
        }
        return cursor.slice(start, cursor.mark()).trim();
    }

    private static MetadataValue typedValue(final String word) {
        if (word.equalsIgnoreCase("true") || word.equalsIgnoreCase("false")) {
            return new MetadataValue.Bool(Boolean.parseBoolean(word));
        }
        if (integerPattern.matcher(word).matches()) {
            try {
                return new MetadataValue.IntegerValue(Long.parseLong(word));
            } catch (final NumberFormatException e) {
                // Out of range for a long, so keep it as text.
                return new MetadataValue.Text(word);
            }
        }
        if (floatPattern.matcher(word).matches()) {
            return new MetadataValue.FloatValue(Double.parseDouble(word));
        }
        return new MetadataValue.Text(unescape(word));
    }

    /**
     * Parses a {@code %...%} template: blocks in which {@code {prefix{name}suffix}} variables are recognized.
     */
    final @Nullable Template parseTemplate() {
        final var start = cursor.mark();
        if (!cursor.matchChar(Tokens.template) || cursor.checkChar(Tokens.template)) {
            cursor.rewind(start);
            return null;
        }
        final var blocks = new ArrayList<Block>();
        while (!cursor.checkChar(Tokens.template)) {
            if (!(parseBlock(Scope.template()) instanceof Outcome.Parsed parsed)) {
                break;
            }
            blocks.add(parsed.block());
        }
        if (!cursor.matchChar(Tokens.template)) {
            cursor.rewind(start);
            return null;
        }
        final var variables = new ArrayList<TemplateVariable>();
        ElementWalker.walk(blocks, new ElementVisitor() {
            @Override
            public void visitTemplateVariable(final TemplateVariable variable) {
                variables.add(variable);
            }
        });
        return new Template(blocks, variables);
    }

    private static boolean isGlossaryKeyChar(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static String unescape(final String text) {
        if (text.indexOf(Cursor.escape) < 0) {
            return text;
        }
        final var result = new StringBuilder(text.length());
        for (var i = 0; i < text.length(); i += 1) {
            final var c = text.charAt(i);
            if (c == Cursor.escape && i + 1 < text.length()) {
                i += 1;
                result.append(text.charAt(i));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    final Cursor cursor;
    private final DownloadRegistry downloads;
    private int depth = 0;

    // Order matters: earlier rules take precedence over later ones at the same position.
    private final List<Function<Scope, @Nullable Inline>> rules = List.of(
        this::parseImage,
        this::parseUrl,
        this::parsePlaceholderRef,
        this::parseBold,
        this::parseItalic,
        this::parseUnderlined,
        this::parseMonospace,
        this::parseStriked,
        this::parseGlossaryRef,
        this::parseSuperscript,
        this::parseCheckbox,
        this::parseEmoji,
        this::parseColored,
        this::parseBibRef,
        this::parseMath,
        this::parseCharacterCode,
        this::parseArrow
    );

    private static final int maxDepth = 64;
    private static final Pattern characterCodePattern =
        Pattern.compile("[A-Za-z][A-Za-z0-9]*|#[0-9]+|#[xX][0-9A-Fa-f]+");
    private static final Pattern integerPattern = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern floatPattern = Pattern.compile("[+-]?[0-9]*\\.[0-9]+([eE][+-]?[0-9]+)?");
}
