// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.util.List;
import com.vdurmont.emoji.EmojiManager;
import quire.tree.Inline;
import quire.tree.MetadataValue;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import static quire.test.ParseSupport.parseInlines;
import static quire.test.ParseSupport.plainText;

final class InlineGrammarTest {
    @Test
    void escapedDelimitersStayPlain() {
        assertThat(parseInlines("\\*not bold\\*")).containsExactly(new Inline.Plain("*not bold*"));
    }

    @Test
    void boldAndItalic() {
        final var inlines = parseInlines("**bold** and *italic*");
        assertThat(inlines).hasSize(3);
        assertThat(inlines.get(0)).isEqualTo(new Inline.Bold(List.of(new Inline.Plain("bold"))));
        assertThat(inlines.get(1)).isEqualTo(new Inline.Plain(" and "));
        assertThat(inlines.get(2)).isEqualTo(new Inline.Italic(List.of(new Inline.Plain("italic"))));
    }

    @Test
    void otherFormatting() {
        final var inlines = parseInlines("_under_ ~~strike~~ `co*de*` ^sup^");
        assertThat(inlines).containsExactly(
            new Inline.Underlined(List.of(new Inline.Plain("under"))),
            new Inline.Plain(" "),
            new Inline.Striked(List.of(new Inline.Plain("strike"))),
            new Inline.Plain(" "),
            new Inline.Monospace("co*de*"),
            new Inline.Plain(" "),
            new Inline.Superscript(List.of(new Inline.Plain("sup")))
        );
    }

    @Test
    void nestedFormatting() {
        final var inlines = parseInlines("**bold _and under_**");
        assertThat(inlines).hasSize(1);
        final var bold = (Inline.Bold) inlines.get(0);
        assertThat(bold.value()).hasSize(2);
        assertThat(bold.value().get(1)).isInstanceOf(Inline.Underlined.class);
        assertThat(plainText(inlines)).isEqualTo("bold and under");
    }

    @ParameterizedTest
    @ValueSource(strings = {"**unclosed", "*", "a * b", "__"})
    void unmatchedDelimitersArePlain(final String text) {
        final var inlines = parseInlines(text);
        assertThat(inlines).allMatch(inline -> inline instanceof Inline.Plain);
        assertThat(plainText(inlines)).isEqualTo(text);
    }

    @Test
    void link() {
        assertThat(parseInlines("[Quire](https://example.com)"))
            .containsExactly(new Inline.Url("Quire", "https://example.com"));
    }

    @Test
    void imageWithMetadata() {
        final var inlines = parseInlines("![alt](img.png)[width=100]");
        assertThat(inlines).hasSize(1);
        final var image = (Inline.Image) inlines.get(0);
        assertThat(image.url()).isEqualTo(new Inline.Url("alt", "img.png"));
        assertThat(image.metadata()).isNotNull();
        assertThat(image.metadata().get("width")).isEqualTo(new MetadataValue.IntegerValue(100));
        assertThat(image.download().source()).isEqualTo("img.png");
    }

    @Test
    void emoji() {
        final var inlines = parseInlines("hi :smile:");
        assertThat(inlines).hasSize(2);
        final var smile = EmojiManager.getForAlias("smile").getUnicode();
        assertThat(inlines.get(1)).isEqualTo(new Inline.Emoji("smile", smile));
    }

    @Test
    void unknownEmojiIsPlain() {
        final var inlines = parseInlines(":notanemoji:");
        assertThat(inlines).noneMatch(inline -> inline instanceof Inline.Emoji);
        assertThat(plainText(inlines)).isEqualTo(":notanemoji:");
    }

    @Test
    void arrows() {
        assertThat(parseInlines("a --> b <==> c")).containsExactly(
            new Inline.Plain("a "),
            Inline.Arrow.RIGHT,
            new Inline.Plain(" b "),
            Inline.Arrow.BIG_LEFT_RIGHT,
            new Inline.Plain(" c")
        );
    }

    @Test
    void glossaryReferences() {
        final var inlines = parseInlines("~HTML and ~~CSS");
        assertThat(inlines).hasSize(3);
        final var html = ((Inline.GlossaryRef) inlines.get(0)).reference();
        final var css = ((Inline.GlossaryRef) inlines.get(2)).reference();
        assertThat(html.key()).isEqualTo("HTML");
        assertThat(html.forceLong()).isFalse();
        assertThat(css.key()).isEqualTo("CSS");
        assertThat(css.forceLong()).isTrue();
    }

    @Test
    void bibReference() {
        final var inlines = parseInlines("as shown[^knuth84].");
        assertThat(inlines).hasSize(3);
        assertThat(((Inline.BibRef) inlines.get(1)).reference().key()).isEqualTo("knuth84");
    }

    @Test
    void checkboxes() {
        final var inlines = parseInlines("[x] done [ ] todo");
        assertThat(inlines).containsExactly(
            new Inline.Checkbox(true),
            new Inline.Plain(" done "),
            new Inline.Checkbox(false),
            new Inline.Plain(" todo")
        );
    }

    @Test
    void coloredText() {
        assertThat(parseInlines("§[red]warning"))
            .containsExactly(new Inline.Colored("red", new Inline.Plain("warning")));
    }

    @Test
    void inlineMath() {
        assertThat(parseInlines("where $$x^2$$ holds")).containsExactly(
            new Inline.Plain("where "),
            new Inline.Math("x^2"),
            new Inline.Plain(" holds")
        );
    }

    @Test
    void characterCodes() {
        assertThat(parseInlines("&amp;")).containsExactly(new Inline.CharacterCode("amp"));
        assertThat(parseInlines("&#8212;")).containsExactly(new Inline.CharacterCode("#8212"));
        assertThat(parseInlines("a & b")).containsExactly(new Inline.Plain("a "), new Inline.Plain("& b"));
    }

    @Test
    void placeholderReference() {
        final var inlines = parseInlines("Today is [[date]].");
        assertThat(inlines).hasSize(3);
        assertThat(((Inline.PlaceholderRef) inlines.get(1)).placeholder().name()).isEqualTo("date");
    }
}
