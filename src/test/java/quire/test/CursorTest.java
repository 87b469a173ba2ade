// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.nio.file.Path;
import java.util.List;
import quire.source.Cursor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class CursorTest {
    @ParameterizedTest
    @ValueSource(strings = {"abc", "abc\n", "abc\r\n"})
    void everyLineIsTerminated(final String text) {
        final var cursor = new Cursor(text, null);
        assertThat(cursor.scanUntil("\n", "")).isEqualTo("abc");
        assertThat(cursor.matchChar('\n')).isTrue();
        assertThat(cursor.atEnd()).isTrue();
    }

    @Test
    void rewindRestoresPosition() {
        final var cursor = new Cursor("hello", null);
        final var start = cursor.mark();
        assertThat(cursor.matchSequence("hel")).isTrue();
        assertThat(cursor.current()).isEqualTo('l');
        cursor.rewind(start);
        assertThat(cursor.current()).isEqualTo('h');
    }

    @Test
    void escapedCharactersAreNotSpecial() {
        final var cursor = new Cursor("\\*x", null);
        cursor.advance();
        assertThat(cursor.isEscaped()).isTrue();
        assertThat(cursor.checkChar('*')).isFalse();
        assertThat(cursor.checkAny("*_")).isFalse();
        assertThat(cursor.matchSequence("*x")).isFalse();
    }

    @Test
    void doubleBackslashDoesNotEscape() {
        final var cursor = new Cursor("\\\\*", null);
        cursor.advance();
        cursor.advance();
        assertThat(cursor.checkChar('*')).isTrue();
    }

    @Test
    void scanUntilSkipsEscapedStops() {
        final var cursor = new Cursor("ab\\]c]d", null);
        assertThat(cursor.scanUntil("]", "\n")).isEqualTo("ab\\]c");
        assertThat(cursor.current()).isEqualTo(']');
    }

    @Test
    void scanUntilFailsAtErrorCharacter() {
        final var cursor = new Cursor("abc\ndef]", null);
        assertThat(cursor.scanUntil("]", "\n")).isNull();
        assertThat(cursor.mark()).isZero();
        assertThat(cursor.scanUntilSequence("]]", "\n")).isNull();
        assertThat(cursor.mark()).isZero();
    }

    @Test
    void scanUntilSequenceStopsBeforeSequence() {
        final var cursor = new Cursor("name]]rest", null);
        assertThat(cursor.scanUntilSequence("]]", "\n")).isEqualTo("name");
        assertThat(cursor.matchSequence("]]")).isTrue();
        assertThat(cursor.checkAnySequence(List.of("x", "re"))).isTrue();
    }

    @Test
    void skipInlineWhitespaceCountsSkippedCharacters() {
        final var cursor = new Cursor(" \t x", null);
        assertThat(cursor.skipInlineWhitespace()).isEqualTo(3);
        assertThat(cursor.skipInlineWhitespace()).isZero();
        assertThat(cursor.current()).isEqualTo('x');
    }

    @Test
    void locationCountsLinesAndColumns() {
        final var path = Path.of("doc.md");
        final var cursor = new Cursor("ab\ncd", path);
        cursor.skipToLinebreak();
        cursor.advance();
        cursor.advance();
        final var location = cursor.location();
        assertThat(location.path()).isEqualTo(path);
        assertThat(location.line()).isEqualTo(2);
        assertThat(location.column()).isEqualTo(2);
        assertThat(location).asString().isEqualTo("doc.md:2:2");
    }

    @Test
    void readingPastEndThrows() {
        final var cursor = new Cursor("", null);
        assertThat(cursor.matchChar('\n')).isTrue();
        assertThat(cursor.advance()).isFalse();
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(cursor::current);
    }
}
