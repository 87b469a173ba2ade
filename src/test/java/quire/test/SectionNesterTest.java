// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.util.List;
import quire.assembly.SectionNester;
import quire.tree.Block;
import quire.tree.Header;
import quire.tree.Inline;
import quire.tree.Line;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class SectionNesterTest {
    @Test
    void siblingsStayAtTopLevel() {
        final var a = section(1, "a");
        final var b = section(2, "b");
        final var c = section(1, "c");
        final var result = SectionNester.nest(List.of(a, b, c));
        assertThat(result).containsExactly(a, c);
        assertThat(a.children()).containsExactly(b);
        assertThat(c.children()).isEmpty();
    }

    @Test
    void deepSectionsAreGraftedIntoIntermediateOnes() {
        final var a = section(1, "a");
        final var b = section(2, "b");
        final var d = section(4, "d");
        final var c = section(3, "c");
        final var result = SectionNester.nest(List.of(a, b, d, c));
        assertThat(result).containsExactly(a);
        assertThat(a.children()).containsExactly(b);
        assertThat(b.children()).containsExactly(d, c);
    }

    @Test
    void blocksFollowingSectionJoinIt() {
        final var before = paragraph("before");
        final var a = section(1, "a");
        final var after = paragraph("after");
        final var result = SectionNester.nest(List.of(before, a, after));
        assertThat(result).containsExactly(before, a);
        assertThat(a.children()).containsExactly(after);
    }

    @Test
    void shallowerSectionStartsNewTopLevelSection() {
        final var a = section(2, "a");
        final var b = section(1, "b");
        final var c = section(3, "c");
        final var result = SectionNester.nest(List.of(a, b, c));
        assertThat(result).containsExactly(a, b);
        assertThat(a.children()).isEmpty();
        assertThat(b.children()).containsExactly(c);
    }

    @Test
    void alreadyNestedChildrenAreKept() {
        final var a = section(1, "a");
        final var inner = section(2, "inner");
        a.append(inner);
        final var imported = section(3, "imported");
        final var result = SectionNester.nest(List.of(a, imported));
        assertThat(result).containsExactly(a);
        assertThat(inner.children()).containsExactly(imported);
    }

    private static Block.Section section(final int size, final String title) {
        return new Block.Section(size, new Header(text(title), title), null);
    }

    private static Block.Paragraph paragraph(final String value) {
        return new Block.Paragraph(List.of(text(value)));
    }

    private static Line text(final String value) {
        return new Line.Text(List.of(new Inline.Plain(value)));
    }
}
