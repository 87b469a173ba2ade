// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.util.ArrayList;
import java.util.List;
import quire.util.condition.Condition;
import quire.util.condition.ConditionContext;
import quire.util.condition.Handler;
import quire.util.condition.Restart;
import quire.util.condition.SignaledCondition;
import quire.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void signalWithoutHandlersReturns() {
        ConditionContext.signal(new TestCondition("ignored"));
    }

    @Test
    void unhandledErrorIsThrown() {
        final var condition = new TestCondition("fatal");
        final var error = catchThrowableOfType(() -> {
            throw ConditionContext.error(condition);
        }, UnhandledErrorError.class);
        assertThat(error).isNotNull();
        assertThat(error.condition()).isSameAs(condition);
        assertThat(error).hasMessageContaining("fatal");
    }

    @Test
    void handlersRunNewestFirst() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(condition -> seen.add("outer " + condition.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(condition -> seen.add("inner " + condition.condition().message()))) {
                inner.use();
                ConditionContext.signal(new TestCondition("x"));
            }
            ConditionContext.signal(new TestCondition("y"));
        }
        assertThat(seen).containsExactly("inner x", "outer x", "outer y");
    }

    @Test
    void handlersSeeSeverity() {
        final var seen = new ArrayList<SignaledCondition>();
        try (final var handler = new Handler(seen::add)) {
            handler.use();
            ConditionContext.signal(new TestCondition("warning"));
            catchThrowableOfType(() -> {
                throw ConditionContext.error(new TestCondition("error"));
            }, UnhandledErrorError.class);
        }
        assertThat(seen).extracting(SignaledCondition::isFatal).containsExactly(false, true);
    }

    @Test
    void unwindingReturnsNullFromRestart() {
        final var after = new ArrayList<String>();
        final String result;
        try (final var handler = new Handler(condition -> {
            final var restart = ConditionContext.findRestart("skip");
            if (restart != null) {
                restart.unwindTo();
            }
        })) {
            handler.use();
            result = ConditionContext.withRestart("skip", restart -> {
                ConditionContext.signal(new TestCondition("unwind me"));
                after.add("not reached");
                return "finished";
            });
        }
        assertThat(result).isNull();
        assertThat(after).isEmpty();
        assertThat(ConditionContext.findRestart("skip")).isNull();
    }

    @Test
    void restartReturnsCallbackValueWithoutUnwind() {
        final var result = ConditionContext.withRestart("skip", restart -> "finished");
        assertThat(result).isEqualTo("finished");
    }

    @Test
    void unwindingToOuterRestartSkipsInnerOne() {
        final var log = new ArrayList<String>();
        final var result = ConditionContext.withRestart("outer", outer -> {
            ConditionContext.withRestart("inner", inner -> {
                outer.unwindTo();
                return null;
            });
            log.add("after inner");
            return "finished";
        });
        assertThat(result).isNull();
        assertThat(log).isEmpty();
    }

    @Test
    void restartsAreListedNewestFirst() {
        final List<String> names = ConditionContext.withRestart("first", first ->
            ConditionContext.withRestart("second", second -> {
                final var result = new ArrayList<String>();
                for (final Restart restart : ConditionContext.restarts()) {
                    result.add(restart.name());
                }
                return result;
            })
        );
        assertThat(names).containsExactly("second", "first");
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void findRestartPicksNewestWithName() {
        ConditionContext.withRestart("same", outer -> ConditionContext.withRestart("same", inner -> {
            assertThat(ConditionContext.findRestart("same")).isSameAs(inner);
            assertThat(ConditionContext.findRestart("other")).isNull();
            return null;
        }));
    }

    @Test
    void conditionSignaledInsideHandlerSkipsNewerHandlers() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(condition -> seen.add("outer " + condition.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(condition -> {
                seen.add("inner " + condition.condition().message());
                if (condition.condition().message().equals("first")) {
                    ConditionContext.signal(new TestCondition("nested"));
                }
            })) {
                inner.use();
                ConditionContext.signal(new TestCondition("first"));
            }
        }
        assertThat(seen).containsExactly("inner first", "outer nested", "outer first");
    }

    private static final class TestCondition extends Condition {
        TestCondition(final String message) {
            super(message);
        }
    }
}
