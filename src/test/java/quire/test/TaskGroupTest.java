// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import quire.util.TaskGroup;
import quire.util.condition.Condition;
import quire.util.condition.ConditionContext;
import quire.util.condition.Handler;
import quire.util.condition.HandlerProcedure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class TaskGroupTest {
    @BeforeEach
    void startPool() {
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void stopPool() {
        executor.shutdownNow();
    }

    @Test
    void nestedSubmissionsAreAwaited() {
        final var group = new TaskGroup(executor);
        final var counter = new AtomicInteger();
        for (var i = 0; i < 4; i += 1) {
            group.submit(() -> "outer task", () -> {
                counter.incrementAndGet();
                for (var j = 0; j < 4; j += 1) {
                    group.submit(() -> "inner task", counter::incrementAndGet);
                }
            });
        }
        group.awaitAll();
        assertThat(counter).hasValue(20);
    }

    @Test
    void onlyThreadSafeHandlersSeeWorkerConditions() {
        final List<String> threadSafe = Collections.synchronizedList(new ArrayList<>());
        final List<String> local = Collections.synchronizedList(new ArrayList<>());
        final HandlerProcedure.ThreadSafe threadSafeProcedure =
            condition -> threadSafe.add(condition.condition().message());
        try (final var outer = new Handler(threadSafeProcedure)) {
            outer.use();
            try (final var inner = new Handler(condition -> local.add(condition.condition().message()))) {
                inner.use();
                final var group = new TaskGroup(executor);
                group.submit(() -> "signaling task", () -> ConditionContext.signal(new TestCondition("from worker")));
                group.awaitAll();
                ConditionContext.signal(new TestCondition("from caller"));
            }
        }
        assertThat(threadSafe).containsExactly("from worker", "from caller");
        assertThat(local).containsExactly("from caller");
    }

    @Test
    void workerCanUnwindToCallerRestart() {
        final var reached = new AtomicInteger();
        final HandlerProcedure.ThreadSafe skip = condition -> {
            final var restart = ConditionContext.findRestart("skip");
            if (restart != null) {
                restart.unwindTo();
            }
        };
        final String result;
        try (final var handler = new Handler(skip)) {
            handler.use();
            result = ConditionContext.withRestart("skip", restart -> {
                final var group = new TaskGroup(executor);
                group.submit(() -> "failing task", () -> {
                    ConditionContext.signal(new TestCondition("give up"));
                    reached.incrementAndGet();
                });
                group.awaitAll();
                return "finished";
            });
        }
        assertThat(result).isNull();
        assertThat(reached).hasValue(0);
    }

    @Test
    void workerRestartsStayLocal() {
        final var group = new TaskGroup(executor);
        final var result = new AtomicInteger();
        group.submit(() -> "task with restart", () -> {
            final var value = ConditionContext.withRestart("local", restart -> {
                restart.unwindTo();
                return 1;
            });
            result.set((value == null) ? 2 : 3);
        });
        group.awaitAll();
        assertThat(result).hasValue(2);
        assertThat(ConditionContext.findRestart("local")).isNull();
    }

    @Test
    void exceptionBecomesAssertionError() {
        final var group = new TaskGroup(executor);
        final var failure = new IllegalStateException("broken task");
        group.submit(() -> "broken task", () -> {
            throw failure;
        });
        final var error = catchThrowableOfType(group::awaitAll, AssertionError.class);
        assertThat(error).isNotNull();
        assertThat(error.getCause()).isSameAs(failure);
    }

    @Test
    void errorsAreRethrownAsIs() {
        final var group = new TaskGroup(executor);
        final var failure = new AssertionError("failed check");
        group.submit(() -> "failing check", () -> {
            throw failure;
        });
        assertThat(catchThrowableOfType(group::awaitAll, AssertionError.class)).isSameAs(failure);
    }

    private ExecutorService executor;

    private static final class TestCondition extends Condition {
        TestCondition(final String message) {
            super(message);
        }
    }
}
