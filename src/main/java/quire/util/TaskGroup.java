// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util;

import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import quire.util.condition.ConditionContext;
import quire.util.condition.MessageSupplier;
import quire.util.condition.Unwind;

/**
 * A group of tasks submitted to an {@link ExecutorService} and joined together by a single barrier.
 * <p>
 * Tasks may submit further tasks to the same group while running. {@link #awaitAll()} keeps waiting until no task is
 * outstanding, including those submitted while it was waiting.
 * <p>
 * Every task inherits the {@link ConditionContext} state of the thread that submitted it, so thread-safe handlers and
 * restart points established by the caller remain in effect. Unwinds escaping a task are rethrown by
 * {@link #awaitAll()} in the awaiting thread.
 */
public final class TaskGroup {
    /**
     * Initializes a new, empty task group submitting its tasks to the given executor service.
     */
    public TaskGroup(final ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Submits a task. Returns immediately.
     *
     * @param description A lazily built description, established as a {@link Trace} while the task runs.
     */
    public void submit(final MessageSupplier description, final Runnable task) {
        final var inheritedState = ConditionContext.saveInheritableState();
        pending.add(executorService.submit(() -> {
            final var previousState = ConditionContext.inheritState(inheritedState);
            try (final var trace = new Trace(description)) {
                trace.use();
                task.run();
            } finally {
                ConditionContext.restoreState(previousState);
            }
        }));
    }

    /**
     * Waits until every task submitted to this group, directly or by another task of the group, has finished.
     * <p>
     * If a task fails, the tasks still outstanding are cancelled and the failure is rethrown: unwinds and errors as
     * they are, anything else wrapped in an {@link AssertionError}.
     */
    public void awaitAll() {
        var failed = true;
        try {
            for (Future<?> future; (future = pending.poll()) != null; ) {
                awaitOne(future);
            }
            if (foundInterrupt) {
                throw new AssertionError("A task was interrupted, but no other task threw anything concrete");
            }
            failed = false;
        } finally {
            if (failed) {
                cancelOutstanding();
            }
        }
    }

    private void awaitOne(final Future<?> future) {
        try {
            future.get();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        } catch (final CancellationException e) {
            foundInterrupt = true;
        } catch (final ExecutionException e) {
            rethrowCause(e);
        }
    }

    private void rethrowCause(final ExecutionException executionException) {
        final var cause = executionException.getCause();
        if (cause instanceof Unwind) {
            // Cross-thread unwind to a restart, keep unwinding in the awaiting thread.
            throw SneakyThrow.doThrow(cause);
        } else if (cause instanceof InterruptedException) {
            // Some other task will likely have a more concrete failure.
            foundInterrupt = true;
        } else if (cause instanceof Error error) {
            throw error;
        } else {
            throw new AssertionError("An exception escaped from a task through a future", cause);
        }
    }

    private void cancelOutstanding() {
        for (Future<?> future; (future = pending.poll()) != null; ) {
            future.cancel(true);
        }
    }

    private final ExecutorService executorService;
    private final Queue<Future<?>> pending = new ConcurrentLinkedQueue<>();
    private boolean foundInterrupt = false;
}
