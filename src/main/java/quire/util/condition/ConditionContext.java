// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import quire.util.SneakyThrow;
import quire.util.annotation.Nullable;

/**
 * Keeps track of the handlers and restart points registered in the calling thread.
 * <p>
 * Every thread owns an independent context. The context itself is never exposed; the static methods of this class
 * operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as a warning.
     * <p>
     * Registered handlers run from the newest to the oldest. If all of them return normally, so does this method. A
     * handler may instead unwind to a restart point, in which case this method throws {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, Severity.WARNING));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is
     * thrown. The method never returns normally; its return type lets call sites write
     * {@code throw ConditionContext.error(...)} to help control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, Severity.ERROR));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the given callback with a restart point named {@code restartName} established around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if a handler unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points of the calling thread, newest first.
     */
    public static Iterable<Restart> restarts() {
        return localContext().new RestartIterable();
    }

    /**
     * Finds the newest active restart point with the given name.
     *
     * @return The restart, or {@code null} if none with that name is active.
     */
    public static @Nullable Restart findRestart(final String name) {
        for (final var restart : restarts()) {
            if (restart.name().equals(name)) {
                return restart;
            }
        }
        return null;
    }

    /**
     * Captures the restarts and thread-safe handlers of the calling thread, so that a worker thread can take them over
     * with {@link #inheritState(InheritedState)}.
     */
    public static InheritedState saveInheritableState() {
        final var context = localContext();
        // The whole handler chain is shared; signal() skips the handlers that are not thread-safe.
        return new InheritedState(context.firstHandler, context.firstRestart);
    }

    /**
     * Installs inherited state in the calling worker thread, whose context must be empty.
     *
     * @return A token to pass to {@link #restoreState(PreviousState)} when the worker's task finishes.
     */
    public static PreviousState inheritState(final InheritedState inheritedState) {
        final var context = localContext();
        assert context.firstHandler == null : "Attempted to inherit state into a thread that already has handlers";
        assert context.firstRestart == null : "Attempted to inherit state into a thread that already has restarts";
        context.firstHandler = inheritedState.firstHandler;
        context.firstRestart = inheritedState.firstRestart;
        return PreviousState.instance;
    }

    /**
     * Empties the calling worker thread's context again.
     */
    public static void restoreState(@SuppressWarnings("unused") final PreviousState previousState) {
        final var context = localContext();
        context.firstHandler = null;
        context.firstRestart = null;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = firstCandidateHandler(); handler != null; handler = handler.next) {
            if (!handler.usableIn(this)) {
                continue;
            }
            final var savedHandler = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = savedHandler;
            }
        }
    }

    // A condition signaled from inside a handler is only seen by handlers older than the running one.
    private @Nullable Handler firstCandidateHandler() {
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    /**
     * Opaque snapshot of the inheritable part of a condition context.
     */
    public static final class InheritedState {
        private InheritedState(final @Nullable Handler firstHandler, final @Nullable Restart firstRestart) {
            this.firstHandler = firstHandler;
            this.firstRestart = firstRestart;
        }

        private final @Nullable Handler firstHandler;
        private final @Nullable Restart firstRestart;
    }

    /**
     * Opaque token returned by {@link #inheritState(InheritedState)}.
     */
    public static final class PreviousState {
        private PreviousState() {
        }

        private static final PreviousState instance = new PreviousState();
    }

    private final class RestartIterable implements Iterable<Restart> {
        @Override
        public Iterator<Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
