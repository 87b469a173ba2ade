// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * The code run by a {@link Handler} for each signaled condition.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Unwinding to a restart with
     * {@link Restart#unwindTo()} handles it; the {@link Unwind} it throws is unchecked in practice.
     */
    void handle(SignaledCondition condition);

    /**
     * A handler procedure that may be called from any thread.
     * <p>
     * Only thread-safe procedures are visible to import workers, which inherit their parent's condition context through
     * {@link ConditionContext#saveInheritableState()}.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
