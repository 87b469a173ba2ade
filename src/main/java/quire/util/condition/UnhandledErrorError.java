// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * Thrown when a condition signaled with {@link ConditionContext#error(Condition)} was declined by every handler.
 * <p>
 * Represents a programming error: whoever calls code that can signal errors is expected to establish a handler that
 * unwinds. Hence this extends {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no handler unwound: " + condition.detailedMessage());
        this.condition = condition;
    }

    /**
     * Retrieves the condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
