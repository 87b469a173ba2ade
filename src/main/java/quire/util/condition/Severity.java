// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * How a condition was signaled.
 */
public enum Severity {
    /**
     * Signaled with {@link ConditionContext#signal(Condition)}: the signaling code carries on if every handler
     * declines.
     */
    WARNING,
    /**
     * Signaled with {@link ConditionContext#error(Condition)}: if every handler declines, an
     * {@link UnhandledErrorError} is thrown.
     */
    ERROR,
}
