// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * A condition together with the way it was signaled, as seen by handler procedures.
 *
 * @param condition The condition being signaled.
 * @param severity  Whether declining to handle the condition is fatal.
 */
public record SignaledCondition(Condition condition, Severity severity) {
    /**
     * Returns {@code true} iff the condition was signaled with {@link ConditionContext#error(Condition)}.
     */
    public boolean isFatal() {
        return severity == Severity.ERROR;
    }
}
