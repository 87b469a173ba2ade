// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something a caller may want to know about, such as a block that could not be parsed or an
 * import that could not be resolved. Signaling a condition runs the registered handlers <em>before</em> any stack
 * unwinding happens, so a handler can inspect the restarts established deeper in the call stack and pick one.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message, including any source position the condition carries.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + detailedMessage();
    }

    private final String message;
}
