// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A write-once cell for a value that is only known after parsing, such as the document an import produces or the
 * value of a placeholder.
 * <p>
 * A cell starts empty and settles exactly once, either {@linkplain #resolve(Object) with a value} or
 * {@linkplain #markUnresolved(String) as unresolved} with a fallback text to display instead. The same cell object
 * is shared by the tree node that declares it and by whatever resolves it. Cells are safe to use from several threads.
 */
public final class Deferred<T> {
    /**
     * Returns {@code true} iff the cell holds a value.
     */
    public synchronized boolean hasValue() {
        return state == State.RESOLVED;
    }

    /**
     * Returns {@code true} iff the cell has been resolved or marked unresolved.
     */
    public synchronized boolean isSettled() {
        return state != State.EMPTY;
    }

    /**
     * Returns the value, or {@code null} if the cell holds none.
     */
    public synchronized @Nullable T value() {
        return value;
    }

    /**
     * Returns the fallback text of an unresolved cell, or {@code null} if the cell is not unresolved.
     */
    public synchronized @Nullable String fallback() {
        return fallback;
    }

    /**
     * Settles the cell with the given value.
     *
     * @throws IllegalStateException if the cell is already settled.
     */
    public synchronized void resolve(final @NotNull T newValue) {
        checkEmpty();
        value = newValue;
        state = State.RESOLVED;
    }

    /**
     * Settles the cell as unresolved, to be displayed as {@code fallbackText}.
     *
     * @throws IllegalStateException if the cell is already settled.
     */
    public synchronized void markUnresolved(final @NotNull String fallbackText) {
        checkEmpty();
        fallback = fallbackText;
        state = State.UNRESOLVED;
    }

    @Override
    public synchronized @NotNull String toString() {
        return switch (state) {
            case EMPTY -> "Deferred[empty]";
            case RESOLVED -> "Deferred[" + value + "]";
            case UNRESOLVED -> "Deferred[unresolved: " + fallback + "]";
        };
    }

    private void checkEmpty() {
        if (state != State.EMPTY) {
            throw new IllegalStateException("Deferred cell settled twice: " + this);
        }
    }

    private State state = State.EMPTY;
    private @Nullable T value = null;
    private @Nullable String fallback = null;

    private enum State {
        EMPTY,
        RESOLVED,
        UNRESOLVED,
    }
}
