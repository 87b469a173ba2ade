// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * Throwable used by {@link Restart#unwindTo()} to transfer control to a restart point.
 * <p>
 * Public only so that methods can declare that they may unwind. Code should neither catch nor throw it by hand, except
 * to carry an unwind across a thread boundary, as the import scheduler does.
 * <p>
 * An unwind is neither an exceptional situation nor an unrecoverable error, so it extends {@link Throwable} directly.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    // Unwinds are never serialized; transient only silences static analysis.
    private final transient Restart target;
}
