// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

import quire.util.SneakyThrow;
import quire.util.annotation.Nullable;

/**
 * A named restart point established by {@link ConditionContext#withRestart(String, RestartCallback)}.
 * <p>
 * Handlers find restarts with {@link ConditionContext#restarts()} or {@link ConditionContext#findRestart(String)} and
 * transfer control to one of them with {@link #unwindTo()}.
 */
public final class Restart {
    Restart(final String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the name of this restart point, for example {@code "skip-import"}.
     */
    public String name() {
        return name;
    }

    /**
     * Transfers control to this restart point. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restart chain corrupt";
        ownerContext.firstRestart = next;
    }

    @Override
    public String toString() {
        return "Restart[" + name + "]";
    }

    final @Nullable Restart next;
    private final String name;
    private final ConditionContext ownerContext;
}
