// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import quire.util.condition.MessageSupplier;

/**
 * A user-readable description of the operation in progress, meant to be used with try-with-resources.
 * <p>
 * Traces such as "Parsing chapter1.md" or "Resolving placeholders" give diagnostics their context. They are not a
 * machine stack trace.
 * <p>
 * A trace must only be used by the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed on first use, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a trace with the given message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext();
        next = context.innermost;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns the calling thread's active trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return ActiveTraces.instance;
    }

    /**
     * Copies the calling thread's active trace messages, innermost first.
     */
    public static List<String> snapshot() {
        final var result = new ArrayList<String>();
        for (final var message : activeTraces()) {
            result.add(message);
        }
        return List.copyOf(result);
    }

    /**
     * Does nothing. Exists to silence warnings about try-with-resources variables that are never referenced.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes the trace from the calling thread's trace chain. Use try-with-resources instead of calling this directly.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // CF does not understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier that computes it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }

    private static final class ActiveTraces implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new TraceIterator(localContext().innermost);
        }

        private static final ActiveTraces instance = new ActiveTraces();
    }

    private static final class TraceIterator implements Iterator<String> {
        private TraceIterator(final @Nullable Trace innermost) {
            current = innermost;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
