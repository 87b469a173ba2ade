// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.parser;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import quire.util.Trace;
import quire.util.condition.Condition;
import quire.util.condition.HandlerProcedure;
import quire.util.condition.SignaledCondition;

/**
 * A handler procedure collecting every condition signaled during a parse, import tasks included.
 * <p>
 * It never handles anything, so fatal conditions still end the parse. Typical use:
 * <pre>{@code
 * final var diagnostics = new Diagnostics();
 * try (final var handler = new Handler(diagnostics)) {
 *     handler.use();
 *     document = Parser.parseFile(path, ParserOptions.defaults());
 * }
 * diagnostics.entries().forEach(entry -> System.err.println(entry.describe()));
 * }</pre>
 */
public final class Diagnostics implements HandlerProcedure.ThreadSafe {
    @Override
    public void handle(final SignaledCondition condition) {
        entries.add(new Entry(condition, Trace.snapshot()));
    }

    /**
     * Returns the collected entries. Entries from different import tasks appear in no particular order.
     */
    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Returns the collected conditions of the given type.
     */
    public <T extends Condition> List<T> conditionsOf(final Class<T> type) {
        return entries.stream()
            .map(entry -> entry.signaled().condition())
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private final Queue<Entry> entries = new ConcurrentLinkedQueue<>();

    /**
     * A collected condition.
     *
     * @param signaled The condition and its severity.
     * @param traces   The traces active when the condition was signaled, innermost first.
     */
    public record Entry(SignaledCondition signaled, List<String> traces) {
        public Entry {
            traces = List.copyOf(traces);
        }

        /**
         * Describes the condition followed by its traces, one per line.
         */
        public String describe() {
            final var builder = new StringBuilder();
            builder.append(signaled.isFatal() ? "error: " : "warning: ")
                .append(signaled.condition().detailedMessage());
            for (final var trace : traces) {
                builder.append("\n\twhile ").append(trace);
            }
            return builder.toString();
        }
    }
}
