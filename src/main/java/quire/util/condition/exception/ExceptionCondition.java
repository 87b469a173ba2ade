// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition.exception;

import java.io.PrintWriter;
import java.io.StringWriter;
import quire.util.condition.Condition;

/**
 * A condition wrapping a caught exception.
 */
abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final String context, final E exception) {
        super(context + ": " + exception.getMessage());
        this.exception = exception;
    }

    /**
     * Retrieves the wrapped exception.
     */
    public final E exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        final var writer = new StringWriter();
        try (final var printWriter = new PrintWriter(writer)) {
            printWriter.println(message());
            exception.printStackTrace(printWriter);
        }
        return writer.toString();
    }

    private final E exception;
}
