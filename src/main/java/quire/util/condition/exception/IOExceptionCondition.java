// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition.exception;

import java.io.IOException;

/**
 * A condition indicating that reading a source file failed.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    /**
     * Initializes a new condition for the given exception, raised while doing what {@code context} describes.
     */
    public IOExceptionCondition(final String context, final IOException exception) {
        super(context, exception);
    }
}
