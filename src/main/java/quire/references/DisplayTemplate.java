// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Renders configuration strings such as {@code "[{{number}}]"}, replacing each {@code {{name}}} with its value.
 * Names without a value are left as written.
 */
public final class DisplayTemplate {
    private DisplayTemplate() {
    }

    @CheckReturnValue
    public static String render(final String pattern, final Map<String, String> values) {
        final var matcher = variable.matcher(pattern);
        final var result = new StringBuilder();
        while (matcher.find()) {
            final var value = values.get(matcher.group(1).trim());
            matcher.appendReplacement(result, Matcher.quoteReplacement((value == null) ? matcher.group() : value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static final Pattern variable = Pattern.compile("\\{\\{([^{}]+)}}");
}
