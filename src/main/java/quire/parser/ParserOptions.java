// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.parser;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import quire.references.ConfigValue;
import quire.util.annotation.Nullable;

/**
 * The caller's choices for one parse.
 *
 * @param executor      Runs the import tasks. If {@code null}, the parser creates a pool for the duration of the parse.
 * @param autoIncludes  Whether the files named by the {@code included-*} configuration keys are loaded when present.
 * @param configuration Values stored in the configuration before parsing, on top of the defaults.
 * @param clock         The clock read by the {@code date} and {@code time} placeholders.
 */
public record ParserOptions(
    @Nullable ExecutorService executor,
    boolean autoIncludes,
    Map<String, ConfigValue> configuration,
    Clock clock
) {
    public ParserOptions {
        configuration = Map.copyOf(configuration);
    }

    /**
     * Returns options with a parser-owned executor, automatic includes, no extra configuration and the system clock.
     */
    public static ParserOptions defaults() {
        return new ParserOptions(null, true, Map.of(), Clock.systemDefaultZone());
    }

    public ParserOptions withExecutor(final ExecutorService newExecutor) {
        return new ParserOptions(newExecutor, autoIncludes, configuration, clock);
    }

    public ParserOptions withAutoIncludes(final boolean newAutoIncludes) {
        return new ParserOptions(executor, newAutoIncludes, configuration, clock);
    }

    public ParserOptions withConfiguration(final String key, final ConfigValue value) {
        final var newConfiguration = new LinkedHashMap<>(configuration);
        newConfiguration.put(key, value);
        return new ParserOptions(executor, autoIncludes, newConfiguration, clock);
    }

    public ParserOptions withClock(final Clock newClock) {
        return new ParserOptions(executor, autoIncludes, configuration, newClock);
    }
}
