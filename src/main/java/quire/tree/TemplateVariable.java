// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import quire.util.annotation.Nullable;

/**
 * A {@code {prefix{name}suffix}} variable inside a template.
 * <p>
 * Unlike other deferred values, a variable is rebound each time its template is expanded and reset afterwards, so one
 * template can be expanded with different values.
 */
public final class TemplateVariable {
    public TemplateVariable(final String prefix, final String name, final String suffix) {
        this.prefix = prefix;
        this.name = name;
        this.suffix = suffix;
    }

    public String prefix() {
        return prefix;
    }

    public String name() {
        return name;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Returns the currently bound value, if any.
     */
    public synchronized @Nullable Inline value() {
        return value;
    }

    public synchronized void bind(final Inline newValue) {
        value = newValue;
    }

    public synchronized void reset() {
        value = null;
    }

    @Override
    public String toString() {
        return "TemplateVariable[" + prefix + '{' + name + '}' + suffix + "]";
    }

    private final String prefix;
    private final String name;
    private final String suffix;
    private @Nullable Inline value = null;
}
