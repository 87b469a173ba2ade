// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.tree;

import java.util.List;

/**
 * A {@code %...%} template used as a metadata or configuration value.
 *
 * @param content   The blocks between the percent signs.
 * @param variables Every variable occurring in {@code content}, in source order.
 */
public record Template(List<Block> content, List<TemplateVariable> variables) {
    public Template {
        content = List.copyOf(content);
        variables = List.copyOf(variables);
    }
}
