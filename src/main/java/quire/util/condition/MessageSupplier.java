// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.util.condition;

/**
 * A lazily built trace message.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
