// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by every part of the parser: operation traces, task scheduling and exception plumbing.
 */
@NonNullByDefault
package quire.util;

import quire.util.annotation.NonNullByDefault;
