// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the images and stylesheets referenced anywhere in a parse. Thread-safe.
 */
public final class DownloadRegistry {
    /**
     * Records a resource, returning the handle already recorded for the same source and kind if there is one.
     */
    public synchronized PendingDownload register(final String source, final PendingDownload.Kind kind) {
        return downloads.computeIfAbsent(kind + ":" + source, key -> new PendingDownload(source, kind));
    }

    /**
     * Returns every recorded resource in registration order.
     */
    public synchronized List<PendingDownload> all() {
        return List.copyOf(downloads.values());
    }

    /**
     * Returns the recorded resources of the given kind in registration order.
     */
    public synchronized List<PendingDownload> ofKind(final PendingDownload.Kind kind) {
        return downloads.values().stream().filter(download -> download.kind() == kind).toList();
    }

    private final Map<String, PendingDownload> downloads = new LinkedHashMap<>();
}
