// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.imports;

import java.nio.file.Path;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import quire.references.SharedState;
import quire.util.TaskGroup;

/**
 * The state of one parse shared by the root document and every import: the shared document state, the task group
 * running document imports, and the set of files already taking part. Thread-safe.
 */
public final class ImportSession {
    /**
     * Initializes a new session.
     *
     * @param tasks The group import tasks are submitted to. The root parse joins it.
     */
    public ImportSession(final SharedState shared, final TaskGroup tasks) {
        this.shared = shared;
        this.tasks = tasks;
    }

    public SharedState shared() {
        return shared;
    }

    public TaskGroup tasks() {
        return tasks;
    }

    /**
     * Atomically records that the given file takes part in the parse.
     *
     * @param path An absolute, normalized path.
     * @return {@code true} iff the file was not taking part yet. {@code false} means the import is cyclic or repeated.
     */
    public boolean claim(final Path path) {
        if (!claimed.add(path)) {
            return false;
        }
        sources.add(path);
        return true;
    }

    /**
     * Returns every claimed file, in the order they were claimed.
     */
    public List<Path> sources() {
        return List.copyOf(sources);
    }

    private final SharedState shared;
    private final TaskGroup tasks;
    private final Set<Path> claimed = ConcurrentHashMap.newKeySet();
    private final Queue<Path> sources = new ConcurrentLinkedQueue<>();
}
