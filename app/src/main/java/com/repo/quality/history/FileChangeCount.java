package com.repo.quality.history;

import java.util.Comparator;

/**
 * Number of commits that changed a path.
 */
public record FileChangeCount(String path, int changes) {

    /** Most changed first, ties by path */
    public static final Comparator<FileChangeCount> BY_CHANGES_DESC = Comparator
            .comparingInt(FileChangeCount::changes).reversed()
            .thenComparing(FileChangeCount::path);
}
