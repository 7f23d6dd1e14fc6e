package com.repo.quality.git;

import java.io.IOException;
import java.util.List;

/**
 * Supplies commit records for a range of history.
 */
@FunctionalInterface
public interface CommitSource {

    /**
     * Returns at most {@code maxCommits} commits of the range, newest first.
     *
     * @throws IllegalArgumentException if a revision of the range cannot be resolved
     */
    List<CommitRecord> fetch(CommitRange range, int maxCommits) throws IOException;
}
