package com.repo.quality.git;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Builds commit records for tests.
 */
public final class CommitFixtures {

    public static final long DAY = 86_400L;

    /** 2023-11-14T22:13:20Z */
    public static final long BASE = 1_700_000_000L;

    private static int counter = 0;

    private CommitFixtures() {
    }

    public static CommitRecord commit(String author, long time, String... files) {
        return commit(author, time, "Update " + String.join(", ", files), 0, 0, files);
    }

    public static CommitRecord commit(String author, long time, String message, int insertions, int deletions,
            String... files) {
        return new CommitRecord(nextHash(), author, time, ZoneOffset.UTC, message, 1, List.of(files),
                insertions, deletions);
    }

    public static CommitRecord rootCommit(String author, long time, String message) {
        return new CommitRecord(nextHash(), author, time, ZoneOffset.UTC, message, 0, List.of(), 0, 0);
    }

    public static long at(String isoInstant) {
        return Instant.parse(isoInstant).getEpochSecond();
    }

    private static synchronized String nextHash() {
        counter++;
        return String.format("%07x", counter);
    }
}
