package com.repo.quality.git;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * One commit as seen by the history pipeline.
 * Changed files are the diff against the first parent, before any exclusion rule is applied.
 */
public record CommitRecord(
        /** Abbreviated commit id (7 characters) */
        String shortHash,

        /** Author name, used verbatim as the identity key */
        String author,

        /** Commit time (Unix epoch seconds) */
        long committedAt,

        /** UTC offset of the committer, used to bucket the commit into its local month */
        ZoneOffset offset,

        /** Raw commit message */
        String message,

        /** Number of parents, 0 for a root commit */
        int parentCount,

        /** Paths changed against the first parent */
        List<String> changedFiles,

        /** Inserted lines, 0 if the diff stat was unavailable */
        int insertions,

        /** Deleted lines, 0 if the diff stat was unavailable */
        int deletions) {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public CommitRecord {
        changedFiles = List.copyOf(changedFiles);
        if (offset == null)
            offset = ZoneOffset.UTC;
    }

    public boolean hasParent() {
        return parentCount > 0;
    }

    /**
     * Year-month key of the commit in the committer's local time, e.g. "2024-03".
     */
    public String monthKey() {
        return Instant.ofEpochSecond(committedAt).atOffset(offset).format(MONTH);
    }

    public String formattedDate() {
        return Instant.ofEpochSecond(committedAt).atOffset(offset).format(DATE_TIME);
    }
}
