package com.repo.quality.history;

/**
 * Per-commit facts kept for an author.
 */
public record CommitDetail(
        /** Commit time (Unix epoch seconds) */
        long timestamp,

        /** Length of the stripped commit message */
        int messageLength,

        /** Retained files touched by the commit */
        int filesCount) {
}
