package com.repo.quality.metrics;

/**
 * Behavioral metrics of one author. Ratios and averages are rounded to one decimal.
 */
public record DerivedMetrics(
        int totalCommits,

        /** Distinct files the author touched */
        int filesModified,

        /** Days between first and last commit, at least 1 */
        double activeDays,

        double avgFilesPerCommit,

        double avgMessageLength,

        /** Active days per commit */
        double avgCommitInterval,

        /** Days between the last commit and the moment of analysis */
        double daysSinceLastCommit,

        /** Percentage of changes falling into the author's 10 most touched files */
        double fileConcentration,

        /** Percentage of the author's files that are repository hotspots */
        double hotspotParticipation,

        /** Percentage of analyzed commits made by the author */
        double contributionRatio,

        /** Inserted plus deleted lines attributed to the author */
        long totalCodeChanges,

        /** Percentage of modification intervals no longer than five days */
        double rapidReworkRatio,

        int rapidReworkCount,

        /** Intervals between consecutive changes of the same file */
        int totalFileModifications) {
}
