package com.repo.quality.analysis;

import java.util.List;

/**
 * Headline counts of an analysis.
 */
public record RepositorySummary(
        int totalCommits,
        int totalAuthors,
        int totalFilesChanged,
        long totalInsertions,
        long totalDeletions,
        List<String> authors) {
}
