package com.repo.quality.analysis;

import com.repo.quality.history.ActivityTimeline;
import com.repo.quality.history.FileChangeCount;
import com.repo.quality.rules.ScoreResult;

import java.util.List;

/**
 * Complete result of a history analysis run.
 */
public record RepositoryAnalysis(
        RepositorySummary summary,

        /** Most changed files, most changes first */
        List<FileChangeCount> topChangedFiles,

        ChangeDistribution changeDistribution,

        ActivityTimeline developerActivity,

        /** Authors ranked by total score */
        List<ScoreResult> authorScores) {
}
