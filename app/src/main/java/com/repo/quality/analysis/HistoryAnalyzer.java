package com.repo.quality.analysis;

import com.repo.quality.core.AnalyzerConfig;
import com.repo.quality.git.CommitRecord;
import com.repo.quality.git.CommitSource;
import com.repo.quality.history.ActivityTimelineBuilder;
import com.repo.quality.history.FileChangeCount;
import com.repo.quality.history.GlobalAggregate;
import com.repo.quality.history.HistoryAggregation;
import com.repo.quality.history.HistoryAggregator;
import com.repo.quality.metrics.AuthorMetricDeriver;
import com.repo.quality.metrics.DerivedMetrics;
import com.repo.quality.progress.ProgressSink;
import com.repo.quality.progress.ProgressUpdate;
import com.repo.quality.rules.QualityScorer;
import com.repo.quality.rules.ScoreResult;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole pipeline: fetch commits, aggregate, derive metrics, score.
 * Each call works on fresh aggregates, so separate instances may run concurrently against the same repository.
 */
public class HistoryAnalyzer {

    private static final int AGGREGATION_START = 10;
    private static final int AGGREGATION_END = 90;

    private final CommitSource source;
    private final AnalyzerConfig config;
    private final ProgressSink progress;
    private final Clock clock;

    public HistoryAnalyzer(CommitSource source, AnalyzerConfig config, ProgressSink progress) {
        this(source, config, progress, Clock.systemUTC());
    }

    public HistoryAnalyzer(CommitSource source, AnalyzerConfig config, ProgressSink progress, Clock clock) {
        this.source = source;
        this.config = config;
        this.progress = ProgressSink.orNone(progress);
        this.clock = clock;
    }

    public RepositoryAnalysis analyze() throws IOException {
        report(0, "Reading commits for " + config.commitRange().describe());
        List<CommitRecord> commits = source.fetch(config.commitRange(), config.getMaxCommits());
        report(AGGREGATION_START, "Found " + commits.size() + " commits");

        HistoryAggregation aggregation = new HistoryAggregator(
                config.getAuthors(), config.pathExclusions(), progress, AGGREGATION_START, AGGREGATION_END)
                .aggregate(commits);

        report(AGGREGATION_END + 5, "Scoring " + aggregation.authors().size() + " authors");
        Map<String, DerivedMetrics> metrics = new AuthorMetricDeriver(clock, config.getCodeChangeMode())
                .derive(aggregation);
        List<ScoreResult> scores = new QualityScorer().scoreAll(metrics);

        GlobalAggregate global = aggregation.global();
        RepositoryAnalysis analysis = new RepositoryAnalysis(
                summarize(aggregation),
                topFiles(global, config.getTopFiles()),
                ChangeDistribution.of(global.getFileChanges().values()),
                new ActivityTimelineBuilder().build(aggregation.authors()),
                scores);

        report(100, "Analysis complete");
        return analysis;
    }

    private RepositorySummary summarize(HistoryAggregation aggregation) {
        GlobalAggregate global = aggregation.global();
        List<String> authors = new ArrayList<>(aggregation.authors().keySet());
        return new RepositorySummary(
                global.getTotalCommits(),
                authors.size(),
                global.distinctFiles(),
                global.getTotalInsertions(),
                global.getTotalDeletions(),
                List.copyOf(authors));
    }

    private void report(int percentage, String message) {
        progress.reportSafely(ProgressUpdate.of(HistoryAggregator.STAGE, percentage, 100, message));
    }

    /**
     * Files changed most often, ties by path.
     */
    public static List<FileChangeCount> topFiles(GlobalAggregate global, int limit) {
        return global.rankedFiles().stream().limit(limit).toList();
    }
}
