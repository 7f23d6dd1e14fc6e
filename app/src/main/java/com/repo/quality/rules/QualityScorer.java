package com.repo.quality.rules;

import com.repo.quality.metrics.DerivedMetrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

/**
 * Band-based author scoring.
 * Each metric is looked up in a table of bands; the first band whose condition holds awards its points.
 * The bands of a dimension add up to its ceiling at most.
 */
public class QualityScorer {

    public static final int COMMIT_BEHAVIOR_MAX = 40;
    public static final int QUALITY_AND_SCOPE_MAX = 30;
    public static final int ACTIVITY_MAX = 30;

    /**
     * A condition on a metric value with a fixed award.
     */
    public record ScoreBand(
            int points,
            DoublePredicate condition,
            String description) {

        static ScoreBand otherwise(int points) {
            return new ScoreBand(points, v -> true, "else");
        }
    }

    /**
     * Ordered bands for one metric.
     */
    public record BandTable(
            String metric,
            ToDoubleFunction<DerivedMetrics> value,
            List<ScoreBand> bands) {

        public int award(DerivedMetrics metrics) {
            double v = value.applyAsDouble(metrics);
            for (ScoreBand band : bands) {
                if (band.condition().test(v)) {
                    return band.points();
                }
            }
            return 0;
        }
    }

    /**
     * A named group of tables with a ceiling.
     */
    public record Dimension(String name, int ceiling, List<BandTable> tables) {

        public int score(DerivedMetrics metrics) {
            int sum = tables.stream().mapToInt(t -> t.award(metrics)).sum();
            return Math.min(sum, ceiling);
        }
    }

    private final Dimension commitBehavior;
    private final Dimension qualityAndScope;
    private final Dimension activity;

    public QualityScorer() {
        this.commitBehavior = buildCommitBehavior();
        this.qualityAndScope = buildQualityAndScope();
        this.activity = buildActivity();
    }

    public ScoreResult score(String author, DerivedMetrics metrics) {
        int behavior = commitBehavior.score(metrics);
        int quality = qualityAndScope.score(metrics);
        int act = activity.score(metrics);
        int total = behavior + quality + act;
        return new ScoreResult(author, behavior, quality, act, total, Grade.fromTotal(total), metrics);
    }

    /**
     * Score all authors, highest total first. Equal totals keep the input order.
     */
    public List<ScoreResult> scoreAll(Map<String, DerivedMetrics> metricsByAuthor) {
        List<ScoreResult> results = new ArrayList<>();
        metricsByAuthor.forEach((author, metrics) -> results.add(score(author, metrics)));
        results.sort(Comparator.comparingInt(ScoreResult::total).reversed());
        return results;
    }

    public List<Dimension> dimensions() {
        return List.of(commitBehavior, qualityAndScope, activity);
    }

    private static Dimension buildCommitBehavior() {
        BandTable filesPerCommit = new BandTable("avg_files_per_commit", DerivedMetrics::avgFilesPerCommit, List.of(
                new ScoreBand(20, v -> v >= 1 && v <= 3, "1-3 files"),
                new ScoreBand(18, v -> v > 3 && v <= 6, "3-6 files"),
                new ScoreBand(15, v -> (v >= 0.5 && v < 1) || (v > 6 && v <= 10), "0.5-1 or 6-10 files"),
                new ScoreBand(10, v -> v > 10 && v <= 15, "10-15 files"),
                ScoreBand.otherwise(5)));

        BandTable recency = new BandTable("days_since_last_commit", DerivedMetrics::daysSinceLastCommit, List.of(
                new ScoreBand(5, v -> v <= 30, "active within 30 days"),
                new ScoreBand(3, v -> v <= 90, "active within 90 days"),
                ScoreBand.otherwise(1)));

        BandTable message = new BandTable("avg_message_length", DerivedMetrics::avgMessageLength, List.of(
                new ScoreBand(15, v -> v >= 20, "descriptive messages"),
                new ScoreBand(11, v -> v >= 10, "short messages"),
                ScoreBand.otherwise(5)));

        return new Dimension("commit_behavior", COMMIT_BEHAVIOR_MAX, List.of(filesPerCommit, recency, message));
    }

    private static Dimension buildQualityAndScope() {
        BandTable breadth = new BandTable("files_modified", DerivedMetrics::filesModified, List.of(
                new ScoreBand(8, v -> v >= 50, "broad"),
                new ScoreBand(7, v -> v >= 30, "wide"),
                new ScoreBand(5, v -> v >= 15, "moderate"),
                new ScoreBand(3, v -> v >= 5, "narrow"),
                ScoreBand.otherwise(1)));

        BandTable volume = new BandTable("total_code_changes", DerivedMetrics::totalCodeChanges, List.of(
                new ScoreBand(7, v -> v >= 10000, "large"),
                new ScoreBand(6, v -> v >= 5000, "medium"),
                new ScoreBand(4, v -> v >= 2000, "regular"),
                new ScoreBand(2, v -> v >= 500, "small"),
                ScoreBand.otherwise(1)));

        BandTable rework = new BandTable("rapid_rework_ratio", DerivedMetrics::rapidReworkRatio, List.of(
                new ScoreBand(15, v -> v <= 10, "stable"),
                new ScoreBand(12, v -> v <= 20, "mostly stable"),
                new ScoreBand(9, v -> v <= 30, "some rework"),
                new ScoreBand(5, v -> v <= 50, "frequent rework"),
                ScoreBand.otherwise(2)));

        return new Dimension("quality_and_scope", QUALITY_AND_SCOPE_MAX, List.of(breadth, volume, rework));
    }

    private static Dimension buildActivity() {
        BandTable files = new BandTable("files_modified", DerivedMetrics::filesModified, List.of(
                new ScoreBand(10, v -> v >= 50, "wide impact"),
                new ScoreBand(8, v -> v >= 30, "good"),
                new ScoreBand(6, v -> v >= 10, "average"),
                ScoreBand.otherwise(3)));

        BandTable span = new BandTable("active_days", DerivedMetrics::activeDays, List.of(
                new ScoreBand(10, v -> v >= 180, "half a year or more"),
                new ScoreBand(8, v -> v >= 90, "three months or more"),
                new ScoreBand(6, v -> v >= 30, "a month or more"),
                ScoreBand.otherwise(3)));

        BandTable share = new BandTable("contribution_ratio", DerivedMetrics::contributionRatio, List.of(
                new ScoreBand(10, v -> v >= 30, "core contributor"),
                new ScoreBand(8, v -> v >= 15, "major contributor"),
                new ScoreBand(6, v -> v >= 5, "regular contributor"),
                ScoreBand.otherwise(3)));

        return new Dimension("activity", ACTIVITY_MAX, List.of(files, span, share));
    }
}
