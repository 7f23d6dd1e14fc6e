package com.repo.quality.metrics;

import com.repo.quality.core.CodeChangeMode;
import com.repo.quality.history.AuthorAggregate;
import com.repo.quality.history.CommitDetail;
import com.repo.quality.history.FileChangeCount;
import com.repo.quality.history.GlobalAggregate;
import com.repo.quality.history.HistoryAggregation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives {@link DerivedMetrics} for every author of a history aggregation.
 * <p>
 * {@code daysSinceLastCommit} is measured against the clock, so two runs over the same history on different
 * days give different values.
 */
public class AuthorMetricDeriver {

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final int CONCENTRATION_TOP_FILES = 10;
    private static final double HOTSPOT_SHARE = 0.2;
    private static final double RAPID_REWORK_DAYS = 5.0;

    private record Rework(int rapid, int intervals) {
    }

    private final Clock clock;
    private final CodeChangeMode codeChangeMode;

    public AuthorMetricDeriver() {
        this(Clock.systemUTC(), CodeChangeMode.ESTIMATED);
    }

    public AuthorMetricDeriver(Clock clock, CodeChangeMode codeChangeMode) {
        this.clock = clock;
        this.codeChangeMode = codeChangeMode;
    }

    /**
     * Metrics per author, in the aggregation's author order. Authors without commits are left out.
     */
    public Map<String, DerivedMetrics> derive(HistoryAggregation aggregation) {
        GlobalAggregate global = aggregation.global();
        Set<String> hotspots = hotspotFiles(global);

        Map<String, DerivedMetrics> result = new LinkedHashMap<>();
        for (AuthorAggregate author : aggregation.authors().values()) {
            if (author.getCommitDetails().isEmpty())
                continue;
            result.put(author.getAuthor(), derive(author, global, hotspots));
        }
        return result;
    }

    public DerivedMetrics derive(AuthorAggregate author, GlobalAggregate global, Set<String> hotspots) {
        List<CommitDetail> commits = new ArrayList<>(author.getCommitDetails());
        commits.sort(Comparator.comparingLong(CommitDetail::timestamp));
        int commitCount = commits.size();

        long firstCommit = commits.get(0).timestamp();
        long lastCommit = commits.get(commitCount - 1).timestamp();
        double activeDays = Math.max(1.0, (lastCommit - firstCommit) / SECONDS_PER_DAY);

        double avgFiles = commits.stream().mapToInt(CommitDetail::filesCount).sum() / (double) commitCount;
        double avgMessage = commits.stream().mapToInt(CommitDetail::messageLength).sum() / (double) commitCount;
        double avgInterval = commitCount > 1 ? activeDays / commitCount : activeDays;

        double now = clock.millis() / 1000.0;
        double daysSinceLast = (now - lastCommit) / SECONDS_PER_DAY;

        Map<String, Integer> fileChanges = author.getFileChanges();
        int filesModified = fileChanges.size();

        Rework rework = rework(author.getFileTimeline());
        double reworkRatio = rework.intervals() > 0 ? 100.0 * rework.rapid() / rework.intervals() : 0;

        return new DerivedMetrics(
                commitCount,
                filesModified,
                round(activeDays),
                round(avgFiles),
                round(avgMessage),
                round(avgInterval),
                round(daysSinceLast),
                round(fileConcentration(fileChanges)),
                round(hotspotParticipation(fileChanges.keySet(), hotspots)),
                round(contributionRatio(commitCount, global.getTotalCommits())),
                codeChanges(author, global),
                round(reworkRatio),
                rework.rapid(),
                rework.intervals());
    }

    /**
     * Top 20% of the changed files by global change count (at least one), ties broken by path.
     */
    public static Set<String> hotspotFiles(GlobalAggregate global) {
        int total = global.distinctFiles();
        if (total == 0)
            return Set.of();
        int size = Math.max(1, (int) (total * HOTSPOT_SHARE));
        return global.rankedFiles().stream()
                .limit(size)
                .map(FileChangeCount::path)
                .collect(Collectors.toUnmodifiableSet());
    }

    static double fileConcentration(Map<String, Integer> fileChanges) {
        int total = fileChanges.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0)
            return 0;
        int top = fileChanges.values().stream()
                .sorted(Comparator.reverseOrder())
                .limit(CONCENTRATION_TOP_FILES)
                .mapToInt(Integer::intValue)
                .sum();
        return 100.0 * top / total;
    }

    static double hotspotParticipation(Set<String> authorFiles, Set<String> hotspots) {
        if (authorFiles.isEmpty())
            return 0;
        long inHotspots = authorFiles.stream().filter(hotspots::contains).count();
        return 100.0 * inHotspots / authorFiles.size();
    }

    static double contributionRatio(int authorCommits, int totalCommits) {
        if (totalCommits == 0)
            return 0;
        return 100.0 * authorCommits / totalCommits;
    }

    long codeChanges(AuthorAggregate author, GlobalAggregate global) {
        if (codeChangeMode == CodeChangeMode.MEASURED)
            return author.getInsertions() + author.getDeletions();

        int total = global.getTotalCommits();
        if (total == 0)
            return 0;
        double share = (double) author.getCommitCount() / total;
        return (long) (global.getTotalInsertions() * share) + (long) (global.getTotalDeletions() * share);
    }

    private static Rework rework(Map<String, List<Long>> fileTimeline) {
        int rapid = 0;
        int intervals = 0;
        for (List<Long> timeline : fileTimeline.values()) {
            if (timeline.size() <= 1)
                continue;
            List<Long> sorted = timeline.stream().sorted().toList();
            for (int i = 0; i < sorted.size() - 1; i++) {
                double gapDays = (sorted.get(i + 1) - sorted.get(i)) / SECONDS_PER_DAY;
                intervals++;
                if (gapDays <= RAPID_REWORK_DAYS)
                    rapid++;
            }
        }
        return new Rework(rapid, intervals);
    }

    static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
