package com.repo.quality.history;

import com.repo.quality.core.PathExclusionMatcher;
import com.repo.quality.git.CommitRecord;
import com.repo.quality.progress.ProgressSink;
import com.repo.quality.progress.ProgressUpdate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Walks a bounded list of commits once and builds the global and per-author tallies.
 * <p>
 * Every retained commit counts for its author, including commits without a diff (root commits, empty
 * merges). Files and line totals are only taken from commits that have a parent.
 */
public class HistoryAggregator {

    public static final String STAGE = "git_analysis";
    private static final int PROGRESS_INTERVAL = 20;

    private final List<String> allowedAuthors;
    private final PathExclusionMatcher exclusions;
    private final ProgressSink progress;
    private final int progressStart;
    private final int progressEnd;

    public HistoryAggregator(List<String> allowedAuthors, PathExclusionMatcher exclusions, ProgressSink progress) {
        this(allowedAuthors, exclusions, progress, 0, 100);
    }

    /**
     * @param progressStart first percentage of the range reserved by the caller
     * @param progressEnd   last percentage of the range reserved by the caller
     */
    public HistoryAggregator(List<String> allowedAuthors, PathExclusionMatcher exclusions, ProgressSink progress,
            int progressStart, int progressEnd) {
        this.allowedAuthors = normalizeAuthors(allowedAuthors);
        this.exclusions = exclusions != null ? exclusions : PathExclusionMatcher.none();
        this.progress = ProgressSink.orNone(progress);
        this.progressStart = progressStart;
        this.progressEnd = progressEnd;
    }

    public HistoryAggregation aggregate(List<CommitRecord> commits) {
        GlobalAggregate global = new GlobalAggregate();
        Map<String, AuthorAggregate> authors = new LinkedHashMap<>();

        int total = commits.size();
        int processed = 0;
        for (CommitRecord commit : commits) {
            processed++;
            if (isAllowed(commit.author())) {
                AuthorAggregate author = authors.computeIfAbsent(commit.author(), AuthorAggregate::new);
                record(commit, global, author);
            }
            if (processed % PROGRESS_INTERVAL == 0 || processed == total) {
                reportProgress(processed, total);
            }
        }
        return new HistoryAggregation(global, authors);
    }

    private void record(CommitRecord commit, GlobalAggregate global, AuthorAggregate author) {
        global.recordCommit();

        List<String> retained = new ArrayList<>();
        if (commit.hasParent()) {
            for (String path : commit.changedFiles()) {
                if (path == null || exclusions.isExcluded(path))
                    continue;
                global.recordFileChange(path);
                author.recordFileChange(path, commit.committedAt());
                retained.add(path);
            }
            global.recordLines(commit.insertions(), commit.deletions());
            author.recordLines(commit.insertions(), commit.deletions());
        }

        String message = commit.message() == null ? "" : commit.message().strip();
        int messageLength = message.codePointCount(0, message.length());
        author.recordCommit(new CommitDetail(commit.committedAt(), messageLength, retained.size()), commit.monthKey());
    }

    boolean isAllowed(String author) {
        if (allowedAuthors.isEmpty())
            return true;
        if (author == null)
            return false;
        return allowedAuthors.contains(author.trim().toLowerCase(Locale.ROOT));
    }

    private void reportProgress(int processed, int total) {
        int percentage = (int) (progressStart + (double) processed / total * (progressEnd - progressStart));
        progress.reportSafely(ProgressUpdate.of(STAGE, percentage, 100,
                "Analyzing Git history... (" + processed + "/" + total + " commits)"));
    }

    private static List<String> normalizeAuthors(List<String> authors) {
        List<String> normalized = new ArrayList<>();
        if (authors != null) {
            for (String author : authors) {
                if (author != null && !author.isBlank()) {
                    normalized.add(author.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return List.copyOf(normalized);
    }
}
