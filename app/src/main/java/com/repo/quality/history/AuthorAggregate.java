package com.repo.quality.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw tallies for one author, filled in while the history is traversed.
 */
public class AuthorAggregate {

    private final String author;
    private int commitCount;
    private final List<CommitDetail> commitDetails = new ArrayList<>();
    private final Map<String, Integer> fileChanges = new LinkedHashMap<>();
    private final Map<String, List<Long>> fileTimeline = new LinkedHashMap<>();
    private final Map<String, Integer> monthlyCommits = new TreeMap<>();
    private long insertions;
    private long deletions;

    public AuthorAggregate(String author) {
        this.author = author;
    }

    void recordCommit(CommitDetail detail, String monthKey) {
        commitCount++;
        commitDetails.add(detail);
        monthlyCommits.merge(monthKey, 1, Integer::sum);
    }

    void recordFileChange(String path, long timestamp) {
        fileChanges.merge(path, 1, Integer::sum);
        fileTimeline.computeIfAbsent(path, p -> new ArrayList<>()).add(timestamp);
    }

    void recordLines(int inserted, int deleted) {
        insertions += inserted;
        deletions += deleted;
    }

    public String getAuthor() {
        return author;
    }

    public int getCommitCount() {
        return commitCount;
    }

    public List<CommitDetail> getCommitDetails() {
        return Collections.unmodifiableList(commitDetails);
    }

    /** Path to number of this author's commits touching it */
    public Map<String, Integer> getFileChanges() {
        return Collections.unmodifiableMap(fileChanges);
    }

    /** Path to commit times of this author's changes, in traversal order */
    public Map<String, List<Long>> getFileTimeline() {
        return Collections.unmodifiableMap(fileTimeline);
    }

    /** "YYYY-MM" to commit count */
    public Map<String, Integer> getMonthlyCommits() {
        return Collections.unmodifiableMap(monthlyCommits);
    }

    public long getInsertions() {
        return insertions;
    }

    public long getDeletions() {
        return deletions;
    }

    public int totalFileTouches() {
        return fileChanges.values().stream().mapToInt(Integer::intValue).sum();
    }
}
