package com.repo.quality.history;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repository-wide tallies over the retained commits.
 */
public class GlobalAggregate {

    private final Map<String, Integer> fileChanges = new LinkedHashMap<>();
    private int totalCommits;
    private long totalInsertions;
    private long totalDeletions;

    void recordCommit() {
        totalCommits++;
    }

    void recordFileChange(String path) {
        fileChanges.merge(path, 1, Integer::sum);
    }

    void recordLines(int inserted, int deleted) {
        totalInsertions += inserted;
        totalDeletions += deleted;
    }

    public Map<String, Integer> getFileChanges() {
        return Collections.unmodifiableMap(fileChanges);
    }

    public int getTotalCommits() {
        return totalCommits;
    }

    public long getTotalInsertions() {
        return totalInsertions;
    }

    public long getTotalDeletions() {
        return totalDeletions;
    }

    public int distinctFiles() {
        return fileChanges.size();
    }

    /**
     * All changed files, most changed first, ties by path.
     */
    public List<FileChangeCount> rankedFiles() {
        return fileChanges.entrySet().stream()
                .map(e -> new FileChangeCount(e.getKey(), e.getValue()))
                .sorted(FileChangeCount.BY_CHANGES_DESC)
                .toList();
    }
}
