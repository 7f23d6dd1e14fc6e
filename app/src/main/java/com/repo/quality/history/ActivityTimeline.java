package com.repo.quality.history;

import java.util.List;

/**
 * Dense author by month commit matrix.
 */
public record ActivityTimeline(
        /** Sorted "YYYY-MM" axis */
        List<String> months,

        /** One row per author, most commits first */
        List<AuthorActivity> authors) {

    /**
     * Commits per month for one author, aligned to {@link ActivityTimeline#months()}.
     */
    public record AuthorActivity(String author, int totalCommits, List<Integer> timeline) {
    }
}
