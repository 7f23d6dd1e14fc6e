package com.repo.quality.history;

import java.util.Collections;
import java.util.Map;

/**
 * Output of one traversal: global tallies plus one aggregate per author in order of first appearance.
 */
public record HistoryAggregation(GlobalAggregate global, Map<String, AuthorAggregate> authors) {

    public HistoryAggregation {
        authors = Collections.unmodifiableMap(authors);
    }
}
