package com.repo.quality.history;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reshapes per-author monthly tallies into an {@link ActivityTimeline}.
 */
public class ActivityTimelineBuilder {

    public ActivityTimeline build(Map<String, AuthorAggregate> authors) {
        TreeSet<String> allMonths = new TreeSet<>();
        for (AuthorAggregate author : authors.values()) {
            allMonths.addAll(author.getMonthlyCommits().keySet());
        }
        List<String> months = List.copyOf(allMonths);

        List<AuthorAggregate> sorted = new ArrayList<>(authors.values());
        sorted.sort(Comparator.comparingInt(AuthorAggregate::getCommitCount).reversed());

        List<ActivityTimeline.AuthorActivity> rows = new ArrayList<>();
        for (AuthorAggregate author : sorted) {
            Map<String, Integer> monthly = author.getMonthlyCommits();
            List<Integer> series = months.stream()
                    .map(month -> monthly.getOrDefault(month, 0))
                    .toList();
            rows.add(new ActivityTimeline.AuthorActivity(author.getAuthor(), author.getCommitCount(), series));
        }
        return new ActivityTimeline(months, rows);
    }
}
