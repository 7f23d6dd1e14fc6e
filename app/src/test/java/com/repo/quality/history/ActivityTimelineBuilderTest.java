package com.repo.quality.history;

import com.repo.quality.core.PathExclusionMatcher;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.repo.quality.git.CommitFixtures.at;
import static com.repo.quality.git.CommitFixtures.commit;
import static org.junit.jupiter.api.Assertions.*;

class ActivityTimelineBuilderTest {

    @Test
    void testDenseMatrixOrderedByCommitCount() {
        HistoryAggregation aggregation = new HistoryAggregator(List.of(), PathExclusionMatcher.none(), null)
                .aggregate(List.of(
                        commit("Alice", at("2024-01-15T09:00:00Z"), "a.txt"),
                        commit("Bob", at("2023-12-20T09:00:00Z"), "b.txt"),
                        commit("Bob", at("2023-12-10T09:00:00Z"), "b.txt"),
                        commit("Bob", at("2023-12-01T09:00:00Z"), "b.txt"),
                        commit("Alice", at("2023-11-03T09:00:00Z"), "a.txt")));

        ActivityTimeline timeline = new ActivityTimelineBuilder().build(aggregation.authors());

        assertEquals(List.of("2023-11", "2023-12", "2024-01"), timeline.months());
        assertEquals(2, timeline.authors().size());

        ActivityTimeline.AuthorActivity bob = timeline.authors().get(0);
        assertEquals("Bob", bob.author());
        assertEquals(3, bob.totalCommits());
        assertEquals(List.of(0, 3, 0), bob.timeline());

        ActivityTimeline.AuthorActivity alice = timeline.authors().get(1);
        assertEquals(List.of(1, 0, 1), alice.timeline());
    }

    @Test
    void testEqualCountsKeepFirstSeenOrder() {
        HistoryAggregation aggregation = new HistoryAggregator(List.of(), PathExclusionMatcher.none(), null)
                .aggregate(List.of(
                        commit("Zoe", at("2024-02-01T09:00:00Z"), "a.txt"),
                        commit("Adam", at("2024-03-01T09:00:00Z"), "a.txt")));

        ActivityTimeline timeline = new ActivityTimelineBuilder().build(aggregation.authors());

        assertEquals("Zoe", timeline.authors().get(0).author());
        assertEquals("Adam", timeline.authors().get(1).author());
    }

    @Test
    void testEmptyTimeline() {
        ActivityTimeline timeline = new ActivityTimelineBuilder().build(Map.of());

        assertTrue(timeline.months().isEmpty());
        assertTrue(timeline.authors().isEmpty());
    }
}
