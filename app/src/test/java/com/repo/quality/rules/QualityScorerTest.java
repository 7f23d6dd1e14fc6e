package com.repo.quality.rules;

import com.repo.quality.metrics.DerivedMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityScorerTest {

    private final QualityScorer scorer = new QualityScorer();

    private static DerivedMetrics metrics(double avgFiles, double daysSince, double messageLength, int filesModified,
            long codeChanges, double reworkRatio, double activeDays, double contribution) {
        return new DerivedMetrics(10, filesModified, activeDays, avgFiles, messageLength, activeDays / 10,
                daysSince, 50.0, 20.0, contribution, codeChanges, reworkRatio, 0, 0);
    }

    private static DerivedMetrics withAvgFiles(double avgFiles) {
        return metrics(avgFiles, 100, 5, 0, 0, 100, 1, 0);
    }

    @Test
    void testTopScoringAuthor() {
        ScoreResult result = scorer.score("Alice", metrics(2.0, 1, 30, 60, 20000, 0, 200, 50));

        assertEquals(40, result.commitBehavior());
        assertEquals(30, result.qualityAndScope());
        assertEquals(30, result.activity());
        assertEquals(100, result.total());
        assertEquals(Grade.S, result.grade());
        assertEquals("Alice", result.author());
    }

    @Test
    void testLowestScoringAuthor() {
        ScoreResult result = scorer.score("Bob", metrics(0.2, 365, 3, 1, 10, 80, 1, 1));

        assertEquals(5 + 1 + 5, result.commitBehavior());
        assertEquals(1 + 1 + 2, result.qualityAndScope());
        assertEquals(3 + 3 + 3, result.activity());
        assertEquals(24, result.total());
        assertEquals(Grade.D, result.grade());
    }

    @Test
    void testTwoFilesPerCommitEarnsTwentyPoints() {
        // 20 for file count, 1 for recency, 5 for messages
        assertEquals(26, scorer.score("x", withAvgFiles(2.0)).commitBehavior());
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 20", "3.0, 20", "3.1, 18", "6.0, 18", "0.5, 15", "0.9, 15", "6.1, 15", "10.0, 15",
            "10.1, 10", "15.0, 10", "15.1, 5", "0.4, 5", "0.0, 5"
    })
    void testFilesPerCommitBands(double avgFiles, int points) {
        assertEquals(points + 6, scorer.score("x", withAvgFiles(avgFiles)).commitBehavior(),
                "avg files per commit " + avgFiles);
    }

    @Test
    void testRecencyAndMessageBands() {
        assertEquals(20 + 5 + 15, scorer.score("x", metrics(2, 30, 20, 0, 0, 0, 1, 0)).commitBehavior());
        assertEquals(20 + 3 + 11, scorer.score("x", metrics(2, 30.1, 19.9, 0, 0, 0, 1, 0)).commitBehavior());
        assertEquals(20 + 3 + 11, scorer.score("x", metrics(2, 90, 10, 0, 0, 0, 1, 0)).commitBehavior());
        assertEquals(20 + 1 + 5, scorer.score("x", metrics(2, 90.1, 9.9, 0, 0, 0, 1, 0)).commitBehavior());
    }

    @Test
    void testQualityAndScopeBands() {
        assertEquals(7 + 6 + 12, scorer.score("x", metrics(2, 1, 30, 30, 5000, 20, 1, 0)).qualityAndScope());
        assertEquals(5 + 4 + 9, scorer.score("x", metrics(2, 1, 30, 15, 2000, 30, 1, 0)).qualityAndScope());
        assertEquals(3 + 2 + 5, scorer.score("x", metrics(2, 1, 30, 5, 500, 50, 1, 0)).qualityAndScope());
        assertEquals(1 + 1 + 2, scorer.score("x", metrics(2, 1, 30, 4, 499, 50.1, 1, 0)).qualityAndScope());
        assertEquals(1 + 1 + 15, scorer.score("x", metrics(2, 1, 30, 0, 0, 10, 1, 0)).qualityAndScope());
    }

    @Test
    void testActivityBands() {
        assertEquals(8 + 8 + 8, scorer.score("x", metrics(2, 1, 30, 30, 0, 0, 90, 15)).activity());
        assertEquals(6 + 6 + 6, scorer.score("x", metrics(2, 1, 30, 10, 0, 0, 30, 5)).activity());
        assertEquals(3 + 3 + 3, scorer.score("x", metrics(2, 1, 30, 9, 0, 0, 29.9, 4.9)).activity());
        assertEquals(10 + 10 + 10, scorer.score("x", metrics(2, 1, 30, 50, 0, 0, 180, 30)).activity());
    }

    @Test
    void testSubScoresSumToTotalWithinCeilings() {
        double[] files = { 0, 0.7, 2, 4, 8, 12, 20 };
        double[] days = { 0, 45, 400 };
        int[] breadth = { 0, 7, 20, 40, 80 };
        for (double f : files) {
            for (double d : days) {
                for (int b : breadth) {
                    ScoreResult r = scorer.score("x", metrics(f, d, b, b, b * 200L, b, b * 3, b / 2.0));
                    assertEquals(r.commitBehavior() + r.qualityAndScope() + r.activity(), r.total());
                    assertTrue(r.commitBehavior() <= QualityScorer.COMMIT_BEHAVIOR_MAX);
                    assertTrue(r.qualityAndScope() <= QualityScorer.QUALITY_AND_SCOPE_MAX);
                    assertTrue(r.activity() <= QualityScorer.ACTIVITY_MAX);
                    assertTrue(r.total() >= 0 && r.total() <= 100);
                    assertEquals(Grade.fromTotal(r.total()), r.grade());
                }
            }
        }
    }

    @Test
    void testDimensionsExposeTheirTables() {
        List<QualityScorer.Dimension> dimensions = scorer.dimensions();

        assertEquals(List.of("commit_behavior", "quality_and_scope", "activity"),
                dimensions.stream().map(QualityScorer.Dimension::name).toList());
        assertEquals(100, dimensions.stream().mapToInt(QualityScorer.Dimension::ceiling).sum());
        for (QualityScorer.Dimension dimension : dimensions) {
            assertEquals(3, dimension.tables().size(), dimension.name());
        }
    }

    @Test
    void testScoreAllSortsDescendingAndStable() {
        Map<String, DerivedMetrics> input = new LinkedHashMap<>();
        input.put("Low", metrics(0.2, 365, 3, 1, 10, 80, 1, 1));
        input.put("FirstTie", withAvgFiles(2.0));
        input.put("Top", metrics(2.0, 1, 30, 60, 20000, 0, 200, 50));
        input.put("SecondTie", withAvgFiles(2.0));

        List<ScoreResult> results = scorer.scoreAll(input);

        assertEquals(List.of("Top", "FirstTie", "SecondTie", "Low"),
                results.stream().map(ScoreResult::author).toList());
        assertEquals(results.get(1).total(), results.get(2).total());
    }
}
