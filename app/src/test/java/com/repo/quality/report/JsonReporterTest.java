package com.repo.quality.report;

import com.repo.quality.analysis.ChangeDistribution;
import com.repo.quality.analysis.RepositoryAnalysis;
import com.repo.quality.analysis.RepositorySummary;
import com.repo.quality.history.ActivityTimeline;
import com.repo.quality.history.FileChangeCount;
import com.repo.quality.metrics.DerivedMetrics;
import com.repo.quality.rules.Grade;
import com.repo.quality.rules.ScoreResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReporterTest {

    @TempDir
    Path tempDir;

    private final JsonReporter reporter = new JsonReporter();

    static ScoreResult score(String author, int total, Grade grade) {
        DerivedMetrics metrics = new DerivedMetrics(12, 7, 45.0, 2.5, 31.2, 3.8, 4.0, 80.0, 42.9, 60.0, 1234,
                25.0, 3, 12);
        return new ScoreResult(author, 38, 22, 24, total, grade, metrics);
    }

    private RepositoryAnalysis sampleAnalysis() {
        return new RepositoryAnalysis(
                new RepositorySummary(20, 2, 3, 400, 120, List.of("Alice", "Bob \"B\"")),
                List.of(new FileChangeCount("src/Main.java", 9), new FileChangeCount("C:\\tmp\\x.txt", 1)),
                new ChangeDistribution(2, 1, 0, 0),
                new ActivityTimeline(List.of("2024-01", "2024-02"),
                        List.of(new ActivityTimeline.AuthorActivity("Alice", 12, List.of(5, 7)))),
                List.of(score("Alice", 84, Grade.A)));
    }

    @Test
    void testSelfDescribingJsonSections() {
        String json = reporter.convertToSelfDescribingJson(sampleAnalysis());

        assertTrue(json.startsWith("{ \"metadata\": {"));
        assertTrue(json.contains("\"tool\": \"Commit Quality 1.0\""));
        assertTrue(json.contains("\"schema\": {"));
        assertTrue(json.contains("\"summary\": { \"totalCommits\": 20, \"totalAuthors\": 2"));
        assertTrue(json.contains("\"authors\": [\"Alice\", \"Bob \\\"B\\\"\"]"), "Author names are escaped");
        assertTrue(json.contains("\"changeDistribution\": { \"low\": 2, \"medium\": 1, \"high\": 0, \"veryHigh\": 0 }"));
        assertTrue(json.contains("\"months\": [\"2024-01\", \"2024-02\"]"));
        assertTrue(json.contains("\"timeline\": [5, 7]"));
        assertTrue(json.endsWith(" }"));
    }

    @Test
    void testFilesJson() {
        String json = reporter.filesToJson(sampleAnalysis().topChangedFiles());

        assertEquals("[{ \"filename\": \"src/Main.java\", \"changes\": 9 }, "
                + "{ \"filename\": \"C:\\\\tmp\\\\x.txt\", \"changes\": 1 }]", json);
    }

    @Test
    void testScoreJsonUsesOneDecimal() {
        String json = reporter.scoresToJson(List.of(score("Alice", 84, Grade.A)));

        assertTrue(json.contains("\"totalScore\": 84"));
        assertTrue(json.contains("\"grade\": \"A\""));
        assertTrue(json.contains("\"gradeDescription\": \"" + Grade.A.getDescription() + "\""));
        assertTrue(json.contains("\"scores\": { \"commitBehavior\": 38, \"qualityAndScope\": 22, \"activity\": 24 }"));
        assertTrue(json.contains("\"avgMessageLength\": 31.2"));
        assertTrue(json.contains("\"hotspotParticipation\": 42.9"));
        assertTrue(json.contains("\"totalCodeChanges\": 1234"));
    }

    @Test
    void testEscapeJson() {
        assertEquals("", JsonReporter.escapeJson(null));
        assertEquals("line\\nnext \\\"quoted\\\" back\\\\slash", JsonReporter.escapeJson("line\nnext \"quoted\" back\\slash"));
    }

    @Test
    void testEscapeJsonControlCharacters() {
        assertEquals("bell\\u0007 esc\\u001b nul\\u0000", JsonReporter.escapeJson("bell\u0007 esc\u001b nul\u0000"));
        assertEquals("caf\u00e9", JsonReporter.escapeJson("caf\u00e9"), "Printable characters are kept");
    }

    @Test
    void testGenerateWritesFile() throws Exception {
        Path output = tempDir.resolve("quality-report.json");

        reporter.generate(sampleAnalysis(), output);

        assertTrue(Files.exists(output));
        assertTrue(Files.readString(output).contains("\"topChangedFiles\": [{ \"filename\": \"src/Main.java\""));
    }
}
