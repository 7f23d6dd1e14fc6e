package com.repo.quality.report;

import com.repo.quality.analysis.ChangeDistribution;
import com.repo.quality.analysis.RepositoryAnalysis;
import com.repo.quality.analysis.RepositorySummary;
import com.repo.quality.history.ActivityTimeline;
import com.repo.quality.history.FileChangeCount;
import com.repo.quality.metrics.DerivedMetrics;
import com.repo.quality.rules.ScoreResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes an analysis as self-describing JSON, with metadata and a field schema for external tools.
 */
public class JsonReporter {

    public void generate(RepositoryAnalysis analysis, Path outputPath) throws IOException {
        Files.writeString(outputPath, convertToSelfDescribingJson(analysis));
        System.out.println("JSON Report generated at: " + outputPath.toAbsolutePath());
    }

    public String convertToSelfDescribingJson(RepositoryAnalysis analysis) {
        return format(
                "{ \"metadata\": { \"generatedAt\": \"%s\", \"tool\": \"Commit Quality 1.0\", \"description\": \"Author quality scores mined from Git history\" }, "
                        +
                        "\"schema\": { " +
                        "\"totalScore\": \"0-100. Sum of commitBehavior (0-40), qualityAndScope (0-30) and activity (0-30).\", "
                        +
                        "\"grade\": \"S (>=90), A (>=80), B (>=70), C (>=60), D otherwise.\", " +
                        "\"rapidReworkRatio\": \"Percentage of consecutive edits of the same file by the same author within 5 days.\", "
                        +
                        "\"hotspotParticipation\": \"Percentage of the author's files among the top 20% most changed files.\", "
                        +
                        "\"totalCodeChanges\": \"Inserted plus deleted lines attributed to the author.\", " +
                        "\"daysSinceLastCommit\": \"Measured against the time of analysis, not the analyzed range.\" " +
                        "}, \"summary\": %s, \"topChangedFiles\": %s, \"changeDistribution\": %s, "
                        +
                        "\"developerActivity\": %s, \"authors\": %s }",
                Instant.now().toString(),
                summaryToJson(analysis.summary()),
                filesToJson(analysis.topChangedFiles()),
                distributionToJson(analysis.changeDistribution()),
                activityToJson(analysis.developerActivity()),
                scoresToJson(analysis.authorScores()));
    }

    String summaryToJson(RepositorySummary s) {
        return format(
                "{ \"totalCommits\": %d, \"totalAuthors\": %d, \"totalFilesChanged\": %d, \"totalInsertions\": %d, "
                        + "\"totalDeletions\": %d, \"authors\": %s }",
                s.totalCommits(), s.totalAuthors(), s.totalFilesChanged(), s.totalInsertions(), s.totalDeletions(),
                stringArray(s.authors()));
    }

    String filesToJson(List<FileChangeCount> files) {
        return files.stream()
                .map(f -> format("{ \"filename\": \"%s\", \"changes\": %d }", escapeJson(f.path()), f.changes()))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    String distributionToJson(ChangeDistribution d) {
        return format("{ \"low\": %d, \"medium\": %d, \"high\": %d, \"veryHigh\": %d }",
                d.low(), d.medium(), d.high(), d.veryHigh());
    }

    String activityToJson(ActivityTimeline timeline) {
        String authors = timeline.authors().stream()
                .map(a -> format("{ \"author\": \"%s\", \"totalCommits\": %d, \"timeline\": %s }",
                        escapeJson(a.author()), a.totalCommits(),
                        a.timeline().stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"))))
                .collect(Collectors.joining(", ", "[", "]"));
        return format("{ \"months\": %s, \"authors\": %s }", stringArray(timeline.months()), authors);
    }

    String scoresToJson(List<ScoreResult> scores) {
        return scores.stream()
                .map(this::scoreToJson)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String scoreToJson(ScoreResult r) {
        DerivedMetrics m = r.metrics();
        return format(
                "{ \"author\": \"%s\", \"totalScore\": %d, \"grade\": \"%s\", \"gradeDescription\": \"%s\", "
                        + "\"scores\": { \"commitBehavior\": %d, \"qualityAndScope\": %d, \"activity\": %d }, "
                        + "\"metrics\": { \"totalCommits\": %d, \"filesModified\": %d, \"activeDays\": %.1f, "
                        + "\"avgFilesPerCommit\": %.1f, \"avgMessageLength\": %.1f, \"avgCommitInterval\": %.1f, "
                        + "\"daysSinceLastCommit\": %.1f, \"fileConcentration\": %.1f, \"hotspotParticipation\": %.1f, "
                        + "\"contributionRatio\": %.1f, \"totalCodeChanges\": %d, \"rapidReworkRatio\": %.1f, "
                        + "\"rapidReworkCount\": %d, \"totalFileModifications\": %d } }",
                escapeJson(r.author()), r.total(), r.grade(), escapeJson(r.grade().getDescription()),
                r.commitBehavior(), r.qualityAndScope(), r.activity(),
                m.totalCommits(), m.filesModified(), m.activeDays(),
                m.avgFilesPerCommit(), m.avgMessageLength(), m.avgCommitInterval(),
                m.daysSinceLastCommit(), m.fileConcentration(), m.hotspotParticipation(),
                m.contributionRatio(), m.totalCodeChanges(), m.rapidReworkRatio(),
                m.rapidReworkCount(), m.totalFileModifications());
    }

    private String stringArray(List<String> values) {
        return values.stream()
                .map(s -> "\"" + escapeJson(s) + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }

    static String escapeJson(String s) {
        if (s == null)
            return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
