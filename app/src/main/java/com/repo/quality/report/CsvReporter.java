package com.repo.quality.report;

import com.repo.quality.metrics.DerivedMetrics;
import com.repo.quality.rules.ScoreResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * One CSV row per scored author.
 */
public class CsvReporter {

    static final String HEADER = "Author,Total,Grade,Commit Behavior,Quality and Scope,Activity,Commits,Files Modified,"
            + "Active Days,Avg Files/Commit,Avg Message Length,Avg Commit Interval,Days Since Last Commit,"
            + "File Concentration,Hotspot Participation,Contribution Ratio,Code Changes,Rapid Rework Ratio,"
            + "Rapid Rework Count,File Modifications\n";

    public void generate(List<ScoreResult> scores, Path outputPath) throws IOException {
        Files.writeString(outputPath, convert(scores));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    String convert(List<ScoreResult> scores) {
        StringBuilder csv = new StringBuilder(HEADER);
        for (ScoreResult r : scores) {
            DerivedMetrics m = r.metrics();
            csv.append(String.format(Locale.ROOT,
                    "%s,%d,%s,%d,%d,%d,%d,%d,%.1f,%.1f,%.1f,%.1f,%.1f,%.1f,%.1f,%.1f,%d,%.1f,%d,%d\n",
                    escape(r.author()),
                    r.total(),
                    r.grade(),
                    r.commitBehavior(),
                    r.qualityAndScope(),
                    r.activity(),
                    m.totalCommits(),
                    m.filesModified(),
                    m.activeDays(),
                    m.avgFilesPerCommit(),
                    m.avgMessageLength(),
                    m.avgCommitInterval(),
                    m.daysSinceLastCommit(),
                    m.fileConcentration(),
                    m.hotspotParticipation(),
                    m.contributionRatio(),
                    m.totalCodeChanges(),
                    m.rapidReworkRatio(),
                    m.rapidReworkCount(),
                    m.totalFileModifications()));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
