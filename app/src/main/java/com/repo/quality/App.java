package com.repo.quality;

import com.repo.quality.analysis.HistoryAnalyzer;
import com.repo.quality.analysis.RepositoryAnalysis;
import com.repo.quality.analysis.RepositorySummary;
import com.repo.quality.core.AnalyzerConfig;
import com.repo.quality.core.CodeChangeMode;
import com.repo.quality.git.CommitRecord;
import com.repo.quality.git.JGitCommitSource;
import com.repo.quality.history.FileChangeCount;
import com.repo.quality.progress.ConsoleProgressSink;
import com.repo.quality.report.CsvReporter;
import com.repo.quality.report.JsonReporter;
import com.repo.quality.rules.Grade;
import com.repo.quality.rules.ScoreResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Commit Quality - scores the authors of a Git repository from its history.
 *
 * Usage: java -jar commit-quality-app.jar --repo <path> [options]
 */
public class App {

    public static void main(String[] args) {
        System.out.println("=== Commit Quality ===");

        CliArgs cliArgs;
        try {
            cliArgs = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            cliArgs = null;
        }
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new App().run(cliArgs);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar commit-quality-app.jar --repo <path> [options]

                Arguments:
                  --repo <path>          Path to the Git repository to analyze (required)
                  --config <file>        YAML configuration (default: <repo>/quality.yaml)
                  --start <rev>          Older end of the commit range (exclusive)
                  --end <rev>            Newer end of the commit range (default: HEAD)
                  --max-commits <n>      Maximum number of commits to analyze (default: 1000)
                  --exclude <a,b,...>    Files to leave out of the statistics
                  --match <modes>        Exclusion matching: basename, substring, suffix (default: basename)
                  --author <a,b,...>     Only analyze these authors (case-insensitive)
                  --code-changes <mode>  estimated (default) or measured
                  --output <dir>         Output directory for reports (default: current directory)
                  --recent <n>           Also list the n most recent commits
                """);
    }

    private record CliArgs(
            Path repoPath,
            Path configFile,
            String startCommit,
            String endCommit,
            Integer maxCommits,
            List<String> exclusions,
            List<String> matchModes,
            List<String> authors,
            String codeChanges,
            Path outputDir,
            int recent) {
    }

    private static CliArgs parseArgs(String[] args) {
        Path repoPath = null;
        Path configFile = null;
        String startCommit = null;
        String endCommit = null;
        Integer maxCommits = null;
        List<String> exclusions = null;
        List<String> matchModes = null;
        List<String> authors = null;
        String codeChanges = null;
        Path outputDir = Path.of(".");
        int recent = 0;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--repo" -> repoPath = Path.of(value(args, ++i));
                case "--config" -> configFile = Path.of(value(args, ++i));
                case "--start" -> startCommit = value(args, ++i);
                case "--end" -> endCommit = value(args, ++i);
                case "--max-commits" -> maxCommits = Integer.parseInt(value(args, ++i));
                case "--exclude" -> exclusions = splitList(value(args, ++i));
                case "--match" -> matchModes = splitList(value(args, ++i));
                case "--author" -> authors = splitList(value(args, ++i));
                case "--code-changes" -> codeChanges = value(args, ++i);
                case "--output" -> outputDir = Path.of(value(args, ++i));
                case "--recent" -> recent = Integer.parseInt(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (repoPath == null) {
            return null;
        }
        return new CliArgs(repoPath, configFile, startCommit, endCommit, maxCommits, exclusions, matchModes,
                authors, codeChanges, outputDir, recent);
    }

    private static String value(String[] args, int index) {
        if (index >= args.length)
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        return args[index];
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private void run(CliArgs args) throws Exception {
        AnalyzerConfig config = buildConfig(args);

        System.out.println("\n>>> PHASE 1: MINING HISTORY (GIT) <<<");
        try (JGitCommitSource source = JGitCommitSource.open(args.repoPath())) {
            System.out.println("Mining Git history for: " + args.repoPath()
                    + " (" + config.commitRange().describe() + ", max " + config.getMaxCommits() + " commits)");

            RepositoryAnalysis analysis = new HistoryAnalyzer(source, config, new ConsoleProgressSink()).analyze();
            RepositorySummary summary = analysis.summary();
            System.out.printf("Analyzed %d commits by %d authors touching %d files (+%d/-%d lines).%n",
                    summary.totalCommits(), summary.totalAuthors(), summary.totalFilesChanged(),
                    summary.totalInsertions(), summary.totalDeletions());

            System.out.println("\n>>> PHASE 2: AUTHOR SCORES <<<");
            printScores(analysis.authorScores());
            printHotspots(analysis.topChangedFiles());

            if (args.recent() > 0) {
                printRecentCommits(source.recentCommits(args.recent()));
            }

            System.out.println("\n>>> PHASE 3: GENERATING REPORTS <<<");
            Files.createDirectories(args.outputDir());
            new JsonReporter().generate(analysis, args.outputDir().resolve("quality-report.json"));
            new CsvReporter().generate(analysis.authorScores(), args.outputDir().resolve("quality-report.csv"));

            printSummary(analysis.authorScores());
        }
    }

    private AnalyzerConfig buildConfig(CliArgs args) {
        AnalyzerConfig config = args.configFile() != null
                ? AnalyzerConfig.loadFile(args.configFile())
                : AnalyzerConfig.load(args.repoPath());

        config.withRange(args.startCommit(), args.endCommit());
        if (args.maxCommits() != null)
            config.withMaxCommits(args.maxCommits());
        if (args.exclusions() != null)
            config.withExclusions(args.exclusions());
        if (args.matchModes() != null)
            config.withMatchModes(AnalyzerConfig.parseMatchModes(args.matchModes()));
        if (args.authors() != null)
            config.withAuthors(args.authors());
        if (args.codeChanges() != null)
            config.withCodeChangeMode(CodeChangeMode.parse(args.codeChanges()));
        return config;
    }

    private void printScores(List<ScoreResult> scores) {
        System.out.println("\n| %-30s | %-5s | %-5s | %-8s | %-8s | %-8s | %-7s | %-6s |".formatted(
                "Author", "Total", "Grade", "Behavior", "Quality", "Activity", "Commits", "Rework"));
        System.out.println("|" + "-".repeat(32) + "|" + "-".repeat(7) + "|" + "-".repeat(7) + "|" + "-".repeat(10)
                + "|" + "-".repeat(10) + "|" + "-".repeat(10) + "|" + "-".repeat(9) + "|" + "-".repeat(8) + "|");

        for (ScoreResult r : scores) {
            System.out.println("| %-30s | %-5d | %-5s | %-8d | %-8d | %-8d | %-7d | %-5.1f%% |".formatted(
                    truncate(r.author(), 30),
                    r.total(),
                    r.grade(),
                    r.commitBehavior(),
                    r.qualityAndScope(),
                    r.activity(),
                    r.metrics().totalCommits(),
                    r.metrics().rapidReworkRatio()));
        }
    }

    private void printHotspots(List<FileChangeCount> files) {
        if (files.isEmpty())
            return;
        System.out.println("\nMost changed files:");
        files.stream()
                .limit(10)
                .forEach(f -> System.out.printf("  %-60s %d%n", truncate(f.path(), 60), f.changes()));
    }

    private void printRecentCommits(List<CommitRecord> commits) {
        System.out.println("\nRecent commits:");
        for (CommitRecord c : commits) {
            String subject = c.message().strip().lines().findFirst().orElse("");
            System.out.printf("  %s %s %-20s %s%n", c.shortHash(), c.formattedDate(), truncate(c.author(), 20),
                    truncate(subject, 60));
        }
    }

    private void printSummary(List<ScoreResult> scores) {
        Map<Grade, Integer> gradeCounts = new EnumMap<>(Grade.class);
        for (ScoreResult r : scores) {
            gradeCounts.merge(r.grade(), 1, Integer::sum);
        }

        System.out.println("\n=== SUMMARY ===");
        System.out.println("Grade Distribution:");
        gradeCounts.forEach((grade, count) -> System.out.printf("  %-2s %-70s: %d%n",
                grade, grade.getDescription(), count));
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
