package com.repo.quality.core;

import com.repo.quality.core.PathExclusionMatcher.MatchMode;
import com.repo.quality.git.CommitRange;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a history analysis run.
 * Loaded from quality.yaml in the repository root or uses sensible defaults.
 */
public class AnalyzerConfig {

    public static final String FILE_NAME = "quality.yaml";

    public static final int DEFAULT_MAX_COMMITS = 1000;
    public static final int DEFAULT_TOP_FILES = 50;

    // History window
    private int maxCommits = DEFAULT_MAX_COMMITS;
    private String startCommit = null;
    private String endCommit = null;

    // Path exclusions
    private List<String> exclusions = List.of();
    private EnumSet<MatchMode> matchModes = EnumSet.of(MatchMode.BASENAME);

    // Author allow-list, empty means everybody
    private List<String> authors = List.of();

    // Report and scoring
    private int topFiles = DEFAULT_TOP_FILES;
    private CodeChangeMode codeChangeMode = CodeChangeMode.ESTIMATED;

    /**
     * Load quality.yaml from the repository root, or return defaults if there is none.
     */
    public static AnalyzerConfig load(Path repoRoot) {
        return loadFile(repoRoot.resolve(FILE_NAME));
    }

    /**
     * Load the given YAML file, or return defaults if it does not exist.
     */
    public static AnalyzerConfig loadFile(Path configFile) {
        AnalyzerConfig config = new AnalyzerConfig();

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.containsKey("history")) {
            Map<String, Object> history = (Map<String, Object>) data.get("history");
            int configured = getInt(history, "max_commits", maxCommits);
            if (configured > 0) {
                maxCommits = configured;
            } else {
                System.err.println("Warning: history.max_commits must be positive, keeping " + maxCommits
                        + " (was " + configured + ")");
            }
            startCommit = getString(history, "start_commit", startCommit);
            endCommit = getString(history, "end_commit", endCommit);
        }

        if (data.containsKey("exclusions")) {
            Map<String, Object> exc = (Map<String, Object>) data.get("exclusions");
            exclusions = getStrings(exc, "files", exclusions);
            List<String> modes = getStrings(exc, "match", List.of());
            if (!modes.isEmpty()) {
                matchModes = parseMatchModes(modes);
            }
        }

        if (data.containsKey("authors")) {
            authors = getStrings(data, "authors", authors);
        }

        if (data.containsKey("report")) {
            Map<String, Object> report = (Map<String, Object>) data.get("report");
            topFiles = getInt(report, "top_files", topFiles);
        }

        if (data.containsKey("scoring")) {
            Map<String, Object> scoring = (Map<String, Object>) data.get("scoring");
            String mode = getString(scoring, "code_changes", null);
            if (mode != null) {
                codeChangeMode = CodeChangeMode.parse(mode);
            }
        }
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        if (val != null)
            return String.valueOf(val);
        return defaultVal;
    }

    private List<String> getStrings(Map<String, Object> map, String key, List<String> defaultVal) {
        Object val = map.get(key);
        if (val instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item != null)
                    result.add(String.valueOf(item));
            }
            return List.copyOf(result);
        }
        return defaultVal;
    }

    public static EnumSet<MatchMode> parseMatchModes(List<String> values) {
        EnumSet<MatchMode> modes = EnumSet.noneOf(MatchMode.class);
        for (String value : values) {
            if (!value.isBlank())
                modes.add(MatchMode.parse(value));
        }
        return modes;
    }

    // === Getters ===

    public int getMaxCommits() {
        return maxCommits;
    }

    public String getStartCommit() {
        return startCommit;
    }

    public String getEndCommit() {
        return endCommit;
    }

    public List<String> getExclusions() {
        return exclusions;
    }

    public EnumSet<MatchMode> getMatchModes() {
        return EnumSet.copyOf(matchModes);
    }

    public List<String> getAuthors() {
        return authors;
    }

    public int getTopFiles() {
        return topFiles;
    }

    public CodeChangeMode getCodeChangeMode() {
        return codeChangeMode;
    }

    public CommitRange commitRange() {
        return new CommitRange(startCommit, endCommit);
    }

    public PathExclusionMatcher pathExclusions() {
        return new PathExclusionMatcher(exclusions, matchModes);
    }

    // === Command line overrides ===

    public AnalyzerConfig withMaxCommits(int maxCommits) {
        if (maxCommits <= 0)
            throw new IllegalArgumentException("max commits must be positive: " + maxCommits);
        this.maxCommits = maxCommits;
        return this;
    }

    public AnalyzerConfig withRange(String startCommit, String endCommit) {
        if (startCommit != null)
            this.startCommit = startCommit;
        if (endCommit != null)
            this.endCommit = endCommit;
        return this;
    }

    public AnalyzerConfig withExclusions(List<String> exclusions) {
        this.exclusions = List.copyOf(exclusions);
        return this;
    }

    public AnalyzerConfig withMatchModes(EnumSet<MatchMode> matchModes) {
        this.matchModes = EnumSet.copyOf(matchModes);
        return this;
    }

    public AnalyzerConfig withAuthors(List<String> authors) {
        this.authors = List.copyOf(authors);
        return this;
    }

    public AnalyzerConfig withTopFiles(int topFiles) {
        this.topFiles = topFiles;
        return this;
    }

    public AnalyzerConfig withCodeChangeMode(CodeChangeMode codeChangeMode) {
        this.codeChangeMode = codeChangeMode;
        return this;
    }
}
