package com.repo.quality.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a changed path is left out of the history statistics.
 * Paths and tokens are normalized to forward slashes; matching is case-sensitive.
 */
public class PathExclusionMatcher {

    /**
     * How a token is compared with a path.
     */
    public enum MatchMode {
        /** Token equals the file name */
        BASENAME,
        /** Token appears anywhere in the path */
        SUBSTRING,
        /** Path ends with the token */
        SUFFIX;

        public static MatchMode parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final List<String> tokens;
    private final EnumSet<MatchMode> modes;

    public PathExclusionMatcher(Collection<String> tokens, Set<MatchMode> modes) {
        List<String> normalized = new ArrayList<>();
        for (String token : tokens) {
            if (token == null)
                continue;
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                normalized.add(normalize(trimmed));
            }
        }
        this.tokens = List.copyOf(normalized);
        this.modes = modes.isEmpty() ? EnumSet.noneOf(MatchMode.class) : EnumSet.copyOf(modes);
    }

    /**
     * Matcher that excludes nothing.
     */
    public static PathExclusionMatcher none() {
        return new PathExclusionMatcher(List.of(), EnumSet.of(MatchMode.BASENAME));
    }

    public boolean isExcluded(String filePath) {
        if (tokens.isEmpty() || filePath == null)
            return false;

        String path = normalize(filePath);
        String fileName = path.substring(path.lastIndexOf('/') + 1);

        for (String token : tokens) {
            if (modes.contains(MatchMode.BASENAME) && token.equals(fileName))
                return true;
            if (modes.contains(MatchMode.SUBSTRING) && path.contains(token))
                return true;
            if (modes.contains(MatchMode.SUFFIX) && path.endsWith(token))
                return true;
        }
        return false;
    }

    public List<String> getTokens() {
        return tokens;
    }

    public Set<MatchMode> getModes() {
        return EnumSet.copyOf(modes);
    }

    private static String normalize(String path) {
        return path.replace('\\', '/');
    }
}
