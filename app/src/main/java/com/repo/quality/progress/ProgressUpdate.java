package com.repo.quality.progress;

import java.time.LocalDateTime;

/**
 * A single progress event.
 */
public record ProgressUpdate(
        /** Stage tag, e.g. "git_analysis" */
        String stage,

        int current,

        int total,

        /** Human readable status */
        String message,

        LocalDateTime timestamp) {

    public static ProgressUpdate of(String stage, int current, int total, String message) {
        return new ProgressUpdate(stage, current, total, message, LocalDateTime.now());
    }
}
