package com.repo.quality.progress;

/**
 * Receives coarse progress notifications. Implementations must not block the caller.
 * Callers go through {@link #reportSafely(ProgressUpdate)}, so a failing sink never aborts an analysis.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = update -> {
    };

    void report(ProgressUpdate update);

    default void reportSafely(ProgressUpdate update) {
        try {
            report(update);
        } catch (RuntimeException e) {
            System.err.println("Warning: progress sink failed at " + update.current() + "%: " + e.getMessage());
        }
    }

    /**
     * Returns the sink itself, or {@link #NONE} for null.
     */
    static ProgressSink orNone(ProgressSink sink) {
        return sink != null ? sink : NONE;
    }
}
