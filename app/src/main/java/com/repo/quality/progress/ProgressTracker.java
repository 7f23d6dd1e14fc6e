package com.repo.quality.progress;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Keeps every progress update of a run and forwards it to an optional callback.
 */
public class ProgressTracker implements ProgressSink {

    private final Consumer<ProgressUpdate> callback;
    private final List<ProgressUpdate> updates = new ArrayList<>();
    private String currentStage;

    public ProgressTracker() {
        this(null);
    }

    public ProgressTracker(Consumer<ProgressUpdate> callback) {
        this.callback = callback;
    }

    @Override
    public void report(ProgressUpdate update) {
        currentStage = update.stage();
        updates.add(update);
        if (callback != null) {
            callback.accept(update);
        }
    }

    public void update(String stage, int current, int total, String message) {
        report(ProgressUpdate.of(stage, current, total, message));
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public List<ProgressUpdate> getUpdates() {
        return List.copyOf(updates);
    }

    public static int percentage(int current, int total) {
        if (total == 0)
            return 0;
        return (int) ((double) current / total * 100);
    }
}
