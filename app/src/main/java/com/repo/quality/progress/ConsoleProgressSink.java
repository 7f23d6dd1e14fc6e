package com.repo.quality.progress;

/**
 * Prints progress in place on the console.
 */
public class ConsoleProgressSink implements ProgressSink {

    @Override
    public void report(ProgressUpdate update) {
        System.out.print("\r> [" + update.current() + "%] " + update.message());
        if (update.current() >= update.total()) {
            System.out.println();
        }
        System.out.flush();
    }
}
