package org.janelia.relief.util;

/**
 * Utility to track elapsed process time.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        final long millis = getElapsedMilliseconds() % 1000;
        return String.format("%d hours, %d minutes, %d.%03d seconds", hours, minutes, seconds, millis);
    }
}
