package net.legacy.unitthreaded.foundation.util;

import lombok.Getter;
import lombok.Value;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named timers for the test cases of one run.
 *
 * <p>A runner starts a timer per test case path and stops it when the case returns.
 * Completed timings are kept for the run summary.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 20:00
 */
public class TestTimer {
    /**
     * Map of active timers by name.
     */
    private final Map<String, Long> activeTimers = new ConcurrentHashMap<>();

    /**
     * Map of completed timer results by name.
     */
    private final Map<String, TimerResult> completedTimers = new ConcurrentHashMap<>();

    /**
     * Overall timer start time.
     */
    @Getter
    private final long startTime;

    /**
     * Creates a new test timer instance.
     */
    public TestTimer() {
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts a named timer, replacing an active timer of the same name.
     *
     * @param timerName the name of the timer
     * @return the timer start time in milliseconds
     */
    public long startTimer(String timerName) {
        long now = System.currentTimeMillis();
        activeTimers.put(timerName, now);
        return now;
    }

    /**
     * Stops a named timer and records the result.
     *
     * @param timerName the name of the timer to stop
     * @return the elapsed time in milliseconds, or -1 if timer was not found
     */
    public long stopTimer(String timerName) {
        Long timerStart = activeTimers.remove(timerName);
        if (timerStart == null) {
            return -1;
        }

        long endTime = System.currentTimeMillis();
        long duration = endTime - timerStart;

        completedTimers.put(timerName, new TimerResult(timerName, timerStart, endTime, duration));
        return duration;
    }

    /**
     * Gets the total elapsed time since this TestTimer was created.
     *
     * @return the total elapsed time in milliseconds
     */
    public long getTotalElapsedTime() {
        return System.currentTimeMillis() - startTime;
    }

    /**
     * Gets the result of a completed timer.
     *
     * @param timerName the name of the timer
     * @return the timer result, or null if not found
     */
    public TimerResult getTimerResult(String timerName) {
        return completedTimers.get(timerName);
    }

    /**
     * Gets all completed timer results.
     *
     * @return a map of timer results by name
     */
    public Map<String, TimerResult> getAllResults() {
        return new HashMap<>(completedTimers);
    }

    /**
     * Creates a summary of all completed timers, slowest first.
     *
     * @return a formatted timing summary
     */
    public String getTimingSummary() {
        StringBuilder summary = new StringBuilder();
        summary.append("Total Elapsed Time: ").append(getTotalElapsedTime()).append("ms\n");
        summary.append("Completed Timers: ").append(completedTimers.size()).append("\n");

        completedTimers.values().stream()
                .sorted(Comparator.comparingLong(TimerResult::getDuration).reversed())
                .forEach(result -> summary.append("  ")
                        .append(result.getName())
                        .append(": ")
                        .append(result.getDuration())
                        .append("ms\n"));

        return summary.toString();
    }

    /**
     * Represents the result of a completed timer operation.
     */
    @Value
    public static class TimerResult {
        String name;
        long startTime;
        long endTime;
        long duration;
    }
}
