package net.legacy.unit.foundation.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Times named operations of a test run.
 *
 * @author qwq-dev
 * @version 1.1
 * @since 2025-06-07 22:30
 */
public class TestTimer {
    /**
     * Map of active timers by name.
     */
    private final Map<String, Long> activeTimers = new ConcurrentHashMap<>();

    /**
     * Starts a named timer.
     *
     * @param timerName the name of the timer
     * @return the timer start time in milliseconds
     */
    public long startTimer(String timerName) {
        long startTime = System.currentTimeMillis();
        activeTimers.put(timerName, startTime);
        return startTime;
    }

    /**
     * Stops a named timer.
     *
     * @param timerName the name of the timer to stop
     * @return the elapsed time in milliseconds, or -1 if timer was not found
     */
    public long stopTimer(String timerName) {
        Long startTime = activeTimers.remove(timerName);
        if (startTime == null) {
            return -1;
        }

        return System.currentTimeMillis() - startTime;
    }
}
