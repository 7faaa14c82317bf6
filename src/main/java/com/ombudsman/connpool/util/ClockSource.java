package com.ombudsman.connpool.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.concurrent.TimeUnit;

/**
 * A monotonic provider of opaque time-stamps and elapsed time calculations.
 * <p>
 * Time-stamps have nanosecond resolution on every platform, so that an age
 * threshold of zero treats any connection that has aged at all as stale.
 */
@SuppressWarnings("unused")
public interface ClockSource {

    ClockSource CLOCK = new NanosecondClockSource();

    /**
     * Get the current time-stamp (resolution is opaque).
     *
     * @return the current time-stamp
     */
    static long currentTime() {
        return CLOCK.currentTime0();
    }

    long currentTime0();

    /**
     * Convert an opaque time-stamp into an elapsed time in milliseconds, based on
     * the current instant in time.
     *
     * @param startTime an opaque time-stamp returned by {@link #currentTime()}
     * @return the elapsed time between startTime and now in milliseconds
     */
    static long elapsedMillis(long startTime) {
        return CLOCK.elapsedMillis0(startTime, CLOCK.currentTime0());
    }

    /**
     * Get the difference in milliseconds between two opaque time-stamps.
     *
     * @param startTime an opaque time-stamp
     * @param endTime   an opaque time-stamp
     * @return the elapsed time between startTime and endTime in milliseconds
     */
    static long elapsedMillis(long startTime, long endTime) {
        return CLOCK.elapsedMillis0(startTime, endTime);
    }

    long elapsedMillis0(long startTime, long endTime);

    static long elapsedNanos(long startTime) {
        return CLOCK.elapsedNanos0(startTime, CLOCK.currentTime0());
    }

    static long elapsedNanos(long startTime, long endTime) {
        return CLOCK.elapsedNanos0(startTime, endTime);
    }

    long elapsedNanos0(long startTime, long endTime);

    /**
     * Return the specified opaque time-stamp plus the specified number of milliseconds.
     *
     * @param time   an opaque time-stamp
     * @param millis milliseconds to add (may be negative)
     * @return a new opaque time-stamp
     */
    static long plusMillis(long time, long millis) {
        return CLOCK.plusMillis0(time, millis);
    }

    long plusMillis0(long time, long millis);

    /**
     * Get a String representation of the elapsed time in appropriate magnitude terminology,
     * e.g. {@code 1m30s250ms}.
     *
     * @param startTime an opaque time-stamp
     * @param endTime   an opaque time-stamp
     * @return a string representation of the elapsed time interval
     */
    static String elapsedDisplayString(long startTime, long endTime) {
        long elapsedNanos = CLOCK.elapsedNanos0(startTime, endTime);
        StringBuilder sb = new StringBuilder(elapsedNanos < 0 ? "-" : "");
        elapsedNanos = Math.abs(elapsedNanos);

        for (int i = 0; i < Units.DESCENDING.length; i++) {
            TimeUnit unit = Units.DESCENDING[i];
            long converted = unit.convert(elapsedNanos, TimeUnit.NANOSECONDS);

            if (converted > 0) {
                sb.append(converted).append(Units.DISPLAY[i]);
                elapsedNanos -= TimeUnit.NANOSECONDS.convert(converted, unit);
            }
        }
        return sb.length() == 0 ? "0ns" : sb.toString();
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    final class Units {

        static final TimeUnit[] DESCENDING = {TimeUnit.DAYS, TimeUnit.HOURS, TimeUnit.MINUTES,
                TimeUnit.SECONDS, TimeUnit.MILLISECONDS, TimeUnit.MICROSECONDS, TimeUnit.NANOSECONDS};
        static final String[] DISPLAY = {"d", "h", "m", "s", "ms", "µs", "ns"};
    }

    @NoArgsConstructor
    final class NanosecondClockSource implements ClockSource {

        @Override
        public long currentTime0() {
            return System.nanoTime();
        }

        @Override
        public long elapsedMillis0(long startTime, long endTime) {
            return TimeUnit.NANOSECONDS.toMillis(endTime - startTime);
        }

        @Override
        public long elapsedNanos0(long startTime, long endTime) {
            return endTime - startTime;
        }

        @Override
        public long plusMillis0(long time, long millis) {
            return time + TimeUnit.MILLISECONDS.toNanos(millis);
        }
    }
}
