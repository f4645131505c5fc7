package com.phillippitts.tagprobe.util;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Conversions from container timing fields (sample counts, byte counts) to {@link Duration}.
 *
 * @since 1.0
 */
public final class Durations {

    public static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final BigInteger BIG_NANOS_PER_SECOND = BigInteger.valueOf(NANOS_PER_SECOND);

    private Durations() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes {@code units / unitsPerSecond} seconds at nanosecond precision (truncated).
     *
     * @param units          e.g. sample count or byte count, treated as unsigned
     * @param unitsPerSecond e.g. sample rate or byte rate
     * @return the duration, or {@link Duration#ZERO} when {@code unitsPerSecond} is not positive
     */
    public static Duration ofFraction(long units, long unitsPerSecond) {
        if (unitsPerSecond <= 0) {
            return Duration.ZERO;
        }
        long seconds = Long.divideUnsigned(units, unitsPerSecond);
        long rem = Long.remainderUnsigned(units, unitsPerSecond);
        long nanos = BigInteger.valueOf(rem)
                .multiply(BIG_NANOS_PER_SECOND)
                .divide(BigInteger.valueOf(unitsPerSecond))
                .longValue();
        return Duration.ofSeconds(seconds, nanos);
    }

    /**
     * Computes {@code units / unitsPerSecond} in whole seconds, discarding the remainder.
     *
     * @return the duration, or {@link Duration#ZERO} when {@code unitsPerSecond} is not positive
     */
    public static Duration ofTruncatedSeconds(long units, long unitsPerSecond) {
        if (unitsPerSecond <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofSeconds(Long.divideUnsigned(units, unitsPerSecond));
    }
}
