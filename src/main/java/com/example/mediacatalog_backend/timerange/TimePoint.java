package com.example.mediacatalog_backend.timerange;

import com.example.mediacatalog_backend.exception.TimeRangeParseException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A point on the media timeline with nanosecond resolution, written {@code <seconds>:<nanoseconds>}
 * with an optional leading {@code -}.
 * <p>
 * Stored normalized: {@code nanos} is always in {@code [0, 1_000_000_000)} and carries the sign
 * through {@code seconds}, so {@code -1:500000000} is held as {@code seconds=-2, nanos=500000000}.
 * All arithmetic is exact; overflow throws {@link ArithmeticException}.
 */
public final class TimePoint implements Comparable<TimePoint> {
    public static final TimePoint ZERO = new TimePoint(0L, 0);

    static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final Pattern PATTERN = Pattern.compile("^(-)?(\\d+):(\\d{1,9})$");

    private final long seconds;
    private final int nanos;

    private TimePoint(long seconds, int nanos) {
        this.seconds = seconds;
        this.nanos = nanos;
    }

    public static TimePoint of(long seconds, long nanos) {
        long carry = Math.floorDiv(nanos, NANOS_PER_SECOND);
        int rest = (int) Math.floorMod(nanos, NANOS_PER_SECOND);
        return new TimePoint(Math.addExact(seconds, carry), rest);
    }

    public static TimePoint parse(String text) {
        if (text == null) {
            throw new TimeRangeParseException("TIMESTAMP_MISSING");
        }
        Matcher m = PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new TimeRangeParseException("BAD_TIMESTAMP");
        }
        TimePoint magnitude;
        try {
            magnitude = new TimePoint(Long.parseLong(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new TimeRangeParseException("BAD_TIMESTAMP");
        }
        return m.group(1) != null ? magnitude.negate() : magnitude;
    }

    public long seconds() {
        return seconds;
    }

    public int nanos() {
        return nanos;
    }

    public boolean isNegative() {
        return seconds < 0;
    }

    public TimePoint plus(TimePoint other) {
        return of(Math.addExact(seconds, other.seconds), (long) nanos + other.nanos);
    }

    public TimePoint minus(TimePoint other) {
        return plus(other.negate());
    }

    public TimePoint negate() {
        if (nanos == 0) {
            return new TimePoint(Math.negateExact(seconds), 0);
        }
        return new TimePoint(Math.subtractExact(Math.negateExact(seconds), 1L), (int) (NANOS_PER_SECOND - nanos));
    }

    @Override
    public int compareTo(TimePoint o) {
        int c = Long.compare(seconds, o.seconds);
        return c != 0 ? c : Integer.compare(nanos, o.nanos);
    }

    public boolean isBefore(TimePoint o) {
        return compareTo(o) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimePoint other)) return false;
        return seconds == other.seconds && nanos == other.nanos;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seconds, nanos);
    }

    @Override
    public String toString() {
        if (isNegative()) {
            return "-" + negate();
        }
        return seconds + ":" + nanos;
    }
}
