package com.example.mediacatalog_backend.timerange;

import com.example.mediacatalog_backend.exception.TimeRangeParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interval on the media timeline. A {@code null} start means unbounded past, a {@code null} end
 * means unbounded future. Unbounded sides are always exclusive.
 * <p>
 * Canonical text form is {@code <mark><start>_<end><mark>}, for example {@code [0:0_10:0)}.
 * Instances are never empty.
 */
public final class TimeRange implements Comparable<TimeRange> {
    public static final TimeRange ETERNITY = new TimeRange(null, false, null, false);

    private static final Pattern PATTERN = Pattern.compile("^([\\[(])?([^_\\[\\]()]*)_([^_\\[\\]()]*)([\\])])?$");

    private final TimePoint start;
    private final boolean startInclusive;
    private final TimePoint end;
    private final boolean endInclusive;

    private TimeRange(TimePoint start, boolean startInclusive, TimePoint end, boolean endInclusive) {
        this.start = start;
        this.startInclusive = start != null && startInclusive;
        this.end = end;
        this.endInclusive = end != null && endInclusive;
    }

    public static TimeRange of(TimePoint start, boolean startInclusive, TimePoint end, boolean endInclusive) {
        TimeRange r = ofOrNull(start, startInclusive, end, endInclusive);
        if (r == null) {
            throw new TimeRangeParseException("EMPTY_TIMERANGE");
        }
        return r;
    }

    /** Half-open {@code [start_end)}. */
    public static TimeRange closedOpen(TimePoint start, TimePoint end) {
        return of(start, true, end, false);
    }

    /** Everything up to {@code end}. */
    public static TimeRange upTo(TimePoint end, boolean endInclusive) {
        return of(null, false, end, endInclusive);
    }

    static TimeRange ofOrNull(TimePoint start, boolean startInclusive, TimePoint end, boolean endInclusive) {
        if (!startBeforeEnd(start, startInclusive, end, endInclusive)) {
            return null;
        }
        return new TimeRange(start, startInclusive, end, endInclusive);
    }

    public static TimeRange parse(String text) {
        if (text == null || text.isBlank()) {
            throw new TimeRangeParseException("TIMERANGE_MISSING");
        }
        Matcher m = PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new TimeRangeParseException("BAD_TIMERANGE");
        }
        boolean startInclusive = m.group(1) == null || "[".equals(m.group(1));
        boolean endInclusive = "]".equals(m.group(4));
        TimePoint start = m.group(2).isEmpty() ? null : TimePoint.parse(m.group(2));
        TimePoint end = m.group(3).isEmpty() ? null : TimePoint.parse(m.group(3));
        return of(start, startInclusive, end, endInclusive);
    }

    // true when a range starting at (s, si) and ending at (e, ei) holds at least one point
    static boolean startBeforeEnd(TimePoint s, boolean si, TimePoint e, boolean ei) {
        if (s == null || e == null) {
            return true;
        }
        int c = s.compareTo(e);
        return c < 0 || (c == 0 && si && ei);
    }

    static int compareStarts(TimeRange a, TimeRange b) {
        if (a.start == null || b.start == null) {
            return a.start == null ? (b.start == null ? 0 : -1) : 1;
        }
        int c = a.start.compareTo(b.start);
        if (c != 0) return c;
        return Boolean.compare(b.startInclusive, a.startInclusive);
    }

    static int compareEnds(TimeRange a, TimeRange b) {
        if (a.end == null || b.end == null) {
            return a.end == null ? (b.end == null ? 0 : 1) : -1;
        }
        int c = a.end.compareTo(b.end);
        if (c != 0) return c;
        return Boolean.compare(a.endInclusive, b.endInclusive);
    }

    public TimePoint start() {
        return start;
    }

    public boolean startInclusive() {
        return startInclusive;
    }

    public TimePoint end() {
        return end;
    }

    public boolean endInclusive() {
        return endInclusive;
    }

    public boolean isBounded() {
        return start != null && end != null;
    }

    public boolean contains(TimePoint point) {
        return startBeforeEnd(start, startInclusive, point, true) && startBeforeEnd(point, true, end, endInclusive);
    }

    /** True when {@code other} lies entirely inside this range. */
    public boolean covers(TimeRange other) {
        return compareStarts(this, other) <= 0 && compareEnds(other, this) <= 0;
    }

    public boolean overlaps(TimeRange other) {
        return startBeforeEnd(start, startInclusive, other.end, other.endInclusive)
                && startBeforeEnd(other.start, other.startInclusive, end, endInclusive);
    }

    /** True when every point of this range lies after the end of {@code other}. */
    public boolean startsAfter(TimeRange other) {
        return !startBeforeEnd(start, startInclusive, other.end, other.endInclusive);
    }

    public TimeRange intersect(TimeRange other) {
        if (!overlaps(other)) {
            return null;
        }
        TimeRange lo = compareStarts(this, other) >= 0 ? this : other;
        TimeRange hi = compareEnds(this, other) <= 0 ? this : other;
        return new TimeRange(lo.start, lo.startInclusive, hi.end, hi.endInclusive);
    }

    public boolean isAdjacentTo(TimeRange other) {
        return touches(this, other) || touches(other, this);
    }

    private static boolean touches(TimeRange left, TimeRange right) {
        return left.end != null && right.start != null
                && left.end.equals(right.start)
                && left.endInclusive != right.startInclusive;
    }

    public TimeRange unionIfAdjacentOrOverlapping(TimeRange other) {
        if (!overlaps(other) && !isAdjacentTo(other)) {
            return null;
        }
        return span(other);
    }

    /** Smallest range covering both. */
    public TimeRange span(TimeRange other) {
        TimeRange lo = compareStarts(this, other) <= 0 ? this : other;
        TimeRange hi = compareEnds(this, other) >= 0 ? this : other;
        return new TimeRange(lo.start, lo.startInclusive, hi.end, hi.endInclusive);
    }

    /**
     * Points of this range not in {@code other}: zero, one or two pieces, in timeline order.
     */
    public List<TimeRange> subtract(TimeRange other) {
        List<TimeRange> pieces = new ArrayList<>(2);
        if (!overlaps(other)) {
            pieces.add(this);
            return pieces;
        }
        if (compareStarts(this, other) < 0) {
            TimeRange left = ofOrNull(start, startInclusive, other.start, !other.startInclusive);
            if (left != null) pieces.add(left);
        }
        if (compareEnds(other, this) < 0) {
            TimeRange right = ofOrNull(other.end, !other.endInclusive, end, endInclusive);
            if (right != null) pieces.add(right);
        }
        return pieces;
    }

    public String format() {
        return (startInclusive ? "[" : "(")
                + (start == null ? "" : start.toString())
                + "_"
                + (end == null ? "" : end.toString())
                + (endInclusive ? "]" : ")");
    }

    @Override
    public int compareTo(TimeRange o) {
        int c = compareStarts(this, o);
        return c != 0 ? c : compareEnds(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange other)) return false;
        return startInclusive == other.startInclusive && endInclusive == other.endInclusive
                && Objects.equals(start, other.start) && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, startInclusive, end, endInclusive);
    }

    @Override
    public String toString() {
        return format();
    }
}
