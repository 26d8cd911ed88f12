package com.example.mediacatalog_backend.timerange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalized union of time ranges: sorted, pairwise disjoint and never adjacent.
 */
public final class TimeRangeSet {
    public static final TimeRangeSet EMPTY = new TimeRangeSet(List.of());

    private final List<TimeRange> ranges;

    private TimeRangeSet(List<TimeRange> ranges) {
        this.ranges = ranges;
    }

    public static TimeRangeSet of(Collection<TimeRange> input) {
        if (input.isEmpty()) {
            return EMPTY;
        }
        List<TimeRange> sorted = new ArrayList<>(input);
        Collections.sort(sorted);
        List<TimeRange> merged = new ArrayList<>();
        TimeRange current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            TimeRange next = sorted.get(i);
            TimeRange joined = current.unionIfAdjacentOrOverlapping(next);
            if (joined != null) {
                current = joined;
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return new TimeRangeSet(List.copyOf(merged));
    }

    public static TimeRangeSet of(TimeRange... input) {
        return of(List.of(input));
    }

    /** Parses the comma-joined form; {@code null} or blank is the empty set. */
    public static TimeRangeSet parse(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY;
        }
        List<TimeRange> parsed = new ArrayList<>();
        for (String part : text.split(",")) {
            parsed.add(TimeRange.parse(part));
        }
        return of(parsed);
    }

    public TimeRangeSet add(TimeRange range) {
        List<TimeRange> all = new ArrayList<>(ranges);
        all.add(range);
        return of(all);
    }

    /** Smallest single range covering every member, or {@code null} when empty. */
    public TimeRange hull() {
        if (ranges.isEmpty()) {
            return null;
        }
        return ranges.get(0).span(ranges.get(ranges.size() - 1));
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public List<TimeRange> ranges() {
        return ranges;
    }

    public String format() {
        return ranges.stream().map(TimeRange::format).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRangeSet other)) return false;
        return ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
