package com.example.mediacatalog_backend.timerange;

import com.example.mediacatalog_backend.exception.TimeRangeParseException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the range operations against point membership for every pair of ranges built from a
 * small grid of bounds and inclusivities. Bounds sit on whole seconds and membership is sampled
 * every half second, so every non-empty overlap or gap contains a sample.
 */
class TimeRangeAlgebraTest {

    private static final List<TimeRange> RANGES = new ArrayList<>();
    private static final List<TimePoint> SAMPLES = new ArrayList<>();

    @BeforeAll
    static void buildGrid() {
        Integer[] bounds = {null, 1, 2, 3, 4};
        boolean[] inclusivity = {true, false};
        for (Integer start : bounds) {
            for (boolean startInclusive : inclusivity) {
                for (Integer end : bounds) {
                    for (boolean endInclusive : inclusivity) {
                        if ((start == null && startInclusive) || (end == null && endInclusive)) continue;
                        try {
                            RANGES.add(TimeRange.of(point(start), startInclusive, point(end), endInclusive));
                        } catch (TimeRangeParseException empty) {
                            // start after end, or a single point with an exclusive side
                        }
                    }
                }
            }
        }
        for (int halfSteps = 0; halfSteps <= 10; halfSteps++) {
            SAMPLES.add(TimePoint.of(halfSteps / 2, (halfSteps % 2) * 500_000_000L));
        }
    }

    private static TimePoint point(Integer seconds) {
        return seconds == null ? null : TimePoint.of(seconds, 0);
    }

    private static boolean anyContains(List<TimeRange> ranges, TimePoint p) {
        return ranges.stream().anyMatch(r -> r.contains(p));
    }

    @Test
    void gridCoversAllShapes() {
        assertThat(RANGES).contains(TimeRange.ETERNITY, TimeRange.parse("[2:0_2:0]"), TimeRange.parse("(1:0_"));
        assertThat(RANGES).hasSizeGreaterThan(40);
    }

    @Test
    void overlapsIsSymmetricAndMatchesSharedPoints() {
        for (TimeRange a : RANGES) {
            for (TimeRange b : RANGES) {
                boolean shared = SAMPLES.stream().anyMatch(p -> a.contains(p) && b.contains(p));
                assertThat(a.overlaps(b)).as("%s overlaps %s", a, b).isEqualTo(b.overlaps(a)).isEqualTo(shared);
            }
        }
    }

    @Test
    void intersectIsNullExactlyWhenDisjoint() {
        for (TimeRange a : RANGES) {
            for (TimeRange b : RANGES) {
                TimeRange both = a.intersect(b);
                assertThat(both == null).as("%s intersect %s", a, b).isEqualTo(!a.overlaps(b));
                if (both == null) continue;
                for (TimePoint p : SAMPLES) {
                    assertThat(both.contains(p)).as("%s in %s", p, both).isEqualTo(a.contains(p) && b.contains(p));
                }
            }
        }
    }

    @Test
    void subtractLeavesExactlyTheDifference() {
        for (TimeRange a : RANGES) {
            for (TimeRange b : RANGES) {
                List<TimeRange> pieces = a.subtract(b);
                assertThat(pieces).as("%s minus %s", a, b).hasSizeLessThanOrEqualTo(2);
                for (TimeRange piece : pieces) {
                    assertThat(a.covers(piece)).isTrue();
                    assertThat(piece.overlaps(b)).isFalse();
                }
                if (pieces.size() == 2) {
                    assertThat(pieces.get(0).overlaps(pieces.get(1))).isFalse();
                    assertThat(pieces.get(0)).isLessThan(pieces.get(1));
                }
                for (TimePoint p : SAMPLES) {
                    assertThat(anyContains(pieces, p)).as("%s in %s minus %s", p, a, b)
                            .isEqualTo(a.contains(p) && !b.contains(p));
                }
            }
        }
    }

    @Test
    void unionOfSetAndDifferenceRebuildsTheOriginal() {
        for (TimeRange a : RANGES) {
            for (TimeRange b : RANGES) {
                List<TimeRange> rebuilt = new ArrayList<>(a.subtract(b));
                TimeRange common = a.intersect(b);
                if (common != null) rebuilt.add(common);
                assertThat(TimeRangeSet.of(rebuilt)).as("%s split by %s", a, b).isEqualTo(TimeRangeSet.of(a));

                TimeRangeSet union = TimeRangeSet.of(a, b);
                for (TimePoint p : SAMPLES) {
                    assertThat(anyContains(union.ranges(), p)).isEqualTo(a.contains(p) || b.contains(p));
                }
            }
        }
    }
}
