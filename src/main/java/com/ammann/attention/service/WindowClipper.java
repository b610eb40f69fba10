/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.model.ActivitySpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Interval arithmetic shared by every report: overlap, proportional clipping, hour and bucket
 * distribution, and the day-start hour shift.
 *
 * <p>All timestamps are epoch milliseconds. Hour buckets are aligned to UTC hour boundaries.
 */
public final class WindowClipper {

    public static final long HOUR_MS = 3_600_000L;
    public static final int HOURS_PER_DAY = 24;

    private WindowClipper() {}

    /**
     * Length of the intersection of {@code [aStart, aEnd)} and {@code [bStart, bEnd)}, never
     * negative.
     */
    public static long overlap(long aStart, long aEnd, long bStart, long bEnd) {
        return Math.max(0L, Math.min(aEnd, bEnd) - Math.max(aStart, bStart));
    }

    /**
     * Clips a span to {@code [rangeStartMs, rangeEndMs)} and scales its seconds by the overlap
     * ratio.
     *
     * @return empty when the span is empty in time or seconds, or misses the range
     */
    public static Optional<ClippedContribution> clip(
            ActivitySpan span, long rangeStartMs, long rangeEndMs) {
        long durationMs = span.durationMs();
        if (durationMs <= 0 || span.totalSeconds() <= 0) {
            return Optional.empty();
        }
        long overlapMs = overlap(span.startMs(), span.endMs(), rangeStartMs, rangeEndMs);
        if (overlapMs == 0) {
            return Optional.empty();
        }
        double ratio = (double) overlapMs / durationMs;
        long overlapStart = Math.max(span.startMs(), rangeStartMs);
        return Optional.of(
                new ClippedContribution(
                        overlapStart,
                        overlapStart + overlapMs,
                        span.activeSeconds() * ratio,
                        span.idleSeconds() * ratio));
    }

    /**
     * Splits a clip across the UTC hours it touches, from the hour containing its start to the
     * hour containing its last millisecond.
     */
    public static List<BucketAllocation> distributeAcrossHours(ClippedContribution clip) {
        long clipMs = clip.durationMs();
        List<BucketAllocation> allocations = new ArrayList<>();
        if (clipMs <= 0) {
            return allocations;
        }
        long firstHour = floorToHour(clip.overlapStartMs());
        long lastHour = floorToHour(clip.overlapEndMs() - 1);
        int index = 0;
        for (long hour = firstHour; hour <= lastHour; hour += HOUR_MS, index++) {
            long part = overlap(clip.overlapStartMs(), clip.overlapEndMs(), hour, hour + HOUR_MS);
            if (part > 0) {
                allocations.add(allocate(clip, index, hour, part));
            }
        }
        return allocations;
    }

    /**
     * Splits a clip across a grid of {@code count} buckets of {@code widthMs} starting at
     * {@code originMs}. Parts of the clip outside the grid are dropped.
     */
    public static List<BucketAllocation> distributeAcrossBuckets(
            ClippedContribution clip, long originMs, long widthMs, int count) {
        List<BucketAllocation> allocations = new ArrayList<>();
        long clipMs = clip.durationMs();
        if (clipMs <= 0 || widthMs <= 0 || count <= 0) {
            return allocations;
        }
        long gridEnd = originMs + widthMs * count;
        long from = Math.max(clip.overlapStartMs(), originMs);
        long to = Math.min(clip.overlapEndMs(), gridEnd);
        if (to <= from) {
            return allocations;
        }
        int first = (int) Math.floorDiv(from - originMs, widthMs);
        int last = (int) Math.floorDiv(to - 1 - originMs, widthMs);
        for (int index = first; index <= last; index++) {
            long bucketStart = originMs + index * widthMs;
            long part =
                    overlap(
                            clip.overlapStartMs(),
                            clip.overlapEndMs(),
                            bucketStart,
                            bucketStart + widthMs);
            if (part > 0) {
                allocations.add(allocate(clip, index, bucketStart, part));
            }
        }
        return allocations;
    }

    private static BucketAllocation allocate(
            ClippedContribution clip, int index, long bucketStart, long partMs) {
        double fraction = (double) partMs / clip.durationMs();
        return new BucketAllocation(
                index,
                bucketStart,
                fraction,
                clip.activeSeconds() * fraction,
                clip.idleSeconds() * fraction);
    }

    public static long floorToHour(long epochMs) {
        return Math.floorDiv(epochMs, HOUR_MS) * HOUR_MS;
    }

    /**
     * Maps a clock hour to its position in a logical day that starts at {@code dayStartHour}.
     */
    public static int shift(int hour, int dayStartHour) {
        return ((hour - dayStartHour) % HOURS_PER_DAY + HOURS_PER_DAY) % HOURS_PER_DAY;
    }

    /**
     * Inverse of {@link #shift(int, int)}.
     */
    public static int unshift(int shiftedHour, int dayStartHour) {
        return (shiftedHour + dayStartHour) % HOURS_PER_DAY;
    }
}
