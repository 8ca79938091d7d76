package com.frosted.tracer.simulation;

import java.util.Objects;

/**
 * A lazy arithmetic sequence as produced by {@code range(start, stop, step)}.
 */
public final class RangeValue {
    private final long start;
    private final long stop;
    private final long step;

    public RangeValue(long start, long stop, long step) {
        if (step == 0) {
            throw new IllegalArgumentException("step must not be zero");
        }
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    public long getStart() { return start; }

    public long getStop() { return stop; }

    public long getStep() { return step; }

    public long size() {
        if (step > 0) {
            return start >= stop ? 0 : (stop - start + step - 1) / step;
        }
        return start <= stop ? 0 : (start - stop - step - 1) / -step;
    }

    public long get(long index) {
        return start + index * step;
    }

    public boolean contains(long value) {
        if (step > 0 ? value < start || value >= stop : value > start || value <= stop) {
            return false;
        }
        return (value - start) % step == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeValue)) return false;
        RangeValue that = (RangeValue) o;
        return start == that.start && stop == that.stop && step == that.step;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, stop, step);
    }
}
