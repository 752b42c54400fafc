package com.tastream.window;

/**
 * Running sum and sum of squares over the current contents of a window.
 *
 * <p>Values are added on push and subtracted on eviction, so mean and variance are O(1)
 * per sample. Repeated add/subtract accumulates rounding error; owners call
 * {@link #resync(Iterable)} from their window once per full rotation to bound it.
 *
 * <p>An empty accumulator has no mean: {@link #mean()} and {@link #variance(VarianceKind)}
 * return {@link Double#NaN} until a value has been pushed.
 */
public final class SumAccumulator {

    private int count;
    private double sum;
    private double sumOfSquares;

    public SumAccumulator() {}

    private SumAccumulator(SumAccumulator other) {
        this.count = other.count;
        this.sum = other.sum;
        this.sumOfSquares = other.sumOfSquares;
    }

    public void onPush(double value) {
        count++;
        sum += value;
        sumOfSquares += value * value;
    }

    public void onEvict(double value) {
        count--;
        sum -= value;
        sumOfSquares -= value * value;
        if (count == 0) {
            sum = 0.0;
            sumOfSquares = 0.0;
        }
    }

    public double mean() {
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Variance of the tracked values, clamped to zero to absorb cancellation error.
     * Sample variance of fewer than two values is zero.
     */
    public double variance(VarianceKind kind) {
        if (count == 0) {
            return Double.NaN;
        }
        double mean = sum / count;
        double variance;
        if (kind == VarianceKind.SAMPLE) {
            if (count < 2) {
                return 0.0;
            }
            variance = (sumOfSquares - count * mean * mean) / (count - 1);
        } else {
            variance = sumOfSquares / count - mean * mean;
        }
        return Math.max(variance, 0.0);
    }

    /** Recomputes count, sum and sum of squares from scratch over the given window. */
    public void resync(Iterable<Double> window) {
        reset();
        for (double value : window) {
            onPush(value);
        }
    }

    public int count() {
        return count;
    }

    public double sum() {
        return sum;
    }

    public double sumOfSquares() {
        return sumOfSquares;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public void reset() {
        count = 0;
        sum = 0.0;
        sumOfSquares = 0.0;
    }

    public SumAccumulator copy() {
        return new SumAccumulator(this);
    }

    @Override
    public String toString() {
        return "SumAccumulator[count=" + count + ", sum=" + sum + ", sumOfSquares=" + sumOfSquares + "]";
    }
}
