/* (C)2026 */
package com.ammann.interaction.model;

/**
 * Online accumulator for a stream of scalar values.
 *
 * <p>Tracks count, mean, variance (Welford's incremental form), min, max, sum and the
 * most recent value without retaining the individual samples. Reads on an empty
 * accumulator return zero for every field.
 */
public class RunningStats {

    private long count;
    private double mean;
    private double sumSqDev;
    private double sum;
    private double min;
    private double max;
    private double lastValue;

    public RunningStats() {}

    public RunningStats(double firstValue) {
        addValue(firstValue);
    }

    private RunningStats(RunningStats other) {
        this.count = other.count;
        this.mean = other.mean;
        this.sumSqDev = other.sumSqDev;
        this.sum = other.sum;
        this.min = other.min;
        this.max = other.max;
        this.lastValue = other.lastValue;
    }

    /**
     * Folds one value into the accumulator.
     *
     * @param value the next sample
     */
    public void addValue(double value) {
        lastValue = value;
        count++;

        if (count == 1) {
            min = value;
            max = value;
        }

        double previousMean = mean;
        sum += value;
        mean += (value - previousMean) / count;
        sumSqDev += (value - previousMean) * (value - mean);

        if (value < min) {
            min = value;
        }
        if (value > max) {
            max = value;
        }
    }

    /**
     * Returns an independent snapshot of this accumulator.
     */
    public RunningStats copy() {
        return new RunningStats(this);
    }

    public long n() {
        return count;
    }

    public double avg() {
        return mean;
    }

    public double sum() {
        return sum;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public double lastValue() {
        return lastValue;
    }

    /** Sample variance; 0 until at least two values were added. */
    public double variance() {
        return count > 1 ? sumSqDev / (count - 1) : 0.0;
    }

    public double stdev() {
        return Math.sqrt(variance());
    }

    @Override
    public String toString() {
        return String.format(
                "%.4f|%.4f|%.4f n=%d", mean - stdev(), mean, mean + stdev(), count);
    }
}
