package de.caluga.topology.sdam;

/**
 * exponentially weighted moving average of round trip times
 */
public class MovingAverage {
    private static final double ALPHA = 0.2;
    private Double average;

    public synchronized void addSample(double sample) {
        if (sample < 0) {
            // clock went backwards
            return;
        }

        if (average == null) {
            average = sample;
        } else {
            average = ALPHA * sample + (1 - ALPHA) * average;
        }
    }

    /**
     * the current average or null if there is no sample yet
     */
    public synchronized Double get() {
        return average;
    }

    public synchronized void reset() {
        average = null;
    }
}
