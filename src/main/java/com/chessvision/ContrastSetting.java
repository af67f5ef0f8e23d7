package com.chessvision;

/**
 * Gain applied to both board images before differencing, and the
 * binarization threshold used with that gain.
 */
public final class ContrastSetting {

    public static final double MIN_GAIN = 0.1;
    public static final double MAX_GAIN = 2.0;
    public static final double BASELINE_GAIN = 1.0;

    private final double gain;
    private final double threshold;

    public ContrastSetting(double gain, double threshold) {
        if (Double.isNaN(gain) || gain < MIN_GAIN || gain > MAX_GAIN) {
            throw new IllegalArgumentException("Gain " + gain + " outside [" + MIN_GAIN + ", " + MAX_GAIN + "]");
        }
        if (threshold < 0 || threshold >= 255) {
            throw new IllegalArgumentException("Threshold " + threshold + " outside [0, 255)");
        }
        this.gain = gain;
        this.threshold = threshold;
    }

    public static ContrastSetting baseline(double threshold) {
        return new ContrastSetting(BASELINE_GAIN, threshold);
    }

    public double getGain() {
        return gain;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContrastSetting)) return false;
        ContrastSetting that = (ContrastSetting) o;
        return Double.compare(gain, that.gain) == 0 && Double.compare(threshold, that.threshold) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(gain) + Double.hashCode(threshold);
    }

    @Override
    public String toString() {
        return String.format("gain=%.1f/thr=%.0f", gain, threshold);
    }
}
