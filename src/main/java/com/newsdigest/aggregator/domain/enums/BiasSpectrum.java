package com.newsdigest.aggregator.domain.enums;

/**
 * Seven-point political bias scale with a numeric projection in [-2.0, +2.0].
 */
public enum BiasSpectrum {
    FAR_LEFT("Far Left", "FL", -2.0),
    LEFT("Left", "L", -1.5),
    CENTER_LEFT("Center-Left", "CL", -0.7),
    CENTER("Center", "C", 0.0),
    CENTER_RIGHT("Center-Right", "CR", 0.7),
    RIGHT("Right", "R", 1.5),
    FAR_RIGHT("Far Right", "FR", 2.0);

    private final String label;
    private final String shortLabel;
    private final double value;

    BiasSpectrum(String label, String shortLabel, double value) {
        this.label = label;
        this.shortLabel = shortLabel;
        this.value = value;
    }

    public String label() {
        return label;
    }

    public String shortLabel() {
        return shortLabel;
    }

    public double value() {
        return value;
    }

    public static BiasSpectrum fromValue(double value) {
        if (value < -1.75) return FAR_LEFT;
        if (value < -1.0) return LEFT;
        if (value < -0.3) return CENTER_LEFT;
        if (value <= 0.3) return CENTER;
        if (value < 1.0) return CENTER_RIGHT;
        if (value < 1.75) return RIGHT;
        return FAR_RIGHT;
    }
}
