package com.eainde.specmap.output;

/**
 * Confidence bands used for colour-coding output cells.
 */
public enum ConfidenceBand {
    HIGH(0.8, new byte[]{(byte) 0xC6, (byte) 0xEF, (byte) 0xCE}),
    MEDIUM(0.5, new byte[]{(byte) 0xFF, (byte) 0xEB, (byte) 0x9C}),
    LOW(0.0, new byte[]{(byte) 0xFF, (byte) 0xC7, (byte) 0xCE});

    private final double lowerBound;
    private final byte[] rgb;

    ConfidenceBand(double lowerBound, byte[] rgb) {
        this.lowerBound = lowerBound;
        this.rgb = rgb;
    }

    public static ConfidenceBand of(double confidence) {
        if (confidence >= HIGH.lowerBound) return HIGH;
        if (confidence >= MEDIUM.lowerBound) return MEDIUM;
        return LOW;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public byte[] rgb() {
        return rgb.clone();
    }
}
