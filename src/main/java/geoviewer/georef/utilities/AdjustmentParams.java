package geoviewer.georef.utilities;

/**
 * Display adjustment slider values.
 *
 * <p>Brightness, contrast and saturation run 0..100 with 50 as the neutral position.
 * Threshold runs 0..255; 0 disables thresholding.
 *
 * @param brightness brightness slider, 0..100
 * @param contrast   contrast slider, 0..100
 * @param saturation saturation slider, 0..100
 * @param threshold  binarization threshold on luminance, 0..255, 0 = off
 */
public record AdjustmentParams(int brightness, int contrast, int saturation, int threshold) {

    public static final int NEUTRAL = 50;
    public static final int MAX_PERCENT = 100;
    public static final int MAX_THRESHOLD = 255;

    /** All sliders in their neutral position. */
    public static final AdjustmentParams DEFAULT = new AdjustmentParams(NEUTRAL, NEUTRAL, NEUTRAL, 0);

    public AdjustmentParams {
        checkRange("brightness", brightness, MAX_PERCENT);
        checkRange("contrast", contrast, MAX_PERCENT);
        checkRange("saturation", saturation, MAX_PERCENT);
        checkRange("threshold", threshold, MAX_THRESHOLD);
    }

    private static void checkRange(String name, int value, int max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(name + " must be in 0.." + max + ", got " + value);
        }
    }

    public boolean isThresholdActive() {
        return threshold > 0;
    }

    public boolean isNeutral() {
        return brightness == NEUTRAL && contrast == NEUTRAL && saturation == NEUTRAL && threshold == 0;
    }

    /**
     * True when saturation is off its neutral position while thresholding is on. The
     * threshold output is black and white, so the saturation setting has no visible effect
     * in that state.
     */
    public boolean colorSettingsConflict() {
        return isThresholdActive() && saturation != NEUTRAL;
    }

    public double contrastFactor() {
        return contrast / (double) NEUTRAL;
    }

    public double brightnessOffset() {
        return (brightness - NEUTRAL) * 255.0 / 100.0;
    }

    public AdjustmentParams withBrightness(int value) {
        return new AdjustmentParams(value, contrast, saturation, threshold);
    }

    public AdjustmentParams withContrast(int value) {
        return new AdjustmentParams(brightness, value, saturation, threshold);
    }

    public AdjustmentParams withSaturation(int value) {
        return new AdjustmentParams(brightness, contrast, value, threshold);
    }

    public AdjustmentParams withThreshold(int value) {
        return new AdjustmentParams(brightness, contrast, saturation, value);
    }
}
