package geoviewer.georef.utilities;

import geoviewer.georef.model.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;

/**
 * Display adjustments applied to a copy of a raster's pixels.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>contrast and brightness: {@code out = clamp(in * contrast/50 + (brightness - 50) * 255 / 100)}
 *       on every color channel</li>
 *   <li>saturation: HSB saturation scaled by {@code saturation / 50} (RGB layouts only)</li>
 *   <li>threshold: luminance {@code 0.299R + 0.587G + 0.114B} at or above the threshold
 *       becomes white, anything below becomes black</li>
 * </ol>
 * Alpha is always copied unchanged. Saturation is skipped while the threshold is active,
 * see {@link AdjustmentParams#colorSettingsConflict()}.
 */
public class ImageAdjustments {
    private static final Logger logger = LoggerFactory.getLogger(ImageAdjustments.class);

    private ImageAdjustments() {
    }

    /**
     * Returns an adjusted copy of {@code source}; the source buffer is never modified.
     */
    public static PixelBuffer adjust(PixelBuffer source, AdjustmentParams params) {
        if (params.isNeutral()) {
            return source;
        }
        if (params.colorSettingsConflict()) {
            logger.debug("Saturation {} ignored while threshold {} is active",
                    params.saturation(), params.threshold());
        }

        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int colorChannels = source.getColorChannels();
        byte[] data = source.copyData();

        double factor = params.contrastFactor();
        double offset = params.brightnessOffset();
        boolean applySaturation = colorChannels == 3
                && params.saturation() != AdjustmentParams.NEUTRAL
                && !params.isThresholdActive();
        float saturationScale = params.saturation() / (float) AdjustmentParams.NEUTRAL;
        float[] hsb = new float[3];

        for (int p = 0; p < width * height; p++) {
            int base = p * channels;
            for (int c = 0; c < colorChannels; c++) {
                int in = data[base + c] & 0xFF;
                data[base + c] = (byte) clamp(in * factor + offset);
            }

            if (applySaturation) {
                int r = data[base] & 0xFF;
                int g = data[base + 1] & 0xFF;
                int b = data[base + 2] & 0xFF;
                Color.RGBtoHSB(r, g, b, hsb);
                float s = Math.max(0f, Math.min(1f, hsb[1] * saturationScale));
                int rgb = Color.HSBtoRGB(hsb[0], s, hsb[2]);
                data[base] = (byte) (rgb >> 16);
                data[base + 1] = (byte) (rgb >> 8);
                data[base + 2] = (byte) rgb;
            }

            if (params.isThresholdActive()) {
                double luminance = colorChannels == 3
                        ? 0.299 * (data[base] & 0xFF) + 0.587 * (data[base + 1] & 0xFF) + 0.114 * (data[base + 2] & 0xFF)
                        : data[base] & 0xFF;
                byte value = luminance >= params.threshold() ? (byte) 255 : 0;
                for (int c = 0; c < colorChannels; c++) {
                    data[base + c] = value;
                }
            }
        }
        logger.trace("Adjusted {} with {}", source, params);
        return new PixelBuffer(width, height, channels, data);
    }

    static int clamp(double value) {
        return (int) Math.round(Math.max(0.0, Math.min(255.0, value)));
    }
}
