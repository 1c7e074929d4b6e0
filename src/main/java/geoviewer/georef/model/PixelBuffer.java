package geoviewer.georef.model;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable 8-bit pixel array, row-major with interleaved channels.
 *
 * <p>Channel layouts: 1 = gray, 2 = gray + alpha, 3 = RGB, 4 = RGBA. The sample at
 * {@code (col, row, channel)} lives at {@code (row * width + col) * channels + channel}.
 *
 * @since 0.1.0
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    /**
     * @param data samples; copied, so later changes to the array are not seen
     * @throws IllegalArgumentException on non-positive size, unsupported channel count or
     *         a data length that does not match
     */
    public PixelBuffer(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Pixel buffer must be at least 1x1, got " + width + "x" + height);
        }
        if (channels < 1 || channels > 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        long expected = (long) width * height * channels;
        if (data == null || data.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d samples for %dx%dx%d, got %s",
                    expected, width, height, channels, data == null ? "null" : data.length));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data.clone();
    }

    /**
     * Buffer of one color, with every pixel set to {@code samples}.
     */
    public static PixelBuffer filled(int width, int height, int... samples) {
        byte[] data = new byte[width * height * samples.length];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) samples[i % samples.length];
        }
        return new PixelBuffer(width, height, samples.length, data);
    }

    /**
     * Copies an AWT image into a buffer: gray images become 1 channel, images with alpha
     * become RGBA, everything else RGB.
     */
    public static PixelBuffer fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        boolean alpha = image.getColorModel().hasAlpha();
        boolean gray = image.getType() == BufferedImage.TYPE_BYTE_GRAY;
        int channels = gray ? 1 : (alpha ? 4 : 3);
        byte[] data = new byte[w * h * channels];
        int i = 0;
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                if (gray) {
                    data[i++] = (byte) image.getRaster().getSample(col, row, 0);
                    continue;
                }
                int argb = image.getRGB(col, row);
                data[i++] = (byte) (argb >> 16);
                data[i++] = (byte) (argb >> 8);
                data[i++] = (byte) argb;
                if (alpha) {
                    data[i++] = (byte) (argb >>> 24);
                }
            }
        }
        return new PixelBuffer(w, h, channels, data);
    }

    public BufferedImage toBufferedImage() {
        if (channels == 1) {
            BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            out.getRaster().setDataElements(0, 0, width, height, data.clone());
            return out;
        }
        boolean alpha = hasAlpha();
        BufferedImage out = new BufferedImage(width, height,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int r = getSample(col, row, 0);
                int g = channels >= 3 ? getSample(col, row, 1) : r;
                int b = channels >= 3 ? getSample(col, row, 2) : r;
                int a = alpha ? getSample(col, row, channels - 1) : 0xFF;
                out.setRGB(col, row, (a << 24) | (r << 16) | (g << 8) | b);
            }
        }
        return out;
    }

    public int getWidth() { return width; }

    public int getHeight() { return height; }

    public int getChannels() { return channels; }

    /** Number of color channels, 1 for gray layouts and 3 for RGB layouts. */
    public int getColorChannels() {
        return channels >= 3 ? 3 : 1;
    }

    public boolean hasAlpha() {
        return channels == 2 || channels == 4;
    }

    /**
     * Sample value in 0..255.
     */
    public int getSample(int col, int row, int channel) {
        if (col < 0 || col >= width || row < 0 || row >= height || channel < 0 || channel >= channels) {
            throw new IndexOutOfBoundsException(String.format(
                    "(%d, %d, %d) outside %dx%dx%d", col, row, channel, width, height, channels));
        }
        return data[(row * width + col) * channels + channel] & 0xFF;
    }

    /**
     * Returns a copy of the samples.
     */
    public byte[] copyData() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return width == other.width && height == other.height && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "x" + channels + "]";
    }
}
