package ca.weblite.qrstudio;

import com.google.zxing.common.BitMatrix;

import java.util.Arrays;

/**
 * Grayscale pixel buffer produced by a {@link QrRasterizer}.
 *
 * <p>One byte per pixel in row-major order: {@link #DARK} or {@link #LIGHT}.</p>
 */
public final class RasterImage {

    public static final byte DARK = (byte) 0x00;
    public static final byte LIGHT = (byte) 0xFF;

    private final int width;
    private final int height;
    private final byte[] pixels;

    /**
     * @param width image width in pixels
     * @param height image height in pixels
     * @param pixels row-major pixel bytes, exactly {@code width * height} long; copied
     */
    public RasterImage(int width, int height, byte[] pixels) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("dimensions must not be negative: " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("pixel buffer must hold exactly " + (width * height) + " bytes");
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return a copy of the pixel bytes
     */
    public byte[] getPixels() {
        return pixels.clone();
    }

    public int getByteCount() {
        return pixels.length;
    }

    public boolean isDark(int x, int y) {
        return pixels[y * width + x] == DARK;
    }

    /**
     * Converts to a ZXing bit matrix with dark pixels set, for use with
     * {@code MatrixToImageWriter}.
     *
     * @return the matrix
     */
    public BitMatrix toBitMatrix() {
        BitMatrix matrix = new BitMatrix(width, height);
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                if (pixels[row + x] == DARK) {
                    matrix.set(x, y);
                }
            }
        }
        return matrix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RasterImage)) {
            return false;
        }
        RasterImage other = (RasterImage) o;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "RasterImage{" + width + "x" + height + "}";
    }
}
