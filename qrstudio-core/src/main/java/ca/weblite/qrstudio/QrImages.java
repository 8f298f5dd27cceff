package ca.weblite.qrstudio;

import com.google.zxing.client.j2se.MatrixToImageWriter;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Conversions from {@link RasterImage} to AWT images and files.
 */
public final class QrImages {

    static final String PNG = "PNG";

    private QrImages() {
        // Static utility class
    }

    /**
     * @param image the raster
     * @return a black-on-white image of the same size
     */
    public static BufferedImage toBufferedImage(RasterImage image) {
        return MatrixToImageWriter.toBufferedImage(image.toBitMatrix());
    }

    /**
     * Writes the image as a PNG file, replacing any existing file.
     *
     * @param image the raster
     * @param file destination
     * @throws IOException if the file cannot be written
     */
    public static void writePng(RasterImage image, Path file) throws IOException {
        try {
            MatrixToImageWriter.writeToPath(image.toBitMatrix(), PNG, file);
        } catch (IOException e) {
            throw new IOException("Failed to write QR image to " + file, e);
        }
    }
}
