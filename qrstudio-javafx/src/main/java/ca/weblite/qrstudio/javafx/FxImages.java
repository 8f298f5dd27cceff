package ca.weblite.qrstudio.javafx;

import ca.weblite.qrstudio.RasterImage;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.WritableImage;

/**
 * Converts raster images for display in JavaFX.
 */
final class FxImages {

    private FxImages() {
    }

    static WritableImage toFxImage(RasterImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] gray = image.getPixels();
        byte[] rgb = new byte[gray.length * 3];
        for (int i = 0; i < gray.length; i++) {
            rgb[3 * i] = gray[i];
            rgb[3 * i + 1] = gray[i];
            rgb[3 * i + 2] = gray[i];
        }
        WritableImage fxImage = new WritableImage(width, height);
        fxImage.getPixelWriter().setPixels(0, 0, width, height, PixelFormat.getByteRgbInstance(), rgb, 0, width * 3);
        return fxImage;
    }
}
