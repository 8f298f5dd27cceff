package ca.weblite.qrstudio.javafx;

import ca.weblite.qrstudio.RasterImage;
import javafx.scene.image.PixelReader;
import javafx.scene.image.WritableImage;
import org.junit.Assume;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import static org.junit.Assert.*;

public class FxImagesTest {

    private static boolean toolkitAvailable;

    @BeforeClass
    public static void initToolkit() {
        toolkitAvailable = FxToolkit.start();
    }

    @Before
    public void setUp() {
        Assume.assumeTrue("JavaFX toolkit not available", toolkitAvailable);
    }

    @Test
    public void testDarkAndLightPixelsConverted() throws Exception {
        byte[] pixels = {
                RasterImage.DARK, RasterImage.LIGHT, RasterImage.LIGHT,
                RasterImage.LIGHT, RasterImage.LIGHT, RasterImage.DARK
        };
        RasterImage raster = new RasterImage(3, 2, pixels);

        WritableImage image = FxToolkit.callOnFxThread(() -> FxImages.toFxImage(raster));

        assertEquals(3, (int) image.getWidth());
        assertEquals(2, (int) image.getHeight());
        PixelReader reader = image.getPixelReader();
        assertEquals(0xFF000000, reader.getArgb(0, 0));
        assertEquals(0xFFFFFFFF, reader.getArgb(1, 0));
        assertEquals(0xFFFFFFFF, reader.getArgb(0, 1));
        assertEquals(0xFF000000, reader.getArgb(2, 1));
    }
}
