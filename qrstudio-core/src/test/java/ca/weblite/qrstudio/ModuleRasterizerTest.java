package ca.weblite.qrstudio;

import ca.weblite.qrstudio.zxing.ZxingQrEncoder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModuleRasterizerTest {

    /** 2x2 symbol with dark modules on the main diagonal. */
    private static final QrSymbol DIAGONAL = new QrSymbol() {
        @Override
        public int getSize() {
            return 2;
        }

        @Override
        public boolean isDark(int x, int y) {
            return x == y;
        }

        @Override
        public int getVersion() {
            return 1;
        }

        @Override
        public ErrorCorrection getErrorCorrection() {
            return ErrorCorrection.LOW;
        }

        @Override
        public String describe() {
            return "diagonal";
        }
    };

    @Test
    void testModulesBecomeScaledBlocksInsideQuietZone() {
        RasterImage image = new ModuleRasterizer(1).rasterize(DIAGONAL, 3);

        assertEquals(12, image.getWidth());
        assertEquals(12, image.getHeight());

        // quiet zone
        assertFalse(image.isDark(0, 0));
        assertFalse(image.isDark(2, 11));
        // module (0,0) covers pixels 3..5
        assertTrue(image.isDark(3, 3));
        assertTrue(image.isDark(5, 5));
        // module (1,0) is light
        assertFalse(image.isDark(6, 3));
        // module (1,1) covers pixels 6..8
        assertTrue(image.isDark(8, 8));
        assertFalse(image.isDark(9, 9));
    }

    @Test
    void testZeroQuietZone() {
        RasterImage image = new ModuleRasterizer(0).rasterize(DIAGONAL, 1);
        assertEquals(2, image.getWidth());
        assertTrue(image.isDark(0, 0));
        assertFalse(image.isDark(1, 0));
    }

    @Test
    void testDoublingScaleQuadruplesBuffer() throws Exception {
        QrSymbol symbol = new ZxingQrEncoder().encode("HELLO", ErrorCorrection.MEDIUM,
                GenerationRequest.AUTO_VERSION, EncodingMode.AUTO);
        ModuleRasterizer rasterizer = new ModuleRasterizer();

        RasterImage small = rasterizer.rasterize(symbol, 5);
        RasterImage large = rasterizer.rasterize(symbol, 10);

        assertEquals(2 * small.getWidth(), large.getWidth());
        assertEquals(4 * small.getByteCount(), large.getByteCount());
        assertEquals((21 + 8) * 5, small.getWidth());
    }

    @Test
    void testRasterizationIsDeterministic() throws Exception {
        QrSymbol symbol = new ZxingQrEncoder().encode("same input", ErrorCorrection.QUARTILE,
                GenerationRequest.AUTO_VERSION, EncodingMode.AUTO);
        ModuleRasterizer rasterizer = new ModuleRasterizer();
        assertEquals(rasterizer.rasterize(symbol, 4), rasterizer.rasterize(symbol, 4));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ModuleRasterizer(-1));
        assertThrows(IllegalArgumentException.class, () -> new ModuleRasterizer().rasterize(DIAGONAL, 0));
        assertThrows(IllegalArgumentException.class, () -> new ModuleRasterizer(ModuleRasterizer.MAX_QUIET_ZONE + 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ModuleRasterizer().rasterize(DIAGONAL, GenerationRequest.MAX_SCALE + 1));
    }
}
