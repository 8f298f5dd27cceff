package ca.weblite.qrstudio;

import java.util.Arrays;

/**
 * Renders each module as a {@code scale x scale} block of pixels, surrounded by a
 * light quiet zone.
 *
 * <p>Output is deterministic: the buffer holds
 * {@code ((size + 2 * quietZone) * scale)^2} bytes.</p>
 */
public class ModuleRasterizer implements QrRasterizer {

    /** Border width, in modules, required by ISO/IEC 18004. */
    public static final int DEFAULT_QUIET_ZONE = 4;

    public static final int MAX_QUIET_ZONE = 16;

    private final int quietZone;

    public ModuleRasterizer() {
        this(DEFAULT_QUIET_ZONE);
    }

    /**
     * @param quietZone border width in modules, in [0, 16]
     */
    public ModuleRasterizer(int quietZone) {
        if (quietZone < 0 || quietZone > MAX_QUIET_ZONE) {
            throw new IllegalArgumentException("quietZone must be between 0 and " + MAX_QUIET_ZONE + ": " + quietZone);
        }
        this.quietZone = quietZone;
    }

    public int getQuietZone() {
        return quietZone;
    }

    @Override
    public RasterImage rasterize(QrSymbol symbol, int scale) {
        if (scale < GenerationRequest.MIN_SCALE || scale > GenerationRequest.MAX_SCALE) {
            throw new IllegalArgumentException("scale must be between "
                    + GenerationRequest.MIN_SCALE + " and " + GenerationRequest.MAX_SCALE + ": " + scale);
        }
        int modules = symbol.getSize();
        int side = (modules + 2 * quietZone) * scale;
        byte[] pixels = new byte[side * side];
        Arrays.fill(pixels, RasterImage.LIGHT);

        int offset = quietZone * scale;
        for (int my = 0; my < modules; my++) {
            for (int mx = 0; mx < modules; mx++) {
                if (!symbol.isDark(mx, my)) {
                    continue;
                }
                int left = offset + mx * scale;
                int top = offset + my * scale;
                for (int py = top; py < top + scale; py++) {
                    Arrays.fill(pixels, py * side + left, py * side + left + scale, RasterImage.DARK);
                }
            }
        }
        return new RasterImage(side, side, pixels);
    }
}
