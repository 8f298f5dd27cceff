package ca.weblite.qrstudio;

/**
 * Renders a {@link QrSymbol} into pixels.
 */
public interface QrRasterizer {

    /**
     * @param symbol the symbol to render
     * @param scale pixels per module, at least 1
     * @return the image
     */
    RasterImage rasterize(QrSymbol symbol, int scale);
}
