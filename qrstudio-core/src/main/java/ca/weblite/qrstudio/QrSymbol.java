package ca.weblite.qrstudio;

/**
 * An encoded QR symbol: a square grid of dark and light modules.
 */
public interface QrSymbol {

    /**
     * @return the number of modules along one side
     */
    int getSize();

    /**
     * @param x module column
     * @param y module row
     * @return true if the module is dark
     */
    boolean isDark(int x, int y);

    /**
     * @return the symbol version in [1, 40]
     */
    int getVersion();

    /**
     * @return the level actually used, never {@link ErrorCorrection#AUTO}
     */
    ErrorCorrection getErrorCorrection();

    /**
     * Human-readable dump of the symbol for diagnostics.
     *
     * @return the description
     */
    String describe();
}
