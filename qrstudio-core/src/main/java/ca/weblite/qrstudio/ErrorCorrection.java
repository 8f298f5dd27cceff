package ca.weblite.qrstudio;

/**
 * Error-correction level requested for a symbol.
 *
 * <p>{@link #AUTO} picks the strongest level that fits without growing the
 * symbol beyond the version the content needs at {@link #LOW}.</p>
 */
public enum ErrorCorrection {
    AUTO,
    LOW,
    MEDIUM,
    QUARTILE,
    HIGH
}
