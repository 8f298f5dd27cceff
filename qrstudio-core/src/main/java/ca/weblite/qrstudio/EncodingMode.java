package ca.weblite.qrstudio;

/**
 * Segment mode requested for the payload.
 *
 * <p>An explicit mode restricts which characters the text may contain.
 * {@link #AUTO} and {@link #BINARY} accept any text.</p>
 */
public enum EncodingMode {
    AUTO,
    NUMERIC,
    ALPHANUMERIC,
    BINARY,
    KANJI
}
