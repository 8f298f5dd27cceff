package ca.weblite.qrstudio;

/**
 * Turns text and options into a {@link QrSymbol}.
 *
 * <p>Implementations must be pure functions of their arguments and safe to call
 * from the generation worker thread.</p>
 */
public interface QrEncoder {

    /**
     * @param text the payload, never null
     * @param errorCorrection requested level
     * @param version {@link GenerationRequest#AUTO_VERSION} or a version in [1, 40]
     * @param mode requested segment mode
     * @return the symbol
     * @throws QrValidationException if the combination cannot be encoded
     */
    QrSymbol encode(String text, ErrorCorrection errorCorrection, int version, EncodingMode mode)
            throws QrValidationException;
}
