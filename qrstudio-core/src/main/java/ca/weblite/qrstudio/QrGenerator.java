package ca.weblite.qrstudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The encode step of the pipeline: encodes and rasterizes one request.
 *
 * <p>Validation failures come back as {@link GenerationResult.Failure}. Anything
 * else the encoder or rasterizer throws propagates to the caller.</p>
 */
public class QrGenerator {

    private static final Logger log = LoggerFactory.getLogger(QrGenerator.class);

    private final QrEncoder encoder;
    private final QrRasterizer rasterizer;

    public QrGenerator(QrEncoder encoder, QrRasterizer rasterizer) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.rasterizer = Objects.requireNonNull(rasterizer, "rasterizer must not be null");
    }

    /**
     * @param request the request to process
     * @return a success with the rendered image, or a failure with a user-facing message
     */
    public GenerationResult generate(GenerationRequest request) {
        QrSymbol symbol;
        try {
            symbol = encoder.encode(request.getText(), request.getErrorCorrection(),
                    request.getVersion(), request.getMode());
        } catch (QrValidationException e) {
            log.debug("Rejected {}: {}", request, e.getMessage());
            return GenerationResult.failure(request, e.getMessage());
        }
        RasterImage image = rasterizer.rasterize(symbol, request.getScale());
        log.debug("Encoded version {} at {} into {}", symbol.getVersion(), symbol.getErrorCorrection(), image);
        return GenerationResult.success(request, image, symbol.describe());
    }
}
