package ca.weblite.qrstudio;

import java.util.Objects;

/**
 * Outcome of processing one {@link GenerationRequest}.
 *
 * <p>Exactly two variants exist: {@link Success} and {@link Failure}. Both carry
 * the request they were produced from.</p>
 *
 * <pre>
 * if (result.isSuccess()) {
 *     show(result.asSuccess().getImage());
 * } else {
 *     showStatus(result.asFailure().getMessage());
 * }
 * </pre>
 */
public abstract class GenerationResult {

    private final GenerationRequest request;

    private GenerationResult(GenerationRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    public static Success success(GenerationRequest request, RasterImage image, String encodedSymbol) {
        return new Success(request, image, encodedSymbol);
    }

    public static Failure failure(GenerationRequest request, String message) {
        return new Failure(request, message);
    }

    /**
     * @return the request this result was generated from
     */
    public GenerationRequest getRequest() {
        return request;
    }

    public abstract boolean isSuccess();

    /**
     * @return this result as a success
     * @throws IllegalStateException if this is a failure
     */
    public Success asSuccess() {
        throw new IllegalStateException("Not a success: " + this);
    }

    /**
     * @return this result as a failure
     * @throws IllegalStateException if this is a success
     */
    public Failure asFailure() {
        throw new IllegalStateException("Not a failure: " + this);
    }

    /**
     * A rendered symbol.
     */
    public static final class Success extends GenerationResult {
        private final RasterImage image;
        private final String encodedSymbol;

        private Success(GenerationRequest request, RasterImage image, String encodedSymbol) {
            super(request);
            this.image = Objects.requireNonNull(image, "image must not be null");
            this.encodedSymbol = encodedSymbol != null ? encodedSymbol : "";
        }

        public RasterImage getImage() {
            return image;
        }

        /**
         * @return diagnostic dump of the encoded symbol, never null
         */
        public String getEncodedSymbol() {
            return encodedSymbol;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Success asSuccess() {
            return this;
        }

        @Override
        public String toString() {
            return "Success{" + image + ", request=" + getRequest() + "}";
        }
    }

    /**
     * The request could not be encoded.
     */
    public static final class Failure extends GenerationResult {
        private final String message;

        private Failure(GenerationRequest request, String message) {
            super(request);
            this.message = message != null ? message : "Unknown error";
        }

        /**
         * @return user-presentable reason, never null
         */
        public String getMessage() {
            return message;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Failure asFailure() {
            return this;
        }

        @Override
        public String toString() {
            return "Failure{message='" + message + "', request=" + getRequest() + "}";
        }
    }
}
