package ca.weblite.qrstudio;

import java.util.Objects;

/**
 * Immutable description of one QR generation job.
 *
 * <p>Requests are plain values: two requests with the same fields are equal,
 * and every {@code with*} method returns a new instance.</p>
 *
 * <pre>
 * GenerationRequest request = GenerationRequest.of("HELLO")
 *         .withErrorCorrection(ErrorCorrection.HIGH)
 *         .withScale(5);
 * pipeline.submit(request);
 * </pre>
 */
public final class GenerationRequest {

    /** Version value meaning "smallest version that fits". */
    public static final int AUTO_VERSION = 0;

    public static final int MIN_VERSION = 1;
    public static final int MAX_VERSION = 40;

    public static final int MIN_SCALE = 1;
    /** Largest scale; keeps a version 40 raster within a few tens of megabytes. */
    public static final int MAX_SCALE = 32;

    public static final int DEFAULT_SCALE = 8;

    private static final int TO_STRING_TEXT_LIMIT = 32;

    private final String text;
    private final ErrorCorrection errorCorrection;
    private final int version;
    private final EncodingMode mode;
    private final int scale;

    /**
     * Creates a request.
     *
     * @param text the payload, may be empty but not null
     * @param errorCorrection the error-correction level
     * @param version {@link #AUTO_VERSION} or a version in [1, 40]
     * @param mode the segment mode
     * @param scale pixels per module, in [1, 32]
     * @throws IllegalArgumentException if version or scale is out of range
     */
    public GenerationRequest(String text, ErrorCorrection errorCorrection, int version,
                             EncodingMode mode, int scale) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.errorCorrection = Objects.requireNonNull(errorCorrection, "errorCorrection must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (version != AUTO_VERSION && (version < MIN_VERSION || version > MAX_VERSION)) {
            throw new IllegalArgumentException("version must be 0 (auto) or between "
                    + MIN_VERSION + " and " + MAX_VERSION + ": " + version);
        }
        if (scale < MIN_SCALE || scale > MAX_SCALE) {
            throw new IllegalArgumentException("scale must be between "
                    + MIN_SCALE + " and " + MAX_SCALE + ": " + scale);
        }
        this.version = version;
        this.scale = scale;
    }

    /**
     * Creates a request with automatic version and mode, MEDIUM error correction
     * and the default scale.
     *
     * @param text the payload
     * @return the request
     */
    public static GenerationRequest of(String text) {
        return new GenerationRequest(text, ErrorCorrection.MEDIUM, AUTO_VERSION, EncodingMode.AUTO, DEFAULT_SCALE);
    }

    public String getText() {
        return text;
    }

    public ErrorCorrection getErrorCorrection() {
        return errorCorrection;
    }

    /**
     * @return the requested version, or {@link #AUTO_VERSION}
     */
    public int getVersion() {
        return version;
    }

    public boolean isAutoVersion() {
        return version == AUTO_VERSION;
    }

    public EncodingMode getMode() {
        return mode;
    }

    public int getScale() {
        return scale;
    }

    public GenerationRequest withText(String newText) {
        return new GenerationRequest(newText, errorCorrection, version, mode, scale);
    }

    public GenerationRequest withErrorCorrection(ErrorCorrection newErrorCorrection) {
        return new GenerationRequest(text, newErrorCorrection, version, mode, scale);
    }

    public GenerationRequest withVersion(int newVersion) {
        return new GenerationRequest(text, errorCorrection, newVersion, mode, scale);
    }

    public GenerationRequest withMode(EncodingMode newMode) {
        return new GenerationRequest(text, errorCorrection, version, newMode, scale);
    }

    public GenerationRequest withScale(int newScale) {
        return new GenerationRequest(text, errorCorrection, version, mode, newScale);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenerationRequest)) {
            return false;
        }
        GenerationRequest other = (GenerationRequest) o;
        return version == other.version
                && scale == other.scale
                && text.equals(other.text)
                && errorCorrection == other.errorCorrection
                && mode == other.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, errorCorrection, version, mode, scale);
    }

    @Override
    public String toString() {
        String shown = text.length() > TO_STRING_TEXT_LIMIT
                ? text.substring(0, TO_STRING_TEXT_LIMIT) + "...(" + text.length() + " chars)"
                : text;
        return "GenerationRequest{text='" + shown + "'"
                + ", errorCorrection=" + errorCorrection
                + ", version=" + (isAutoVersion() ? "AUTO" : String.valueOf(version))
                + ", mode=" + mode
                + ", scale=" + scale
                + "}";
    }
}
