package ca.weblite.qrstudio;

import ca.weblite.qrstudio.zxing.ZxingQrEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;

/**
 * Startup settings, read from system properties.
 *
 * <p>Recognised properties:</p>
 * <ul>
 *   <li>{@code qrstudio.initialText}: text of the first request</li>
 *   <li>{@code qrstudio.errorCorrection}: AUTO, LOW, MEDIUM, QUARTILE or HIGH</li>
 *   <li>{@code qrstudio.version}: 0 for automatic, or 1 to 40</li>
 *   <li>{@code qrstudio.mode}: AUTO, NUMERIC, ALPHANUMERIC, BINARY or KANJI</li>
 *   <li>{@code qrstudio.scale}: pixels per module, 1 to 32</li>
 *   <li>{@code qrstudio.quietZone}: border width in modules, 0 to 16</li>
 *   <li>{@code qrstudio.minIntervalMs}: minimum time between two generations</li>
 * </ul>
 *
 * <p>A malformed value is logged and replaced by its default.</p>
 */
public final class QrStudioConfig {

    private static final Logger log = LoggerFactory.getLogger(QrStudioConfig.class);

    static final String PROP_INITIAL_TEXT = "qrstudio.initialText";
    static final String PROP_ERROR_CORRECTION = "qrstudio.errorCorrection";
    static final String PROP_VERSION = "qrstudio.version";
    static final String PROP_MODE = "qrstudio.mode";
    static final String PROP_SCALE = "qrstudio.scale";
    static final String PROP_QUIET_ZONE = "qrstudio.quietZone";
    static final String PROP_MIN_INTERVAL_MS = "qrstudio.minIntervalMs";

    static final String DEFAULT_INITIAL_TEXT = "https://www.jdeploy.com";

    private final GenerationRequest initialRequest;
    private final int quietZone;
    private final long minIntervalMillis;

    private QrStudioConfig(GenerationRequest initialRequest, int quietZone, long minIntervalMillis) {
        this.initialRequest = initialRequest;
        this.quietZone = quietZone;
        this.minIntervalMillis = minIntervalMillis;
    }

    /**
     * @return configuration built from {@link System#getProperties()}
     */
    public static QrStudioConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * @param props the properties to read, missing keys fall back to defaults
     * @return the configuration
     */
    public static QrStudioConfig fromProperties(Properties props) {
        String text = props.getProperty(PROP_INITIAL_TEXT, DEFAULT_INITIAL_TEXT);
        ErrorCorrection errorCorrection = readEnum(props, PROP_ERROR_CORRECTION,
                ErrorCorrection.class, ErrorCorrection.MEDIUM);
        EncodingMode mode = readEnum(props, PROP_MODE, EncodingMode.class, EncodingMode.AUTO);

        int version = readInt(props, PROP_VERSION, GenerationRequest.AUTO_VERSION);
        if (version != GenerationRequest.AUTO_VERSION
                && (version < GenerationRequest.MIN_VERSION || version > GenerationRequest.MAX_VERSION)) {
            log.warn("Ignoring {}={}: out of range", PROP_VERSION, version);
            version = GenerationRequest.AUTO_VERSION;
        }

        int scale = readInt(props, PROP_SCALE, GenerationRequest.DEFAULT_SCALE);
        if (scale < GenerationRequest.MIN_SCALE || scale > GenerationRequest.MAX_SCALE) {
            log.warn("Ignoring {}={}: must be between {} and {}", PROP_SCALE, scale,
                    GenerationRequest.MIN_SCALE, GenerationRequest.MAX_SCALE);
            scale = GenerationRequest.DEFAULT_SCALE;
        }

        int quietZone = readInt(props, PROP_QUIET_ZONE, ModuleRasterizer.DEFAULT_QUIET_ZONE);
        if (quietZone < 0 || quietZone > ModuleRasterizer.MAX_QUIET_ZONE) {
            log.warn("Ignoring {}={}: must be between 0 and {}", PROP_QUIET_ZONE, quietZone,
                    ModuleRasterizer.MAX_QUIET_ZONE);
            quietZone = ModuleRasterizer.DEFAULT_QUIET_ZONE;
        }

        long minInterval = readInt(props, PROP_MIN_INTERVAL_MS, 0);
        if (minInterval < 0) {
            log.warn("Ignoring {}={}: must not be negative", PROP_MIN_INTERVAL_MS, minInterval);
            minInterval = 0;
        }

        GenerationRequest initial = new GenerationRequest(text, errorCorrection, version, mode, scale);
        return new QrStudioConfig(initial, quietZone, minInterval);
    }

    /**
     * @return the request to submit at startup so a symbol shows immediately
     */
    public GenerationRequest getInitialRequest() {
        return initialRequest;
    }

    public int getQuietZone() {
        return quietZone;
    }

    public long getMinIntervalMillis() {
        return minIntervalMillis;
    }

    /**
     * Builds a pipeline wired to ZXing with this configuration. The pipeline is
     * not started.
     *
     * @param sink receives results on the worker thread
     * @return the pipeline
     */
    public QrGenerationPipeline createPipeline(ResultSink sink) {
        QrGenerator generator = new QrGenerator(new ZxingQrEncoder(),
                new ModuleRasterizer(quietZone));
        return new QrGenerationPipeline(generator, sink).withMinInterval(minIntervalMillis);
    }

    private static int readInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number", key, value);
            return defaultValue;
        }
    }

    private static <E extends Enum<E>> E readEnum(Properties props, String key, Class<E> type, E defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {}={}: expected one of {}", key, value, Arrays.toString(type.getEnumConstants()));
            return defaultValue;
        }
    }
}
