package ca.weblite.qrstudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Application-wide constants.
 */
public final class QrStudio {

    private static final Logger log = LoggerFactory.getLogger(QrStudio.class);

    public static final String APP_NAME = "QR Studio";

    static final String UNKNOWN_VERSION = "unknown";

    private static final String VERSION_RESOURCE = "version.properties";

    private static String version;

    private QrStudio() {
    }

    /**
     * Returns the version of the application, as set by the build.
     * @return the version string, or {@code "unknown"} if it cannot be determined
     */
    public static synchronized String getVersion() {
        if (version == null) {
            version = loadVersion();
        }
        return version;
    }

    private static String loadVersion() {
        try (InputStream in = QrStudio.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                String value = props.getProperty("version", "").trim();
                // unfiltered when run from sources outside Maven
                if (!value.isEmpty() && !value.startsWith("${")) {
                    return value;
                }
            }
        } catch (IOException e) {
            log.warn("Could not read {}", VERSION_RESOURCE, e);
        }
        String implementationVersion = QrStudio.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : UNKNOWN_VERSION;
    }
}
