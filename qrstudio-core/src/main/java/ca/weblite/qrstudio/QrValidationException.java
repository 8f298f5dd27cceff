package ca.weblite.qrstudio;

/**
 * Thrown by a {@link QrEncoder} when the text and options cannot be encoded,
 * for example when the text is too long for the requested version or contains
 * characters outside the requested mode.
 */
public class QrValidationException extends Exception {

    public QrValidationException(String message) {
        super(message);
    }

    public QrValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
