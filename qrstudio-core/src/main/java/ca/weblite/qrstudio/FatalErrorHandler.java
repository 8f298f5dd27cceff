package ca.weblite.qrstudio;

/**
 * Called when the generation worker dies from an error that is not a validation
 * failure.
 */
public interface FatalErrorHandler {

    /**
     * Terminates the JVM with exit status 1.
     */
    FatalErrorHandler EXIT_PROCESS = error -> System.exit(1);

    /**
     * @param error the error that ended the worker
     */
    void onFatalError(Throwable error);
}
