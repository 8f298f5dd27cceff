package ca.weblite.qrstudio;

/**
 * Receives the outcome of each request the generation worker consumed.
 */
public interface ResultSink {

    /**
     * Called once per consumed request.
     *
     * <p>This method is called on the generation worker thread. Implementations
     * should dispatch to the appropriate thread (e.g., EDT for Swing,
     * Platform.runLater for JavaFX) if UI updates are needed, and must return
     * promptly: the worker does not take the next request until this returns.</p>
     *
     * @param result the result, never null
     */
    void onResult(GenerationResult result);
}
