package ca.weblite.qrstudio.javafx;

import ca.weblite.qrstudio.GenerationResult;
import ca.weblite.qrstudio.ResultSink;
import javafx.application.Platform;

import java.util.Objects;

/**
 * Delivers generation results on the JavaFX Application Thread.
 *
 * <p>The JavaFX toolkit must be running before results arrive.</p>
 */
public class FxResultSink implements ResultSink {

    private final ResultSink delegate;

    /**
     * @param delegate the sink to call on the FX Application Thread
     */
    public FxResultSink(ResultSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void onResult(GenerationResult result) {
        dispatchOnFXThread(() -> delegate.onResult(result));
    }

    /**
     * Dispatch a runnable on the FX Application Thread.
     * If already on FX thread, runs immediately. Otherwise, uses runLater.
     *
     * @param runnable the code to run on FX Application Thread
     */
    private static void dispatchOnFXThread(Runnable runnable) {
        if (Platform.isFxApplicationThread()) {
            runnable.run();
        } else {
            Platform.runLater(runnable);
        }
    }
}
