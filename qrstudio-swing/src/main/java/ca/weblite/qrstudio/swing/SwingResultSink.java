package ca.weblite.qrstudio.swing;

import ca.weblite.qrstudio.GenerationResult;
import ca.weblite.qrstudio.ResultSink;

import javax.swing.SwingUtilities;
import java.util.Objects;

/**
 * Delivers generation results on the Swing Event Dispatch Thread.
 *
 * <p>Wraps a sink that touches Swing components. Results arriving on the
 * generation worker thread are re-posted with {@code invokeLater}; the worker
 * never waits for the EDT.</p>
 *
 * <pre>
 * QrGenerationPipeline pipeline = config.createPipeline(new SwingResultSink(panel::showResult));
 * </pre>
 */
public class SwingResultSink implements ResultSink {

    private final ResultSink delegate;

    /**
     * @param delegate the sink to call on the EDT
     */
    public SwingResultSink(ResultSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void onResult(GenerationResult result) {
        dispatchOnEDT(() -> delegate.onResult(result));
    }

    /**
     * Dispatch a runnable on the EDT.
     * If already on EDT, runs immediately. Otherwise, uses invokeLater.
     *
     * @param runnable the code to run on EDT
     */
    private static void dispatchOnEDT(Runnable runnable) {
        if (SwingUtilities.isEventDispatchThread()) {
            runnable.run();
        } else {
            SwingUtilities.invokeLater(runnable);
        }
    }
}
