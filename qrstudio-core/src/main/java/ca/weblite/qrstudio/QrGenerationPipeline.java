package ca.weblite.qrstudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Background QR generation with latest-wins coalescing.
 *
 * <p>Owns one {@link RequestMailbox} and one worker thread. Submitting never
 * blocks; while the worker is busy, newer submissions replace older ones that
 * have not started yet, and only the newest is generated next. Every request
 * the worker picks up produces exactly one call to the {@link ResultSink}, on the
 * worker thread.</p>
 *
 * <h2>Usage</h2>
 * <pre>
 * QrGenerationPipeline pipeline = new QrGenerationPipeline(
 *         new QrGenerator(new ZxingQrEncoder(), new ModuleRasterizer()),
 *         new SwingResultSink(result -&gt; panel.showResult(result)));
 * pipeline.start();
 *
 * textField.getDocument().addDocumentListener(...
 *     pipeline.submit(request.withText(textField.getText())));
 * </pre>
 */
public class QrGenerationPipeline implements RequestSubmitter {

    private static final Logger log = LoggerFactory.getLogger(QrGenerationPipeline.class);

    static final String THREAD_NAME = "QrStudio-GenerationWorker";

    private final RequestMailbox mailbox = new RequestMailbox();
    private final QrGenerator generator;
    private final ResultSink sink;

    private long minIntervalMillis;
    private FatalErrorHandler fatalErrorHandler = FatalErrorHandler.EXIT_PROCESS;

    private Thread workerThread;

    public QrGenerationPipeline(QrGenerator generator, ResultSink sink) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Sets a minimum time between two generations. Submissions made in between
     * coalesce as usual.
     *
     * @param minIntervalMillis interval in milliseconds, 0 (the default) to disable
     * @return this pipeline for chaining
     */
    public synchronized QrGenerationPipeline withMinInterval(long minIntervalMillis) {
        checkNotStarted();
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("minIntervalMillis must not be negative: " + minIntervalMillis);
        }
        this.minIntervalMillis = minIntervalMillis;
        return this;
    }

    /**
     * Sets what happens when the worker dies from a non-validation error.
     * Defaults to {@link FatalErrorHandler#EXIT_PROCESS}.
     *
     * @param handler the handler
     * @return this pipeline for chaining
     */
    public synchronized QrGenerationPipeline withFatalErrorHandler(FatalErrorHandler handler) {
        checkNotStarted();
        this.fatalErrorHandler = Objects.requireNonNull(handler, "handler must not be null");
        return this;
    }

    /**
     * Starts the worker thread.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        checkNotStarted();
        GenerationWorker worker = new GenerationWorker(mailbox, generator, sink, minIntervalMillis);
        FatalErrorHandler handler = fatalErrorHandler;

        workerThread = new Thread(worker, THREAD_NAME);
        workerThread.setDaemon(true);
        workerThread.setUncaughtExceptionHandler((thread, error) -> {
            log.error("Generation worker terminated by unexpected error", error);
            handler.onFatalError(error);
        });
        workerThread.start();
    }

    @Override
    public void submit(GenerationRequest request) {
        mailbox.submit(request);
    }

    /**
     * Stops accepting requests. A request already being generated still completes
     * and is delivered; a pending one is discarded.
     */
    public void shutdown() {
        mailbox.close();
    }

    /**
     * Waits for the worker thread to exit after {@link #shutdown()}.
     *
     * @param timeout maximum time to wait
     * @param unit unit of {@code timeout}
     * @return true if the worker has exited (or was never started)
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        Thread t;
        synchronized (this) {
            t = workerThread;
        }
        if (t == null) {
            return true;
        }
        t.join(Math.max(1L, unit.toMillis(timeout)));
        return !t.isAlive();
    }

    /**
     * @return true if the worker thread is alive
     */
    public synchronized boolean isRunning() {
        return workerThread != null && workerThread.isAlive();
    }

    RequestMailbox getMailbox() {
        return mailbox;
    }

    private void checkNotStarted() {
        if (workerThread != null) {
            throw new IllegalStateException("Pipeline already started");
        }
    }
}
