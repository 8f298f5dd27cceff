package ca.weblite.qrstudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Drains a {@link RequestMailbox}, turns each request into a result and hands it
 * to a {@link ResultSink}.
 *
 * <p>The loop ends when the mailbox is closed or the thread is interrupted.
 * Validation failures are delivered as results; any other exception escapes
 * {@link #run()} so the owning thread's uncaught-exception handler sees it.</p>
 */
public class GenerationWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GenerationWorker.class);

    private final RequestMailbox mailbox;
    private final QrGenerator generator;
    private final ResultSink sink;
    private final long minIntervalNanos;

    private long lastConsumedAt;
    private boolean consumedAny;
    private long processedCount;

    /**
     * @param mailbox source of requests
     * @param generator the encode step
     * @param sink receives every result
     * @param minIntervalMillis minimum time between two consumptions, 0 for none
     */
    public GenerationWorker(RequestMailbox mailbox, QrGenerator generator, ResultSink sink, long minIntervalMillis) {
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("minIntervalMillis must not be negative: " + minIntervalMillis);
        }
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(minIntervalMillis);
    }

    @Override
    public void run() {
        log.info("Generation worker started");
        try {
            while (true) {
                pace();
                GenerationRequest request = mailbox.take();
                if (request == null) {
                    break;
                }
                lastConsumedAt = System.nanoTime();
                consumedAny = true;

                log.debug("Generating {}", request);
                GenerationResult result = generator.generate(request);
                processedCount++;
                sink.onResult(result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Generation worker stopped after {} requests ({} superseded)",
                processedCount, mailbox.getDroppedCount());
    }

    /**
     * Holds off the next take until the minimum interval has passed, so bursts of
     * submissions collapse into the slot meanwhile.
     */
    private void pace() throws InterruptedException {
        if (minIntervalNanos == 0L || !consumedAny) {
            return;
        }
        long wait = minIntervalNanos - (System.nanoTime() - lastConsumedAt);
        if (wait > 0L) {
            TimeUnit.NANOSECONDS.sleep(wait);
        }
    }
}
