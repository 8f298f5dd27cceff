package ca.weblite.qrstudio.swing;

import ca.weblite.qrstudio.GenerationRequest;
import ca.weblite.qrstudio.GenerationResult;
import org.junit.Before;
import org.junit.Test;

import javax.swing.SwingUtilities;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class SwingResultSinkTest {

    private List<GenerationResult> received;
    private AtomicBoolean wasOnEDT;

    @Before
    public void setUp() {
        received = new CopyOnWriteArrayList<>();
        wasOnEDT = new AtomicBoolean(false);
    }

    private static GenerationResult failure(String message) {
        return GenerationResult.failure(GenerationRequest.of("x"), message);
    }

    @Test
    public void testResultDispatchedOnEDT() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        SwingResultSink sink = new SwingResultSink(result -> {
            wasOnEDT.set(SwingUtilities.isEventDispatchThread());
            received.add(result);
            latch.countDown();
        });

        // Deliver from a non-EDT thread, like the generation worker does
        Thread worker = new Thread(() -> sink.onResult(failure("from worker")));
        worker.start();

        assertTrue("Callback should complete within timeout", latch.await(2, TimeUnit.SECONDS));
        assertTrue("Callback should be on EDT", wasOnEDT.get());
        assertEquals(1, received.size());
        assertEquals("from worker", received.get(0).asFailure().getMessage());
    }

    @Test
    public void testOnResultDoesNotWaitForEDT() throws Exception {
        CountDownLatch edtBusy = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(1);
        SwingUtilities.invokeLater(() -> {
            try {
                edtBusy.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        SwingResultSink sink = new SwingResultSink(result -> delivered.countDown());
        long start = System.nanoTime();
        sink.onResult(failure("queued"));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue("onResult should return while the EDT is busy", elapsedMillis < 1000);
        assertEquals(1, delivered.getCount());

        edtBusy.countDown();
        assertTrue(delivered.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void testRunsInlineWhenAlreadyOnEDT() throws Exception {
        AtomicBoolean ranInline = new AtomicBoolean(false);
        SwingUtilities.invokeAndWait(() -> {
            AtomicBoolean called = new AtomicBoolean(false);
            new SwingResultSink(result -> called.set(true)).onResult(failure("inline"));
            ranInline.set(called.get());
        });
        assertTrue(ranInline.get());
    }

    @Test
    public void testResultsKeepTheirOrder() throws Exception {
        CountDownLatch latch = new CountDownLatch(3);
        SwingResultSink sink = new SwingResultSink(result -> {
            received.add(result);
            latch.countDown();
        });

        sink.onResult(failure("1"));
        sink.onResult(failure("2"));
        sink.onResult(failure("3"));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals("1", received.get(0).asFailure().getMessage());
        assertEquals("2", received.get(1).asFailure().getMessage());
        assertEquals("3", received.get(2).asFailure().getMessage());
    }

    @Test(expected = NullPointerException.class)
    public void testNullDelegateRejected() {
        new SwingResultSink(null);
    }
}
