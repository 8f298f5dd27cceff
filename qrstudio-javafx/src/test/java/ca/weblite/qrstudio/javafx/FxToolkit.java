package ca.weblite.qrstudio.javafx;

import javafx.application.Platform;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts the JavaFX toolkit once for all tests. Machines without a display
 * report it as unavailable so tests can skip.
 */
final class FxToolkit {

    private static Boolean available;

    private FxToolkit() {
    }

    static synchronized boolean start() {
        if (available == null) {
            CountDownLatch latch = new CountDownLatch(1);
            try {
                Platform.startup(latch::countDown);
                available = latch.await(5, TimeUnit.SECONDS);
            } catch (IllegalStateException e) {
                // Toolkit already initialized
                available = true;
            } catch (RuntimeException | Error | InterruptedException e) {
                available = false;
            }
        }
        return available;
    }

    static <T> T callOnFxThread(Callable<T> callable) throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<T> value = new AtomicReference<>();
        AtomicReference<Exception> error = new AtomicReference<>();
        Platform.runLater(() -> {
            try {
                value.set(callable.call());
            } catch (Exception e) {
                error.set(e);
            } finally {
                latch.countDown();
            }
        });
        if (!latch.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("FX thread did not respond");
        }
        if (error.get() != null) {
            throw error.get();
        }
        return value.get();
    }
}
