package ca.weblite.qrstudio;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test encoder whose behaviour is selected by the text prefix:
 * "block" waits for {@link #release()}, "invalid" fails validation,
 * "boom" throws an unchecked exception. Anything else yields a 1x1 dark symbol.
 */
class ScriptedEncoder implements QrEncoder {

    private final List<String> seen = new CopyOnWriteArrayList<>();
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch gate = new CountDownLatch(1);

    @Override
    public QrSymbol encode(String text, ErrorCorrection errorCorrection, int version, EncodingMode mode)
            throws QrValidationException {
        seen.add(text);
        if (text.startsWith("block")) {
            entered.countDown();
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("gate never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        if (text.startsWith("invalid")) {
            throw new QrValidationException("cannot encode " + text);
        }
        if (text.startsWith("boom")) {
            throw new IllegalStateException("encoder bug");
        }
        return new FakeSymbol(text);
    }

    boolean awaitBlocked(long timeout, TimeUnit unit) throws InterruptedException {
        return entered.await(timeout, unit);
    }

    void release() {
        gate.countDown();
    }

    List<String> getSeen() {
        return seen;
    }

    static final class FakeSymbol implements QrSymbol {
        private final String text;

        FakeSymbol(String text) {
            this.text = text;
        }

        @Override
        public int getSize() {
            return 1;
        }

        @Override
        public boolean isDark(int x, int y) {
            return true;
        }

        @Override
        public int getVersion() {
            return 1;
        }

        @Override
        public ErrorCorrection getErrorCorrection() {
            return ErrorCorrection.LOW;
        }

        @Override
        public String describe() {
            return "fake:" + text;
        }
    }
}
