package ca.weblite.qrstudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot, latest-wins handoff between request submitters and the generation
 * worker.
 *
 * <p>{@link #submit(GenerationRequest)} replaces whatever request is still waiting,
 * so a burst of submissions followed by one {@link #take()} yields only the last of
 * them. This is not a queue: older requests are dropped, never delivered.</p>
 *
 * <p>A retriever is signalled only when the slot goes from empty to occupied.
 * Overwriting an occupied slot does not signal again.</p>
 */
public final class RequestMailbox {

    private static final Logger log = LoggerFactory.getLogger(RequestMailbox.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();

    // guarded by lock
    private GenerationRequest pending;
    private boolean closed;
    private long droppedCount;

    /**
     * Stores {@code request} as the only pending request.
     *
     * <p>Never waits for the retriever. Ignored once the mailbox is closed.</p>
     *
     * @param request the request, never null
     */
    public void submit(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        lock.lock();
        try {
            if (closed) {
                log.debug("Mailbox closed, ignoring {}", request);
                return;
            }
            GenerationRequest previous = pending;
            pending = request;
            if (previous == null) {
                available.signal();
            } else {
                droppedCount++;
                log.trace("Superseded {}", previous);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for a request and removes it from the slot.
     *
     * @return the newest request, or null once the mailbox has been closed
     * @throws InterruptedException if interrupted while waiting
     */
    public GenerationRequest take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending == null && !closed) {
                available.await();
            }
            return removePending();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #take()} but gives up after the timeout.
     *
     * @param timeout maximum time to wait
     * @param unit unit of {@code timeout}
     * @return the newest request, or null on timeout or once closed
     * @throws InterruptedException if interrupted while waiting
     */
    public GenerationRequest poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending == null && !closed) {
                if (remaining <= 0L) {
                    return null;
                }
                remaining = available.awaitNanos(remaining);
            }
            return removePending();
        } finally {
            lock.unlock();
        }
    }

    private GenerationRequest removePending() {
        if (closed) {
            return null;
        }
        GenerationRequest request = pending;
        pending = null;
        return request;
    }

    /**
     * Closes the mailbox. Any pending request is discarded and every waiting
     * retriever returns null.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            pending = null;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if a request is waiting to be taken
     */
    public boolean hasPending() {
        lock.lock();
        try {
            return pending != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return how many requests were overwritten before anyone took them
     */
    public long getDroppedCount() {
        lock.lock();
        try {
            return droppedCount;
        } finally {
            lock.unlock();
        }
    }
}
