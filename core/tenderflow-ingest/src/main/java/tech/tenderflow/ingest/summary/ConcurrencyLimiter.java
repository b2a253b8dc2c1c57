package tech.tenderflow.ingest.summary;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps the number of simultaneous model calls.
 *
 * <p>One instance is shared by every caller in the process. Permits are released by closing
 * them, so a try-with-resources block releases on every exit path.
 */
public class ConcurrencyLimiter {

    private final Semaphore semaphore;

    public ConcurrencyLimiter(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, was " + maxConcurrency);
        }
        this.semaphore = new Semaphore(maxConcurrency, true);
    }

    /**
     * Blocks until a slot is free.
     */
    public Permit acquire() throws InterruptedException {
        semaphore.acquire();
        return new Permit(semaphore);
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    /**
     * A held slot. Closing it more than once releases only once.
     */
    public static final class Permit implements AutoCloseable {

        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
