package tech.tenderflow.ingest.summary;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: {@code min(base * 2^(attempt-1) * jitter, max)} where the
 * jitter multiplier is uniform in [0.75, 1.25).
 */
public class BackoffCalculator {

    private static final double JITTER_MIN = 0.75;
    private static final double JITTER_RANGE = 0.5;
    private static final int MAX_EXPONENT = 30;

    private final long baseMillis;
    private final long maxMillis;
    private final DoubleSupplier jitterSource;

    public BackoffCalculator(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitterSource supplies values in [0, 1)
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay, DoubleSupplier jitterSource) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.baseMillis = baseDelay.toMillis();
        this.maxMillis = maxDelay.toMillis();
        this.jitterSource = jitterSource;
    }

    /**
     * Delay before the retry that follows the given (1-indexed) failed attempt.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1, was " + attempt);
        }
        double exponential = baseMillis * Math.pow(2, Math.min(attempt - 1, MAX_EXPONENT));
        double jitter = JITTER_MIN + JITTER_RANGE * jitterSource.getAsDouble();
        long delay = (long) (exponential * jitter);
        return Duration.ofMillis(Math.min(delay, maxMillis));
    }
}
