package io.neocli.errors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits out transient failures. Recovery here is only the wait: the caller stays responsible
 * for re-running the operation that failed.
 */
public final class RetryStrategy implements ErrorRecoveryStrategy {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_DELAY_MS = 1_000L;

    private static final Logger log = LoggerFactory.getLogger(RetryStrategy.class);

    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = Thread::sleep;

        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long delayMs;
    private final boolean backoff;
    private final Sleeper sleeper;

    public RetryStrategy() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_DELAY_MS, true);
    }

    public RetryStrategy(int maxRetries, long delayMs, boolean backoff) {
        this(maxRetries, delayMs, backoff, Sleeper.THREAD);
    }

    public RetryStrategy(int maxRetries, long delayMs, boolean backoff, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative: " + delayMs);
        }
        this.maxRetries = maxRetries;
        this.delayMs = delayMs;
        this.backoff = backoff;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    @Override
    public boolean canRecover(AppError error) {
        return error instanceof NetworkError || error instanceof FileSystemError;
    }

    @Override
    public void recover(AppError error) throws InterruptedException {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            long delay = delayFor(attempt);
            sleeper.sleep(delay);
            log.info("Retry attempt {} after {}ms ({})", attempt, delay, error.code());
        }
    }

    long delayFor(int attempt) {
        return backoff ? delayMs * attempt : delayMs;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
