package com.contacts.merger.configration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(RetryUtils.class);

    private RetryUtils() {
    }

    /**
     * Runs {@code operation} up to {@code maxAttempts} times, sleeping {@code delayMillis} between
     * failed attempts.
     *
     * @throws RetryExhaustedException carrying the last failure when no attempt succeeds
     */
    public static <T> T retry(int maxAttempts, long delayMillis, RetryableOperation<T> operation) {
        int attempts = Math.max(1, maxAttempts);
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                logger.info("🔁 Attempt {}/{}...", attempt, attempts);
                return operation.execute();
            } catch (Exception e) {
                lastFailure = e;
                logger.warn("❌ Attempt {} failed: {}", attempt, e.getMessage());
                if (attempt < attempts && delayMillis > 0) {
                    try {
                        Thread.sleep(delayMillis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RetryExhaustedException("Retry interrupted", ie);
                    }
                }
            }
        }
        throw new RetryExhaustedException("🚫 Operation failed after " + attempts + " attempts.", lastFailure);
    }

    @FunctionalInterface
    public interface RetryableOperation<T> {
        T execute() throws Exception;
    }

    public static class RetryExhaustedException extends RuntimeException {
        public RetryExhaustedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
