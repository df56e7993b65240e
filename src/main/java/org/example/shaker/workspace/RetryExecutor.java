package org.example.shaker.workspace;

import org.example.shaker.exception.MaterializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.Callable;

/**
 * Executes git network operations with retry logic for transient connection errors.
 *
 * <p>Retry is triggered ONLY for:</p>
 * <ul>
 *   <li>Connection timeout (SocketTimeoutException)</li>
 *   <li>Connection refused (ConnectException)</li>
 *   <li>Unresolvable host (UnknownHostException)</li>
 *   <li>IOExceptions whose message reports a network problem, as git's output does</li>
 * </ul>
 *
 * <p>Authentication failures, unknown revisions and local file errors are not retried.</p>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final long backoffMs;

    /**
     * Creates a RetryExecutor with default settings (3 attempts, 2s backoff).
     */
    public RetryExecutor() {
        this(3, 2000);
    }

    /**
     * @param maxAttempts maximum number of attempts
     * @param backoffMs   backoff time in milliseconds between attempts
     */
    public RetryExecutor(int maxAttempts, long backoffMs) {
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    /**
     * Executes the given operation with retry logic.
     *
     * @param operation   the operation to execute
     * @param description description for logging
     * @param <T>         the return type
     * @return the operation result
     * @throws MaterializationException if all retries are exhausted or a non-retryable error occurs
     */
    public <T> T execute(Callable<T> operation, String description) throws MaterializationException {
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastException = e;

                if (!isRetryable(e)) {
                    log.error("{} failed with non-retryable error: {}", description, e.getMessage());
                    throw wrapException(e, description);
                }

                if (attempt < maxAttempts) {
                    log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                            description, attempt, maxAttempts, backoffMs, e.getMessage());
                    sleep(backoffMs);
                } else {
                    log.error("{} failed after {} attempts: {}",
                            description, maxAttempts, e.getMessage());
                }
            }
        }

        throw new MaterializationException(
                String.format("%s failed after %d attempts", description, maxAttempts),
                lastException
        );
    }

    /**
     * Executes the given operation with retry logic (void return).
     */
    public void executeVoid(VoidCallable operation, String description) throws MaterializationException {
        execute(() -> {
            operation.call();
            return null;
        }, description);
    }

    /**
     * Determines if the given exception, or any of its causes, is a connection problem.
     */
    public boolean isRetryable(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (isConnectionException(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean isConnectionException(Throwable e) {
        if (e instanceof SocketTimeoutException
                || e instanceof ConnectException
                || e instanceof UnknownHostException) {
            return true;
        }
        if (e instanceof IOException) {
            String message = e.getMessage();
            if (message != null) {
                String lowerMessage = message.toLowerCase();
                return lowerMessage.contains("connection") ||
                       lowerMessage.contains("network") ||
                       lowerMessage.contains("timeout") ||
                       lowerMessage.contains("timed out") ||
                       lowerMessage.contains("could not resolve host") ||
                       lowerMessage.contains("unreachable") ||
                       lowerMessage.contains("reset");
            }
        }
        return false;
    }

    private MaterializationException wrapException(Exception e, String description) {
        if (e instanceof MaterializationException) {
            return (MaterializationException) e;
        }
        return new MaterializationException(description + " failed: " + e.getMessage(), e);
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Retry sleep interrupted");
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    /**
     * Functional interface for void operations.
     */
    @FunctionalInterface
    public interface VoidCallable {
        void call() throws Exception;
    }
}
