package email.assistant.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Boundary around every mailbox and model call: a bounded timeout, then a single retry
 * after a fixed backoff. Quota errors are rethrown immediately.
 */
@Slf4j
public class CapabilityGuard {
    private static final int MAX_TRIES = 2;

    private final AsyncTaskExecutor executor;
    private final Duration timeout;
    private final Duration backoff;

    public CapabilityGuard(AsyncTaskExecutor executor, Duration timeout, Duration backoff) {
        this.executor = executor;
        this.timeout = timeout;
        this.backoff = backoff;
    }

    public <T> T call(String operation, Callable<T> call) {
        Throwable lastFailure = null;
        for (int attempt = 1; attempt <= MAX_TRIES; attempt++) {
            Future<T> future = executor.submit(call);
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastFailure = e;
                log.warn("{} timed out after {} ms (attempt {}/{})", operation, timeout.toMillis(), attempt, MAX_TRIES);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof QuotaException) {
                    throw (QuotaException) cause;
                }
                lastFailure = cause;
                log.warn("{} failed (attempt {}/{}): {}", operation, attempt, MAX_TRIES, cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CapabilityUnavailableException(operation + " interrupted", e);
            }

            if (attempt < MAX_TRIES && !backoff.isZero()) {
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CapabilityUnavailableException(operation + " interrupted during backoff", e);
                }
            }
        }
        throw new CapabilityUnavailableException(operation + " unavailable after " + MAX_TRIES + " attempts", lastFailure);
    }
}
