package com.shoplytic.ai.concurrent;

import com.shoplytic.ai.exception.OperationTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs blocking work on a worker thread and waits for it no longer than the
 * given limit. A task that overruns is interrupted and reported as an
 * {@link OperationTimeoutException}; exceptions thrown by the task reach the
 * caller unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class TimeLimitedExecutor {

    private final ExecutorService executor;

    public <T> T call(String operation, Duration timeout, Supplier<T> task) {
        Future<T> future = executor.submit(task::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {} ms", operation, timeout.toMillis());
            throw new OperationTimeoutException(operation, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(operation, timeout);
        } catch (CancellationException e) {
            throw new OperationTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }
}
