package org.screenmatch;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generic deadline helpers for arbitrary operations and conditions.
 */
public final class Timeouts {
    private static final Logger l = LogManager.getLogger(Timeouts.class);

    private static final long CANCEL_POLL_MS = 100;

    private Timeouts() {
    }

    /**
     * Runs the operation on its own thread and waits at most {@code timeout} for it. The operation is not stopped
     * when the deadline passes; its thread is a daemon and its result is discarded.
     *
     * @throws OperationTimeoutException if the operation takes longer
     */
    public static <T> T withTimeout(Duration timeout, Callable<T> operation) {
        ExecutorService executor = newWorker();
        long start = System.nanoTime();
        try {
            Future<T> future = executor.submit(operation);
            try {
                T result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                l.debug("Operation completed in {}ms", (System.nanoTime() - start) / 1_000_000);
                return result;
            } catch (TimeoutException e) {
                l.warn("Operation timed out after {}", timeout);
                throw new OperationTimeoutException("operation", seconds(timeout));
            } catch (ExecutionException e) {
                throw unwrap(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancelledException("operation", e);
            }
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Like {@link #withTimeout} but also gives up as soon as the token is cancelled. The token is handed to the
     * operation so it can stop itself.
     */
    public static <T> T withTimeoutAndCancel(Duration timeout, CancellationToken token, Function<CancellationToken, T> operation) {
        ExecutorService executor = newWorker();
        long start = System.nanoTime();
        try {
            Future<T> future = executor.submit(() -> operation.apply(token));
            while (true) {
                if (token.isCancelled()) {
                    l.warn("Operation cancelled by user");
                    throw new CancelledException("operation");
                }
                try {
                    return future.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (System.nanoTime() - start >= timeout.toNanos()) {
                        l.warn("Operation timed out after {}", timeout);
                        throw new OperationTimeoutException("operation", seconds(timeout));
                    }
                } catch (ExecutionException e) {
                    throw unwrap(e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancelledException("operation", e);
                }
            }
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Checks the condition, then the deadline, then sleeps {@code interval}, until one of the first two holds.
     *
     * @throws FindFailedException named "condition" when the deadline passes first
     */
    public static void waitForCondition(Duration timeout, Duration interval, BooleanSupplier condition) {
        waitForConditionWithCancel(timeout, interval, null, condition);
    }

    public static void waitForConditionWithCancel(Duration timeout, Duration interval, CancellationToken token, BooleanSupplier condition) {
        long start = System.nanoTime();
        while (true) {
            if (token != null && token.isCancelled()) {
                l.warn("Wait cancelled by user");
                throw new CancelledException("wait for condition");
            }
            if (condition.getAsBoolean()) {
                l.debug("Condition met in {}ms", (System.nanoTime() - start) / 1_000_000);
                return;
            }
            if (System.nanoTime() - start >= timeout.toNanos()) {
                l.warn("Condition not met after {}", timeout);
                throw new FindFailedException("condition", seconds(timeout));
            }
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancelledException("wait for condition", e);
            }
        }
    }

    private static ExecutorService newWorker() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "timeout-worker");
            t.setDaemon(true);
            return t;
        });
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new ScreenMatchException("Operation failed: " + cause.getMessage(), cause);
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
