package org.rostilos.gitvault.manager;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs login flows on daemon worker threads with an overall deadline. A flow that
 * overruns is interrupted and reported as {@code CANCELED}.
 */
public class InteractiveFlowRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InteractiveFlowRunner.class);

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor;

    public InteractiveFlowRunner() {
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gitvault-login-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run {@code flow} and wait at most {@code timeout} for its result.
     * Unchecked exceptions thrown by the flow propagate unchanged.
     *
     * @throws AuthException with kind {@code CANCELED} on timeout or when the caller is interrupted
     */
    public <T> T run(String description, Supplier<T> flow, Duration timeout) {
        Callable<T> task = flow::get;
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Credential manager is closed", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} did not complete within {}s and was canceled", description, timeout.toSeconds());
            throw new AuthException(EAuthErrorKind.CANCELED, "LOGIN_TIMEOUT",
                    description + " timed out after " + timeout.toSeconds() + "s",
                    "Run the login again and finish it within the configured timeout", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AuthException(EAuthErrorKind.CANCELED, "LOGIN_INTERRUPTED",
                    description + " was interrupted", null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(description + " failed", cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
