package com.oloc.adapter.executor;

import com.oloc.core.CalculationOptions;
import com.oloc.core.Calculator;
import com.oloc.core.Result;
import com.oloc.exception.CalculationRejectedException;
import com.oloc.exception.CalculationTimeoutException;
import com.oloc.exception.OlocException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enforces calculation time limits by running each supervised calculation as a
 * cancellable task on daemon threads. An expired task is cancelled with an
 * interrupt and abandoned; the caller gets a {@link CalculationTimeoutException}.
 */
public class CalculationSupervisor {

    private static final Logger log = LoggerFactory.getLogger(CalculationSupervisor.class);

    private static final String THREAD_NAME_PREFIX = "oloc-calc-";

    private final Calculator calculator;
    private final ExecutorService executor;

    public CalculationSupervisor(Calculator calculator) {
        this.calculator = calculator;
        this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory());
        log.info("CalculationSupervisor started, default time limit {} ms",
                calculator.getConfig().timeLimitMillis());
    }

    public Result calculate(String expression) {
        return calculate(expression, CalculationOptions.from(calculator.getConfig()));
    }

    /**
     * Calculate under the time limit of {@code options}. A negative limit runs
     * the calculation in the calling thread.
     *
     * @throws CalculationTimeoutException  if the limit expires first
     * @throws CalculationRejectedException if the supervisor is shut down or the caller is interrupted
     */
    public Result calculate(String expression, CalculationOptions options) {
        if (!options.isSupervised()) {
            return calculator.calculate(expression, options);
        }

        Future<Result> future;
        try {
            future = executor.submit(() -> calculator.calculate(expression, options));
        } catch (RejectedExecutionException e) {
            throw new CalculationRejectedException("Supervisor is shut down", e);
        }

        try {
            return future.get(options.timeLimitMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Calculation of '{}' exceeded {} ms, cancelled", expression, options.timeLimitMillis());
            throw new CalculationTimeoutException(expression, options.timeLimitMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CalculationRejectedException("Interrupted while waiting for '" + expression + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new OlocException("Calculation of '" + expression + "' failed", cause);
        }
    }

    public void shutdown() {
        log.info("Shutting down CalculationSupervisor");
        executor.shutdownNow();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private static final class DaemonThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, THREAD_NAME_PREFIX + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
