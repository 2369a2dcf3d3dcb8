package me.internalizable.socialflood.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Runs a batch of independent tasks on the shared executor with at most {@code maxParallel}
 * of them in flight. Each batch gets its own semaphore, so batches never starve each other.
 *
 * Outcomes come back in input order and one task failing never cancels its siblings.
 * There is no timeout here; callers bound a batch by interrupting the thread that waits on it.
 */
public class ConcurrencyGate {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyGate.class);

    private final ExecutorService executor;
    private final int defaultMaxParallel;

    public ConcurrencyGate(ExecutorService executor, int defaultMaxParallel) {
        if (defaultMaxParallel < 1) {
            throw new IllegalArgumentException("defaultMaxParallel must be at least 1, got " + defaultMaxParallel);
        }
        this.executor = executor;
        this.defaultMaxParallel = defaultMaxParallel;
    }

    public <T> List<FetchOutcome<T>> runAll(List<? extends Callable<T>> tasks) throws InterruptedException {
        return runAll(tasks, defaultMaxParallel);
    }

    /**
     * @throws InterruptedException if the calling thread is interrupted; every task of the batch
     *                              is cancelled with interruption before this is thrown
     */
    public <T> List<FetchOutcome<T>> runAll(List<? extends Callable<T>> tasks, int maxParallel)
            throws InterruptedException {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        if (tasks.isEmpty()) {
            return List.of();
        }

        Semaphore permits = new Semaphore(maxParallel);
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        try {
            for (Callable<T> task : tasks) {
                permits.acquire();
                futures.add(executor.submit(() -> {
                    try {
                        return task.call();
                    } finally {
                        permits.release();
                    }
                }));
            }

            List<FetchOutcome<T>> outcomes = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                outcomes.add(await(future));
            }
            return outcomes;
        } catch (InterruptedException e) {
            logger.warn("Fan-out of {} tasks interrupted, cancelling {} submitted", tasks.size(), futures.size());
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
    }

    public int getDefaultMaxParallel() {
        return defaultMaxParallel;
    }

    private static <T> FetchOutcome<T> await(Future<T> future) throws InterruptedException {
        try {
            return FetchOutcome.success(future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.debug("Fan-out task failed: {}", cause.toString());
            return FetchOutcome.failure(cause);
        }
    }
}
