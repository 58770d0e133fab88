package org.cobbzilla.s3fetch;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches a batch of keys with a fixed number of worker threads. Each worker is one concurrency
 * slot: at most {@code maxThreads} fetches are in flight at any time. Submission is throttled so
 * the backlog of queued jobs never grows beyond {@link #getMaxQueueCapacity(FetchOptions)}.
 */
@Slf4j
public class TransferMaster {

    public static int getMaxQueueCapacity(FetchOptions options) {
        return 10 * options.getMaxThreads();
    }

    private final FetchContext context;
    private final Object notifyLock = new Object();

    public TransferMaster(FetchContext context) {
        this.context = context;
    }

    /**
     * Attempts every listed key at most once and waits until all submitted attempts have finished.
     * If the calling thread is interrupted while jobs are being queued, no further jobs are queued:
     * the keys not yet submitted are reported as failed, the submitted ones are still waited for,
     * and the interrupt flag is set again before returning.
     *
     * @return one outcome per key, in the order the keys were given
     */
    public List<TransferOutcome> fetchAll(List<KeyObjectSummary> summaries, Path localRoot) {
        final FetchOptions options = context.getOptions();
        final boolean verbose = options.isVerbose();
        final int maxThreads = options.getMaxThreads();
        final int maxQueueCapacity = getMaxQueueCapacity(options);

        final BlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<Runnable>();
        final ThreadPoolExecutor executorService = new ThreadPoolExecutor(maxThreads, maxThreads,
                1, TimeUnit.MINUTES, workQueue, new FetchThreadFactory());

        final List<Future<TransferOutcome>> futures = new ArrayList<Future<TransferOutcome>>(summaries.size());
        final List<TransferOutcome> outcomes = new ArrayList<TransferOutcome>(summaries.size());
        InterruptedException interruption = null;
        try {
            submit:
            for (KeyObjectSummary summary : summaries) {
                while (workQueue.size() >= maxQueueCapacity) {
                    synchronized (notifyLock) {
                        try {
                            notifyLock.wait(50);
                        } catch (InterruptedException e) {
                            log.warn("Interrupted while queueing {}, not queueing the remaining {} keys.",
                                    summary.getKey(), summaries.size() - futures.size());
                            interruption = e;
                            break submit;
                        }
                    }
                }
                futures.add(executorService.submit(new KeyFetchJob(context, summary, localRoot, notifyLock)));
                if (verbose && futures.size() % 100 == 0) {
                    log.info("Queued {} of {} keys (queue size={}, active={}).",
                            futures.size(), summaries.size(), workQueue.size(), executorService.getActiveCount());
                }
            }

            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(summaries.get(i).getKey(), futures.get(i)));
            }
            for (int i = futures.size(); i < summaries.size(); i++) {
                context.getStats().fetchErrors.incrementAndGet();
                outcomes.add(TransferOutcome.failed(summaries.get(i).getKey(), null, interruption));
            }
        } finally {
            // every submitted job has been awaited above unless something unexpected was thrown
            executorService.shutdown();
            if (interruption != null) Thread.currentThread().interrupt();
        }

        if (verbose) log.info("All {} fetches finished.", outcomes.size());
        return outcomes;
    }

    private TransferOutcome await(String key, Future<TransferOutcome> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    // no cancellation: keep waiting, restore the flag afterwards
                    interrupted = true;
                    log.warn("Interrupted while waiting for {}, still waiting.", key);
                } catch (ExecutionException e) {
                    final Throwable cause = e.getCause();
                    log.error("Unexpected error fetching {}.", key, cause);
                    context.getStats().fetchErrors.incrementAndGet();
                    return TransferOutcome.failed(key, null,
                            cause instanceof Exception ? (Exception) cause : new IllegalStateException(cause));
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private static class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            final Thread thread = new Thread(r, "s3fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
