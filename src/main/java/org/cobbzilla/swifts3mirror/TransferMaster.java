package org.cobbzilla.swifts3mirror;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fans a key snapshot out to a fixed pool of {@code maxWorkers} threads, one job per key, and returns
 * once every job has finished. Jobs are isolated: a failing key never cancels the others.
 */
@Slf4j
public class TransferMaster {

    public static final int PROGRESS_INTERVAL_SECONDS = 30;

    private final MirrorContext context;

    public TransferMaster(MirrorContext context) {
        this.context = context;
    }

    protected KeyJob getTask(KeyObjectSummary summary, KeyUploader uploader, TransferSummary results) {
        if (summary.isDirectoryMarker()) {
            return new MarkerCreateJob(context, summary, uploader, results);
        }
        return new KeyTransferJob(context, summary, uploader, results);
    }

    public TransferSummary run(List<KeyObjectSummary> summaries) {
        final MirrorOptions options = context.getOptions();
        final boolean verbose = options.isVerbose();
        final int maxWorkers = options.getMaxWorkers();

        final BlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<Runnable>();
        final ThreadPoolExecutor executorService = new ThreadPoolExecutor(maxWorkers, maxWorkers,
                1, TimeUnit.MINUTES, workQueue,
                new ThreadFactoryBuilder().setNameFormat("transfer-worker-%d").build());

        final KeyUploader uploader = new KeyUploader(context);
        final TransferSummary results = new TransferSummary();

        int counter = 0;
        try {
            for (KeyObjectSummary summary : summaries) {
                context.getDestination().awaitDispatch();
                executorService.execute(getTask(summary, uploader, results));
                counter++;
            }
            log.info("Queued {} keys for {} workers.", counter, maxWorkers);

        } finally {
            // already queued jobs still run to completion
            executorService.shutdown();
            awaitDrain(executorService, workQueue, verbose);
        }
        log.info("Transfer pass finished: {}.", results);
        return results;
    }

    private void awaitDrain(ThreadPoolExecutor executorService, BlockingQueue<Runnable> workQueue, boolean verbose) {
        try {
            while (!executorService.awaitTermination(PROGRESS_INTERVAL_SECONDS, TimeUnit.SECONDS)) {
                if (verbose) log.info("Waiting for transfers (queue size={}, active={}).",
                        workQueue.size(), executorService.getActiveCount());
                context.getStats().logStats();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for {} queued and {} active transfers.",
                    workQueue.size(), executorService.getActiveCount());
            Thread.currentThread().interrupt();
        }
    }
}
