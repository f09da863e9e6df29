/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Targets.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.targets.job;

import com.hellblazer.targets.color.LookupTables;
import com.hellblazer.targets.color.TransferFunction;
import com.hellblazer.targets.io.ImageSink;
import com.hellblazer.targets.post.PostProcessMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the catalog through a fixed pool of workers.
 *
 * <p>Jobs are handed to workers through a {@link SynchronousQueue}, so the producer blocks until a worker is free
 * to take the next job. That hand-off is the only synchronization point: workers share nothing but immutable lookup
 * tables and patterns. Once every job is handed off the producer sends one end-of-stream marker per worker and
 * joins the pool.
 *
 * <p>Any failure in a worker is fatal, whether a persistence failure or an exception or error escaping a job: the
 * producer stops dispatching, idle workers are released, and {@link #run(String)} rethrows the failure once the pool
 * has terminated.
 *
 * @author hal.hildebrand
 */
public class RenderScheduler {
    private static final Logger log = LoggerFactory.getLogger(RenderScheduler.class);

    private static final long HANDOFF_POLL_MILLIS = 100;

    /**
     * Configuration for a render run
     */
    public static class Config {
        public final int              workers;
        public final TransferFunction output;
        public final PostProcessMode  postProcess;

        public Config(int workers, TransferFunction output, PostProcessMode postProcess) {
            if (workers < 1) {
                throw new IllegalArgumentException("Workers must be at least 1, got: " + workers);
            }
            this.workers = workers;
            this.output = output;
            this.postProcess = postProcess;
        }

        public static Config defaultConfig() {
            return new Config(Runtime.getRuntime().availableProcessors(), TransferFunction.SRGB_ENCODE,
                              PostProcessMode.CLAMP);
        }

        @Override
        public String toString() {
            return String.format("Config[workers=%d, output=%s, post=%s]", workers, output, postProcess);
        }
    }

    /**
     * Queue entry; the marker with a null job tells a worker to exit.
     */
    private record Handoff(RenderJob job) {
        static final Handoff END_OF_STREAM = new Handoff(null);
    }

    private final RenderCatalog                    catalog;
    private final RenderTask                       task;
    private final Config                           config;
    private final SynchronousQueue<Handoff>        queue    = new SynchronousQueue<>();
    private final AtomicReference<SchedulerState>  state    = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicReference<RenderException> failure  = new AtomicReference<>();
    private final AtomicInteger                    rendered = new AtomicInteger();
    private final AtomicInteger                    skipped  = new AtomicInteger();
    private final AtomicInteger                    files    = new AtomicInteger();

    public RenderScheduler(RenderCatalog catalog, LookupTables tables, ImageSink sink, Config config) {
        this(catalog, new RenderTask(tables.get(config.output), config.postProcess.processor(), sink), config);
    }

    RenderScheduler(RenderCatalog catalog, RenderTask task, Config config) {
        this.catalog = catalog;
        this.task = task;
        this.config = config;
    }

    /**
     * Render every job of the catalog, or only those of one size class.
     *
     * @param filter size class name, or null for all
     * @return counts for the completed run
     * @throws RenderException           when a job fails fatally
     * @throws IllegalArgumentException when the filter names no size class
     * @throws IllegalStateException    when this scheduler has already run
     */
    public RenderReport run(String filter) throws InterruptedException {
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.ENUMERATING)) {
            throw new IllegalStateException("Scheduler already started, state: " + state.get());
        }
        var start = Instant.now();
        List<RenderJob> jobs;
        try {
            jobs = catalog.enumerate(filter);
        } catch (RuntimeException e) {
            state.set(SchedulerState.FAILED);
            throw e;
        }
        log.info("Enumerated {} jobs{} with {}", jobs.size(), filter == null ? "" : " for " + filter, config);

        var workers = Executors.newFixedThreadPool(config.workers, new WorkerThreadFactory());
        for (int i = 0; i < config.workers; i++) {
            workers.execute(this::work);
        }

        boolean handedOff = false;
        try {
            state.set(SchedulerState.DISPATCHING);
            for (var job : jobs) {
                if (!handOff(new Handoff(job))) {
                    break;
                }
            }

            state.compareAndSet(SchedulerState.DISPATCHING, SchedulerState.DRAINING);
            for (int i = 0; i < config.workers; i++) {
                if (!handOff(Handoff.END_OF_STREAM)) {
                    break;
                }
            }
            handedOff = true;
        } finally {
            if (!handedOff || failure.get() != null) {
                workers.shutdownNow();
            } else {
                workers.shutdown();
            }
            while (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                log.trace("Waiting for workers to drain");
            }
        }

        var error = failure.get();
        if (error != null) {
            state.set(SchedulerState.FAILED);
            log.error("Render aborted after {} files: {}", files.get(), error.getMessage());
            throw error;
        }
        state.set(SchedulerState.DONE);
        var report = new RenderReport(jobs.size(), rendered.get(), skipped.get(), files.get(), config.workers,
                                      Duration.between(start, Instant.now()));
        log.info("Render complete: {}", report);
        return report;
    }

    /**
     * Block until a worker takes the entry, giving up once the run has failed.
     */
    private boolean handOff(Handoff entry) throws InterruptedException {
        while (failure.get() == null) {
            if (queue.offer(entry, HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void work() {
        try {
            while (failure.get() == null) {
                var entry = queue.take();
                if (entry.job() == null) {
                    return;
                }
                execute(entry.job());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void execute(RenderJob job) {
        try {
            var outcome = task.execute(job);
            if (outcome.skipped()) {
                skipped.incrementAndGet();
            } else {
                rendered.incrementAndGet();
                files.addAndGet(outcome.filesWritten());
            }
        } catch (RenderException e) {
            fail(e);
        } catch (Throwable t) {
            fail(new RenderException.JobFailedException(job.baseName(), t));
        }
    }

    private void fail(RenderException e) {
        if (failure.compareAndSet(null, e)) {
            state.set(SchedulerState.FAILED);
            log.error("Fatal failure, aborting run", e);
        } else {
            log.debug("Additional failure after abort", e);
        }
    }

    public SchedulerState getState() {
        return state.get();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var thread = new Thread(r, "render-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
