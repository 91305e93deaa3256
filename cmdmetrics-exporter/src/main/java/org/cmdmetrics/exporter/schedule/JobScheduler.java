// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.schedule;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cmdmetrics.core.concurrent.NamedThreadFactory;
import org.cmdmetrics.exporter.exec.JobRunner;
import org.cmdmetrics.exporter.job.Job;

/**
 * Runs each job repeatedly at its own interval.
 * <p>
 * Jobs are kept in a min-heap ordered by the time they are due next, jobs due at the same time in the order
 * they were added. Every job is due as soon as it is added. When a job is taken from the heap it is due again
 * one interval after that moment, so a late run shifts later runs and missed runs are not caught up.
 * <p>
 * {@link #run()} blocks the calling thread and hands every due job to a worker pool, so slow commands never
 * delay other jobs. A job whose previous run has not finished yet is skipped until it is due again.
 * {@link #shutdown()} stops the loop and lets running commands finish.
 */
public final class JobScheduler {

    private static final Logger logger = LogManager.getLogger(JobScheduler.class);

    public static final Duration DEFAULT_TICK = Duration.ofSeconds(1);

    private final JobRunner runner;
    private final Clock clock;
    private final Duration tick;
    private final ExecutorService workers;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<ScheduledJob> queue = new PriorityQueue<>(
            Comparator.comparing(ScheduledJob::nextDue).thenComparingLong(ScheduledJob::sequence));

    private long nextSequence;
    private volatile boolean stopped;

    /**
     * @param jobs   the initial jobs, all due at once
     * @param runner runs a single job
     * @param clock  the source of the current time
     * @param tick   the longest time the loop sleeps before checking for due jobs again
     */
    public JobScheduler(
            @NonNull Collection<Job> jobs, @NonNull JobRunner runner, @NonNull Clock clock, @NonNull Duration tick) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
        Job.requireInRange(tick, "tick");
        this.workers = Executors.newCachedThreadPool(new NamedThreadFactory("job-worker"));

        jobs.forEach(this::addJob);
    }

    /**
     * Adds a job, due immediately.
     *
     * @param job the job to add
     */
    public void addJob(@NonNull Job job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            queue.add(new ScheduledJob(job, nextSequence++, clock.instant()));
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        logger.debug("Job {} added, runs every {}s", job.id(), job.interval().toSeconds());
    }

    /**
     * Removes all jobs due at the given time from the heap and schedules each one again one interval later.
     *
     * @param now the current time
     * @return the due jobs, earliest first
     */
    @NonNull
    public List<Job> pollDue(@NonNull Instant now) {
        return pollDueEntries(now).stream().map(ScheduledJob::job).toList();
    }

    /**
     * @return the time the earliest job is due, or {@code null} if there are no jobs
     */
    @Nullable
    public Instant nextDue() {
        lock.lock();
        try {
            ScheduledJob head = queue.peek();
            return head == null ? null : head.nextDue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of scheduled jobs
     */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatches due jobs until {@link #shutdown()} is called or the calling thread is interrupted.
     */
    public void run() {
        logger.info("Scheduler started with {} job(s)", size());
        while (!stopped) {
            for (ScheduledJob entry : pollDueEntries(clock.instant())) {
                dispatch(entry);
            }
            if (!awaitNextDue()) {
                break;
            }
        }
        logger.info("Scheduler stopped");
    }

    /**
     * Stops the loop and the worker pool. Running commands are not interrupted.
     */
    public void shutdown() {
        stopped = true;
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        workers.shutdown();
    }

    /**
     * Waits for running commands after {@link #shutdown()}.
     *
     * @param timeout the maximum time to wait
     * @return {@code true} if all runs finished, {@code false} if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(@NonNull Duration timeout) throws InterruptedException {
        return workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isShutdown() {
        return stopped;
    }

    private List<ScheduledJob> pollDueEntries(Instant now) {
        final List<ScheduledJob> due = new ArrayList<>();
        lock.lock();
        try {
            while (!queue.isEmpty() && !queue.peek().nextDue().isAfter(now)) {
                due.add(queue.poll());
            }
            for (ScheduledJob entry : due) {
                entry.nextDue = nextDue(now, entry.job().interval());
                queue.add(entry);
            }
        } finally {
            lock.unlock();
        }
        return due;
    }

    /**
     * @return {@code now + interval}, saturated at {@link Instant#MAX}
     */
    private static Instant nextDue(Instant now, Duration interval) {
        if (interval.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
            return Instant.MAX;
        }
        return now.plus(interval);
    }

    private void dispatch(ScheduledJob entry) {
        final Job job = entry.job();
        if (!entry.running.compareAndSet(false, true)) {
            logger.warn("Job {} is still running since its last due time, skipping this run", job.id());
            return;
        }

        try {
            workers.execute(() -> {
                try {
                    runner.run(job);
                } catch (RuntimeException e) {
                    logger.error("Unexpected error while running job {}", job.id(), e);
                } finally {
                    entry.running.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            entry.running.set(false);
            logger.warn("Job {} not started, scheduler is shutting down", job.id());
        }
    }

    /**
     * Sleeps until the earliest job is due, at most one tick.
     *
     * @return {@code false} if interrupted
     */
    private boolean awaitNextDue() {
        lock.lock();
        try {
            if (stopped) {
                return true;
            }
            long waitNanos = tick.toNanos();
            ScheduledJob head = queue.peek();
            if (head != null) {
                Instant now = clock.instant();
                if (!head.nextDue().isAfter(now)) {
                    return true;
                }
                Duration untilDue = Duration.between(now, head.nextDue());
                if (untilDue.compareTo(tick) < 0) {
                    waitNanos = untilDue.toNanos();
                }
            }
            changed.awaitNanos(waitNanos);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Scheduler interrupted");
            return false;
        } finally {
            lock.unlock();
        }
    }

    private static final class ScheduledJob {

        private final Job job;
        private final long sequence;
        private final AtomicBoolean running = new AtomicBoolean();
        private Instant nextDue;

        private ScheduledJob(Job job, long sequence, Instant nextDue) {
            this.job = job;
            this.sequence = sequence;
            this.nextDue = nextDue;
        }

        Job job() {
            return job;
        }

        long sequence() {
            return sequence;
        }

        Instant nextDue() {
            return nextDue;
        }
    }
}
