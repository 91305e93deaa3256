// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.cmdmetrics.exporter.exec.JobRunner;
import org.cmdmetrics.exporter.job.Job;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class JobSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Job job(String metricName, long intervalSeconds) {
        return Job.builder(metricName, List.of("true"))
                .setInterval(Duration.ofSeconds(intervalSeconds))
                .build();
    }

    @Nested
    class PollDue {

        private final MutableClock clock = new MutableClock(T0);
        private final Job every30 = job("every_30", 30);
        private final Job every60 = job("every_60", 60);
        private final JobScheduler scheduler =
                new JobScheduler(List.of(every30, every60), mock(JobRunner.class), clock, Duration.ofSeconds(1));

        @AfterEach
        void tearDown() {
            scheduler.shutdown();
        }

        @Test
        void testAllJobsDueAtStart() {
            assertThat(scheduler.size()).isEqualTo(2);
            assertThat(scheduler.nextDue()).isEqualTo(T0);
            assertThat(scheduler.pollDue(T0)).containsExactly(every30, every60);
        }

        @Test
        void testJobsDueAtTheirIntervals() {
            assertThat(scheduler.pollDue(T0)).containsExactly(every30, every60);
            assertThat(scheduler.nextDue()).isEqualTo(T0.plusSeconds(30));

            assertThat(scheduler.pollDue(T0.plusSeconds(29))).isEmpty();
            assertThat(scheduler.pollDue(T0.plusSeconds(30))).containsExactly(every30);
            assertThat(scheduler.pollDue(T0.plusSeconds(60))).containsExactly(every30, every60);
            assertThat(scheduler.size()).isEqualTo(2);
        }

        @Test
        void testEachJobAtMostOncePerPoll() {
            scheduler.pollDue(T0);

            assertThat(scheduler.pollDue(T0.plusSeconds(600))).containsExactly(every30, every60);
        }

        @Test
        void testLatePollShiftsNextRun() {
            scheduler.pollDue(T0);

            assertThat(scheduler.pollDue(T0.plusSeconds(45))).containsExactly(every30);
            assertThat(scheduler.pollDue(T0.plusSeconds(60))).containsExactly(every60);
            assertThat(scheduler.pollDue(T0.plusSeconds(74))).isEmpty();
            assertThat(scheduler.pollDue(T0.plusSeconds(75))).containsExactly(every30);
        }

        @Test
        void testTiesInInsertionOrder() {
            Job first = job("first", 10);
            Job second = job("second", 10);
            Job third = job("third", 10);
            JobScheduler ties =
                    new JobScheduler(List.of(first, second, third), mock(JobRunner.class), clock, Duration.ofSeconds(1));

            assertThat(ties.pollDue(T0)).containsExactly(first, second, third);
            assertThat(ties.pollDue(T0.plusSeconds(10))).containsExactly(first, second, third);
            ties.shutdown();
        }

        @Test
        void testAddedJobDueImmediately() {
            scheduler.pollDue(T0);
            clock.advance(Duration.ofSeconds(10));
            Job added = job("added", 60);

            scheduler.addJob(added);

            assertThat(scheduler.nextDue()).isEqualTo(T0.plusSeconds(10));
            assertThat(scheduler.pollDue(T0.plusSeconds(10))).containsExactly(added);
        }

        @Test
        void testRescheduleSaturatesAtEndOfTime() {
            Instant nearEnd = Instant.MAX.minusSeconds(60);
            Job yearly = job("yearly", Job.MAX_DURATION.toSeconds());
            JobScheduler late = new JobScheduler(
                    List.of(yearly, every30), mock(JobRunner.class), new MutableClock(nearEnd), Duration.ofSeconds(1));

            assertThat(late.pollDue(nearEnd)).containsExactly(yearly, every30);

            assertThat(late.size()).isEqualTo(2);
            assertThat(late.nextDue()).isEqualTo(nearEnd.plusSeconds(30));
            assertThat(late.pollDue(nearEnd.plusSeconds(30))).containsExactly(every30);
            assertThat(late.pollDue(nearEnd.plusSeconds(60))).containsExactly(yearly, every30);
            late.shutdown();
        }

        @Test
        void testNoJobs() {
            JobScheduler empty = new JobScheduler(List.of(), mock(JobRunner.class), clock, Duration.ofSeconds(1));

            assertThat(empty.nextDue()).isNull();
            assertThat(empty.pollDue(T0)).isEmpty();
            empty.shutdown();
        }

        @Test
        void testInvalidTickThrows() {
            assertThatThrownBy(() -> new JobScheduler(List.of(), mock(JobRunner.class), clock, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @Timeout(30)
    class Loop {

        private final MutableClock clock = new MutableClock(T0);
        private final JobRunner runner = mock(JobRunner.class);
        private final Job job = job("service_check", 1);

        private Thread start(JobScheduler scheduler) {
            Thread thread = new Thread(scheduler::run, "test-scheduler");
            thread.start();
            return thread;
        }

        private void stop(JobScheduler scheduler, Thread thread) throws InterruptedException {
            scheduler.shutdown();
            thread.join(TimeUnit.SECONDS.toMillis(10));
            assertThat(thread.isAlive()).isFalse();
        }

        private void awaitNextDue(JobScheduler scheduler, Instant expected) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (!expected.equals(scheduler.nextDue()) && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertThat(scheduler.nextDue()).isEqualTo(expected);
        }

        @Test
        void testDispatchesDueJobs() throws InterruptedException {
            JobScheduler scheduler = new JobScheduler(List.of(job), runner, clock, Duration.ofMillis(10));
            Thread thread = start(scheduler);

            verify(runner, timeout(5000)).run(job);
            awaitNextDue(scheduler, T0.plusSeconds(1));

            clock.advance(Duration.ofSeconds(1));
            verify(runner, timeout(5000).times(2)).run(job);

            stop(scheduler, thread);
            assertThat(scheduler.isShutdown()).isTrue();
        }

        @Test
        void testJobAddedWhileRunning() throws InterruptedException {
            JobScheduler scheduler = new JobScheduler(List.of(), runner, clock, Duration.ofSeconds(5));
            Thread thread = start(scheduler);
            Job added = job("added", 60);

            scheduler.addJob(added);

            verify(runner, timeout(5000)).run(added);
            stop(scheduler, thread);
        }

        @Test
        void testRunningJobSkipped() throws InterruptedException {
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(invocation -> {
                        release.await();
                        return null;
                    })
                    .when(runner)
                    .run(any());
            JobScheduler scheduler = new JobScheduler(List.of(job), runner, clock, Duration.ofMillis(10));
            Thread thread = start(scheduler);

            verify(runner, timeout(5000)).run(job);
            awaitNextDue(scheduler, T0.plusSeconds(1));
            clock.advance(Duration.ofSeconds(1));
            awaitNextDue(scheduler, T0.plusSeconds(2));
            verify(runner, times(1)).run(job);

            release.countDown();
            clock.advance(Duration.ofSeconds(1));
            verify(runner, timeout(5000).times(2)).run(job);
            stop(scheduler, thread);
        }

        @Test
        void testShutdownLetsRunningCommandsFinish() throws InterruptedException {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(invocation -> {
                        started.countDown();
                        release.await();
                        return null;
                    })
                    .when(runner)
                    .run(any());
            JobScheduler scheduler = new JobScheduler(List.of(job), runner, clock, Duration.ofMillis(10));
            Thread thread = start(scheduler);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            stop(scheduler, thread);
            assertThat(scheduler.awaitTermination(Duration.ofMillis(100))).isFalse();

            release.countDown();
            assertThat(scheduler.awaitTermination(Duration.ofSeconds(5))).isTrue();
        }

        @Test
        void testNothingDispatchedAfterShutdown() throws InterruptedException {
            JobScheduler scheduler = new JobScheduler(List.of(), runner, clock, Duration.ofMillis(10));
            Thread thread = start(scheduler);
            stop(scheduler, thread);

            scheduler.addJob(job);

            assertThat(scheduler.awaitTermination(Duration.ofSeconds(5))).isTrue();
            verify(runner, never()).run(any());
        }

        @Test
        void testLoopSurvivesJobDueAtEndOfTime() throws InterruptedException {
            Instant nearEnd = Instant.MAX.minusSeconds(60);
            Job yearly = job("yearly", Job.MAX_DURATION.toSeconds());
            JobScheduler scheduler =
                    new JobScheduler(List.of(yearly), runner, new MutableClock(nearEnd), Duration.ofMillis(10));
            Thread thread = start(scheduler);

            verify(runner, timeout(5000)).run(yearly);
            awaitNextDue(scheduler, Instant.MAX);
            Thread.sleep(50);

            assertThat(thread.isAlive()).isTrue();
            assertThat(scheduler.size()).isEqualTo(1);
            stop(scheduler, thread);
        }

        @Test
        void testInterruptStopsLoop() throws InterruptedException {
            JobScheduler scheduler = new JobScheduler(List.of(), runner, clock, Duration.ofSeconds(5));
            Thread thread = start(scheduler);

            thread.interrupt();
            thread.join(TimeUnit.SECONDS.toMillis(10));

            assertThat(thread.isAlive()).isFalse();
            scheduler.shutdown();
        }
    }
}
