package fr.lapetina.inference.executor;

import fr.lapetina.inference.executor.exception.RejectedTaskException;
import fr.lapetina.inference.executor.exception.RejectedTaskException.RejectionReason;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerialExecutorTest {

    private MetricsRegistry metricsRegistry;
    private SerialExecutor executor;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("test");
        executor = SerialExecutor.builder()
                .name("test-queue")
                .ringBufferSize(1024)
                .metricsRegistry(metricsRegistry)
                .build()
                .start();
    }

    @AfterEach
    void tearDown() {
        executor.close();
        metricsRegistry.close();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("should run tasks from one thread in submission order")
        void shouldRunTasksInSubmissionOrder() {
            List<Integer> executed = Collections.synchronizedList(new ArrayList<>());
            for (int i = 0; i < 500; i++) {
                int value = i;
                executor.submit(() -> executed.add(value));
            }

            executor.stop(true);

            assertThat(executed).hasSize(500);
            for (int i = 0; i < 500; i++) {
                assertThat(executed.get(i)).isEqualTo(i);
            }
        }

        @Test
        @DisplayName("should keep each submitter's order and never overlap tasks")
        void shouldPreservePerThreadOrderWithoutOverlap() throws Exception {
            int threads = 4;
            int perThread = 250;
            AtomicBoolean running = new AtomicBoolean(false);
            AtomicInteger overlaps = new AtomicInteger();
            Map<Integer, List<Integer>> seenBySubmitter = new ConcurrentHashMap<>();
            CountDownLatch start = new CountDownLatch(1);

            List<Thread> submitters = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int submitter = t;
                seenBySubmitter.put(submitter, Collections.synchronizedList(new ArrayList<>()));
                Thread thread = new Thread(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        int seq = i;
                        executor.submit(() -> {
                            if (!running.compareAndSet(false, true)) {
                                overlaps.incrementAndGet();
                            }
                            seenBySubmitter.get(submitter).add(seq);
                            running.set(false);
                        });
                    }
                });
                submitters.add(thread);
                thread.start();
            }
            start.countDown();
            for (Thread thread : submitters) {
                thread.join();
            }

            executor.stop(true);

            assertThat(overlaps.get()).isZero();
            for (List<Integer> seen : seenBySubmitter.values()) {
                assertThat(seen).hasSize(perThread).isSorted();
            }
        }

        @Test
        @DisplayName("should run every task on the same worker thread")
        void shouldRunOnSingleWorkerThread() {
            List<String> threadNames = Collections.synchronizedList(new ArrayList<>());
            for (int i = 0; i < 20; i++) {
                executor.submit(() -> threadNames.add(Thread.currentThread().getName()));
            }
            executor.stop(true);

            assertThat(threadNames).hasSize(20).containsOnly("test-queue-worker");
        }
    }

    @Nested
    @DisplayName("shutdown")
    class Shutdown {

        @Test
        @DisplayName("blocking stop should return only after all accepted tasks ran")
        void blockingStopShouldDrainQueue() {
            AtomicInteger executed = new AtomicInteger();
            for (int i = 0; i < 100; i++) {
                executor.submit(() -> {
                    Thread.sleep(1);
                    executed.incrementAndGet();
                });
            }

            executor.stop(true);
            int atReturn = executed.get();

            assertThat(atReturn).isEqualTo(100);
            assertThat(executor.isTerminated()).isTrue();
            assertThat(executor.getCompletedTaskCount()).isEqualTo(100);
        }

        @RepeatedTest(100)
        @DisplayName("blocking stop right after start should run every accepted task")
        void blockingStopRightAfterStart() {
            SerialExecutor fresh = SerialExecutor.builder()
                    .name("fresh")
                    .metricsRegistry(metricsRegistry)
                    .build()
                    .start();
            AtomicInteger ran = new AtomicInteger();
            for (int i = 0; i < 20; i++) {
                fresh.submit(ran::incrementAndGet);
            }

            fresh.stop(true);

            assertThat(ran.get()).isEqualTo(20);
            assertThat(fresh.getCompletedTaskCount()).isEqualTo(20);
        }

        @Test
        @DisplayName("should reject submissions after stop")
        void shouldRejectAfterStop() {
            executor.stop(true);

            assertThatThrownBy(() -> executor.submit(() -> { }))
                    .isInstanceOf(RejectedTaskException.class)
                    .satisfies(e -> assertThat(((RejectedTaskException) e).getReason())
                            .isEqualTo(RejectionReason.SHUTDOWN));
        }

        @Test
        @DisplayName("non-blocking stop should return before a slow task finishes and still drain")
        void nonBlockingStopShouldReturnImmediately() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch finished = new CountDownLatch(2);
            executor.submit(() -> {
                release.await();
                finished.countDown();
            });
            executor.submit(finished::countDown);

            executor.stop(false);

            assertThat(executor.isShutdown()).isTrue();
            assertThat(finished.getCount()).isEqualTo(2);

            release.countDown();
            assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();

            executor.stop(true);
            assertThat(executor.isTerminated()).isTrue();
        }

        @Test
        @DisplayName("stop should be idempotent")
        void stopShouldBeIdempotent() {
            executor.submit(() -> { });
            executor.stop(true);
            executor.stop(true);
            executor.stop(false);

            assertThat(executor.isTerminated()).isTrue();
            assertThat(executor.getCompletedTaskCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("blocking stop from a task should not deadlock")
        void blockingStopFromWorkerShouldNotDeadlock() throws Exception {
            CountDownLatch stopped = new CountDownLatch(1);
            AtomicBoolean laterTaskRan = new AtomicBoolean(false);
            executor.submit(() -> {
                executor.stop(true);
                stopped.countDown();
            });

            assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
            assertThatThrownBy(() -> executor.submit(() -> laterTaskRan.set(true)))
                    .isInstanceOf(RejectedTaskException.class);

            executor.stop(true);
            assertThat(executor.isTerminated()).isTrue();
            assertThat(laterTaskRan).isFalse();
        }

        @Test
        @DisplayName("stop before start should terminate without running anything")
        void stopBeforeStart() {
            SerialExecutor idle = SerialExecutor.builder()
                    .name("idle")
                    .metricsRegistry(metricsRegistry)
                    .build();

            idle.stop(true);

            assertThat(idle.isTerminated()).isTrue();
        }
    }

    @Nested
    @DisplayName("halt")
    class Halt {

        @Test
        @DisplayName("should interrupt the running task and drop the queued ones")
        void shouldInterruptAndDrop() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean interrupted = new AtomicBoolean(false);
            AtomicBoolean queuedTaskRan = new AtomicBoolean(false);
            executor.submit(() -> {
                started.countDown();
                try {
                    new CountDownLatch(1).await();
                } catch (InterruptedException e) {
                    interrupted.set(true);
                }
            });
            executor.submit(() -> queuedTaskRan.set(true));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            executor.halt();

            executor.getTermination().get(5, TimeUnit.SECONDS);
            assertThat(executor.isTerminated()).isTrue();
            assertThat(interrupted).isTrue();
            assertThat(queuedTaskRan).isFalse();
            assertThatThrownBy(() -> executor.submit(() -> { }))
                    .isInstanceOf(RejectedTaskException.class);
        }

        @Test
        @DisplayName("should return while the running task is still busy")
        void shouldNotWaitForRunningTask() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            executor.submit(() -> {
                started.countDown();
                // Ignores interrupts until released
                while (release.getCount() > 0) {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        // keep waiting
                    }
                }
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            executor.halt();

            assertThat(executor.isShutdown()).isTrue();
            assertThat(executor.isTerminated()).isFalse();

            release.countDown();
            executor.getTermination().get(5, TimeUnit.SECONDS);
            assertThat(executor.isTerminated()).isTrue();
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        private double queueRemaining(String name) {
            return metricsRegistry.getRegistry().get("test_queue_remaining")
                    .tag("executor", name).gauge().value();
        }

        @Test
        @DisplayName("the queue gauge should survive garbage collection")
        void gaugeShouldSurviveGc() {
            assertThat(queueRemaining("test-queue")).isEqualTo(1024.0);

            System.gc();

            assertThat(queueRemaining("test-queue")).isEqualTo(1024.0);
        }

        @Test
        @DisplayName("an executor reusing a name should report through the same gauge")
        void gaugeShouldFollowLatestExecutor() {
            SerialExecutor first = SerialExecutor.builder()
                    .name("reused").ringBufferSize(8).metricsRegistry(metricsRegistry).build();
            first.stop(true);

            SerialExecutor second = SerialExecutor.builder()
                    .name("reused").ringBufferSize(16).metricsRegistry(metricsRegistry).build();
            try {
                assertThat(queueRemaining("reused")).isEqualTo(16.0);
            } finally {
                second.stop(true);
            }
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a throwing task should not stop later tasks")
        void throwingTaskShouldNotStallQueue() {
            AtomicBoolean laterTaskRan = new AtomicBoolean(false);
            executor.submit(() -> {
                throw new IllegalStateException("boom");
            });
            executor.submit(() -> laterTaskRan.set(true));

            executor.stop(true);

            assertThat(laterTaskRan).isTrue();
            assertThat(executor.getFailedTaskCount()).isEqualTo(1);
            assertThat(executor.getCompletedTaskCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject with QUEUE_FULL when the ring buffer has no free slot")
        void shouldRejectWhenFull() throws Exception {
            SerialExecutor small = SerialExecutor.builder()
                    .name("small")
                    .ringBufferSize(4)
                    .metricsRegistry(metricsRegistry)
                    .build()
                    .start();
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch started = new CountDownLatch(1);
            try {
                small.submit(() -> {
                    started.countDown();
                    release.await();
                });
                assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

                // The running task's slot is not released until it finishes
                for (int i = 0; i < 3; i++) {
                    small.submit(() -> { });
                }

                assertThatThrownBy(() -> small.submit(() -> { }))
                        .isInstanceOf(RejectedTaskException.class)
                        .satisfies(e -> assertThat(((RejectedTaskException) e).getReason())
                                .isEqualTo(RejectionReason.QUEUE_FULL));
            } finally {
                release.countDown();
                small.close();
            }
            assertThat(small.getCompletedTaskCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should refuse submissions before start")
        void shouldRefuseBeforeStart() {
            SerialExecutor notStarted = SerialExecutor.builder()
                    .name("not-started")
                    .metricsRegistry(metricsRegistry)
                    .build();
            try {
                assertThatThrownBy(() -> notStarted.submit(() -> { }))
                        .isInstanceOf(IllegalStateException.class);
            } finally {
                notStarted.close();
            }
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderValidation {

        @Test
        @DisplayName("should require a power of two ring buffer")
        void shouldRequirePowerOfTwo() {
            assertThatThrownBy(() -> SerialExecutor.builder().ringBufferSize(1000))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should require a metrics registry")
        void shouldRequireMetrics() {
            assertThatThrownBy(() -> SerialExecutor.builder().name("x").build())
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
