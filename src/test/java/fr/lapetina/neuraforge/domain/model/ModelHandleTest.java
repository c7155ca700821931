package fr.lapetina.neuraforge.domain.model;

import fr.lapetina.neuraforge.executor.BatchOutput;
import fr.lapetina.neuraforge.executor.ModelExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelHandleTest {

    private static final ModelExecutor EXECUTOR = (handle, input) -> BatchOutput.ofSegments(List.of());

    private final AtomicInteger unloadCalls = new AtomicInteger(0);
    private ModelHandle handle;

    @BeforeEach
    void setUp() {
        handle = new ModelHandle("resnet50", "v1", EXECUTOR, h -> unloadCalls.incrementAndGet());
    }

    @Test
    @DisplayName("should start in LOADING and refuse admission")
    void shouldStartLoading() {
        assertThat(handle.getState()).isEqualTo(ModelState.LOADING);
        assertThat(handle.getId()).isEqualTo("resnet50:v1");
        assertThat(handle.tryAdmit(10)).isEqualTo(ModelHandle.Admission.NOT_READY);
        assertThat(handle.getInFlightRequests()).isZero();
    }

    @Test
    @DisplayName("should become READY only from LOADING")
    void shouldBecomeReadyOnce() {
        assertThat(handle.markReady()).isTrue();
        assertThat(handle.isReady()).isTrue();
        assertThat(handle.getReadyAt()).isNotNull();

        assertThat(handle.markReady()).isFalse();
    }

    @Nested
    @DisplayName("admission")
    class Admission {

        @BeforeEach
        void ready() {
            handle.markReady();
        }

        @Test
        @DisplayName("should admit up to the limit then report overload")
        void shouldEnforceLimit() {
            assertThat(handle.tryAdmit(2)).isEqualTo(ModelHandle.Admission.ADMITTED);
            assertThat(handle.tryAdmit(2)).isEqualTo(ModelHandle.Admission.ADMITTED);
            assertThat(handle.tryAdmit(2)).isEqualTo(ModelHandle.Admission.OVERLOADED);

            handle.release();

            assertThat(handle.tryAdmit(2)).isEqualTo(ModelHandle.Admission.ADMITTED);
            assertThat(handle.getAdmittedTotal()).isEqualTo(3);
        }

        @Test
        @DisplayName("should count the limit across versions sharing a model name")
        void shouldShareLimitAcrossVersions() {
            AdmissionCounter counter = new AdmissionCounter("bert");
            ModelHandle v1 = new ModelHandle("bert", "v1", EXECUTOR, counter, null);
            ModelHandle v2 = new ModelHandle("bert", "v2", EXECUTOR, counter, null);
            v1.markReady();
            v2.markReady();

            assertThat(v1.tryAdmit(2)).isEqualTo(ModelHandle.Admission.ADMITTED);
            assertThat(v1.tryAdmit(2)).isEqualTo(ModelHandle.Admission.ADMITTED);
            v1.markDraining();

            assertThat(v2.tryAdmit(2)).isEqualTo(ModelHandle.Admission.OVERLOADED);
            assertThat(v2.getInFlightRequests()).isZero();

            v1.release();

            assertThat(v2.tryAdmit(2)).isEqualTo(ModelHandle.Admission.ADMITTED);
            assertThat(counter.getPending()).isEqualTo(2);
        }

        @Test
        @DisplayName("should refuse a counter of another model")
        void shouldRefuseForeignCounter() {
            assertThatThrownBy(() -> new ModelHandle("bert", "v1", EXECUTOR, new AdmissionCounter("gpt"), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("gpt");
        }

        @Test
        @DisplayName("should reject a release without admission")
        void shouldRejectUnbalancedRelease() {
            assertThatThrownBy(() -> handle.release())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should keep counts consistent under concurrent admit and release")
        void shouldBeThreadSafe() throws InterruptedException {
            int threads = 8;
            int iterations = 1000;
            CountDownLatch latch = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            AtomicInteger admitted = new AtomicInteger(0);

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < iterations; i++) {
                            if (handle.tryAdmit(4) == ModelHandle.Admission.ADMITTED) {
                                admitted.incrementAndGet();
                                Thread.yield();
                                handle.release();
                            }
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(handle.getInFlightRequests()).isZero();
            assertThat(handle.getAdmittedTotal()).isEqualTo(admitted.get());
        }
    }

    @Nested
    @DisplayName("draining")
    class Draining {

        @BeforeEach
        void ready() {
            handle.markReady();
        }

        @Test
        @DisplayName("should refuse new admissions once draining")
        void shouldRefuseAdmissionWhileDraining() {
            handle.tryAdmit(10);

            assertThat(handle.markDraining()).isTrue();

            assertThat(handle.getState()).isEqualTo(ModelState.DRAINING);
            assertThat(handle.tryAdmit(10)).isEqualTo(ModelHandle.Admission.NOT_READY);
        }

        @Test
        @DisplayName("should unload on the release that empties it")
        void shouldUnloadOnLastRelease() {
            handle.tryAdmit(10);
            handle.tryAdmit(10);
            handle.markDraining();

            assertThat(handle.unloadIfIdle()).isFalse();
            handle.release();
            assertThat(handle.getState()).isEqualTo(ModelState.DRAINING);
            assertThat(handle.whenUnloaded()).isNotDone();

            handle.release();

            assertThat(handle.getState()).isEqualTo(ModelState.UNLOADED);
            assertThat(handle.whenUnloaded()).isDone();
            assertThat(unloadCalls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should unload immediately when idle")
        void shouldUnloadWhenIdle() {
            handle.markDraining();

            assertThat(handle.unloadIfIdle()).isTrue();
            assertThat(handle.unloadIfIdle()).isFalse();

            assertThat(handle.getState()).isEqualTo(ModelState.UNLOADED);
            assertThat(unloadCalls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not drain a handle that is not ready")
        void shouldNotDrainTwice() {
            assertThat(handle.markDraining()).isTrue();
            assertThat(handle.markDraining()).isFalse();
        }
    }

    @Test
    @DisplayName("should end UNLOADED without calling the listener when loading fails")
    void shouldFailLoad() {
        handle.markLoadFailed();

        assertThat(handle.getState()).isEqualTo(ModelState.UNLOADED);
        assertThat(handle.whenUnloaded()).isDone();
        assertThat(unloadCalls.get()).isZero();
        assertThat(handle.markReady()).isFalse();
    }
}
