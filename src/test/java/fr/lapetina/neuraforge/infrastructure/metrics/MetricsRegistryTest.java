package fr.lapetina.neuraforge.infrastructure.metrics;

import fr.lapetina.neuraforge.domain.batch.SealReason;
import fr.lapetina.neuraforge.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test", false);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count outcomes per model, with null meaning success")
    void shouldCountOutcomes() {
        metrics.recordOutcome("bert", null);
        metrics.recordOutcome("bert", null);
        metrics.recordOutcome("bert", ErrorType.REJECTED_OVERLOAD);

        assertThat(metrics.getRegistry().get("test_requests_total")
                .tags("model", "bert", "outcome", "SUCCESS").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("test_requests_total")
                .tags("model", "bert", "outcome", "REJECTED_OVERLOAD").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record batch sizes and seal reasons")
    void shouldRecordSealedBatches() {
        metrics.recordBatchSealed("bert", 4, SealReason.SIZE);
        metrics.recordBatchSealed("bert", 1, SealReason.TIMEOUT);

        assertThat(metrics.getRegistry().get("test_batch_size").tag("model", "bert").summary().count())
                .isEqualTo(2);
        assertThat(metrics.getRegistry().get("test_batches_sealed_total")
                .tags("model", "bert", "reason", "SIZE").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should time executions by status")
    void shouldTimeExecutions() {
        metrics.recordExecution("bert", Duration.ofMillis(5), true);
        metrics.recordExecution("bert", Duration.ofMillis(7), false);

        assertThat(metrics.getRegistry().get("test_batch_execution")
                .tags("model", "bert", "status", "failed").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should sample registered gauges on scrape")
    void shouldExposeGauges() {
        AtomicInteger depth = new AtomicInteger(3);
        metrics.registerGauge("ready_queue_depth", "depth", depth::get);

        assertThat(metrics.scrape()).contains("test_ready_queue_depth 3.0");
    }
}
