package fr.lapetina.neuraforge.domain.queue;

import fr.lapetina.neuraforge.domain.batch.Batch;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.executor.BatchOutput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BatchQueueTest {

    private static ModelHandle handle(String name) {
        ModelHandle handle = new ModelHandle(name, "v1", (h, input) -> BatchOutput.ofSegments(List.of()));
        handle.markReady();
        return handle;
    }

    @Nested
    @DisplayName("fifo")
    class Fifo {

        @Test
        @DisplayName("should hand out batches in seal order")
        void shouldKeepSealOrder() throws InterruptedException {
            BatchQueue queue = new FifoBatchQueue();
            ModelHandle a = handle("a");
            ModelHandle b = handle("b");
            Batch first = new Batch(a, 2);
            Batch second = new Batch(b, 2);
            Batch third = new Batch(a, 2);

            queue.offer(first);
            queue.offer(second);
            queue.offer(third);

            assertThat(queue.size()).isEqualTo(3);
            assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isSameAs(first);
            assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isSameAs(second);
            assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isSameAs(third);
        }

        @Test
        @DisplayName("should return null when nothing arrives before the timeout")
        void shouldTimeOut() throws InterruptedException {
            assertThat(new FifoBatchQueue().poll(10, TimeUnit.MILLISECONDS)).isNull();
        }
    }

    @Nested
    @DisplayName("round-robin")
    class RoundRobin {

        @Test
        @DisplayName("should alternate between models")
        void shouldAlternateModels() throws InterruptedException {
            BatchQueue queue = new RoundRobinBatchQueue();
            ModelHandle busy = handle("busy");
            ModelHandle quiet = handle("quiet");
            Batch busy1 = new Batch(busy, 1);
            Batch busy2 = new Batch(busy, 1);
            Batch busy3 = new Batch(busy, 1);
            Batch quiet1 = new Batch(quiet, 1);

            queue.offer(busy1);
            queue.offer(busy2);
            queue.offer(busy3);
            queue.offer(quiet1);

            List<Batch> order = new ArrayList<>();
            Batch next;
            while ((next = queue.poll(10, TimeUnit.MILLISECONDS)) != null) {
                order.add(next);
            }

            assertThat(order).containsExactly(busy1, quiet1, busy2, busy3);
        }

        @Test
        @DisplayName("should drain every lane")
        void shouldDrainAll() {
            BatchQueue queue = new RoundRobinBatchQueue();
            queue.offer(new Batch(handle("a"), 1));
            queue.offer(new Batch(handle("b"), 1));
            queue.offer(new Batch(handle("a"), 1));

            assertThat(queue.drain()).hasSize(3);
            assertThat(queue.size()).isZero();
        }
    }

    @Test
    @DisplayName("should create registered queues by name")
    void shouldCreateByName() {
        assertThat(BatchQueueFactory.create("FIFO")).get().isInstanceOf(FifoBatchQueue.class);
        assertThat(BatchQueueFactory.create("round-robin")).get().isInstanceOf(RoundRobinBatchQueue.class);
        assertThat(BatchQueueFactory.create("lottery")).isEmpty();
        assertThat(BatchQueueFactory.createOrDefault("lottery", FifoBatchQueue::new))
                .isInstanceOf(FifoBatchQueue.class);
    }
}
