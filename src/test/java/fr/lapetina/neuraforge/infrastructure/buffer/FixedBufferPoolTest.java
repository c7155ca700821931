package fr.lapetina.neuraforge.infrastructure.buffer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedBufferPoolTest {

    private FixedBufferPool pool;

    @BeforeEach
    void setUp() {
        pool = new FixedBufferPool(2, 64);
    }

    @Test
    @DisplayName("should lease distinct slots until exhausted")
    void shouldLeaseDistinctSlots() throws InterruptedException {
        BufferSlot a = pool.acquire(10);
        BufferSlot b = pool.acquire(10);

        assertThat(a).isNotSameAs(b);
        assertThat(a.getState()).isEqualTo(SlotState.LEASED);
        assertThat(pool.available()).isZero();
        assertThat(a.capacity()).isEqualTo(64);
    }

    @Test
    @DisplayName("should reject a size hint above slot capacity")
    void shouldRejectOversize() {
        assertThatThrownBy(() -> pool.acquire(65))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds slot capacity");
        assertThat(pool.available()).isEqualTo(2);
    }

    @Test
    @DisplayName("should block while exhausted and resume on release")
    void shouldBlockUntilRelease() throws Exception {
        BufferSlot a = pool.acquire(1);
        pool.acquire(1);

        CompletableFuture<BufferSlot> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return pool.acquire(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        assertThatThrownBy(() -> waiter.get(100, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);

        pool.release(a);

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isSameAs(a);
    }

    @Test
    @DisplayName("should fail loudly on a double release")
    void shouldRejectDoubleRelease() throws InterruptedException {
        BufferSlot slot = pool.acquire(1);
        pool.release(slot);

        assertThatThrownBy(() -> pool.release(slot))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("released twice");
        assertThat(pool.available()).isEqualTo(2);
    }

    @Test
    @DisplayName("should refuse a slot from another pool")
    void shouldRejectForeignSlot() throws InterruptedException {
        BufferSlot foreign = new FixedBufferPool(1, 8).acquire(1);

        assertThatThrownBy(() -> pool.release(foreign))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should hand out zeroed memory after reuse")
    void shouldWipeOnRelease() throws InterruptedException {
        FixedBufferPool single = new FixedBufferPool(1, 16, true);
        BufferSlot slot = single.acquire(16);
        slot.assignOwner(42);
        ByteBuffer buffer = slot.buffer();
        for (int i = 0; i < 16; i++) {
            buffer.put((byte) 0x7f);
        }
        single.release(slot);

        BufferSlot again = single.acquire(16);
        ByteBuffer reused = again.buffer();

        assertThat(again.getOwnerBatchId()).isEqualTo(-1);
        assertThat(again.getLeaseCount()).isEqualTo(2);
        for (int i = 0; i < 16; i++) {
            assertThat(reused.get(i)).isZero();
        }
    }

    @Test
    @DisplayName("should refuse buffer access on a free slot")
    void shouldGuardFreeSlot() throws InterruptedException {
        BufferSlot slot = pool.acquire(1);
        pool.release(slot);

        assertThatThrownBy(slot::buffer).isInstanceOf(IllegalStateException.class);
    }
}
