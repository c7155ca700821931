package fr.lapetina.neuraforge.domain.batch;

import fr.lapetina.neuraforge.domain.model.ErrorType;
import fr.lapetina.neuraforge.domain.model.InferenceRequest;
import fr.lapetina.neuraforge.domain.model.InferenceResult;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.executor.BatchOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchTest {

    private ModelHandle handle;

    @BeforeEach
    void setUp() {
        handle = new ModelHandle("bert", "v1", (h, input) -> BatchOutput.ofSegments(List.of()));
        handle.markReady();
    }

    private PendingRequest admit(int payloadSize) {
        handle.tryAdmit(100);
        return new PendingRequest(InferenceRequest.of("bert", new byte[payloadSize]), handle);
    }

    @Test
    @DisplayName("should keep insertion order and track payload bytes")
    void shouldKeepInsertionOrder() {
        Batch batch = new Batch(handle, 4);
        PendingRequest a = admit(10);
        PendingRequest b = admit(20);

        batch.add(a);
        batch.add(b);

        assertThat(batch.requests()).containsExactly(a, b);
        assertThat(batch.getPayloadBytes()).isEqualTo(30);
        assertThat(a.getBatchId()).isEqualTo(batch.getId());
        assertThat(batch.isFull()).isFalse();
    }

    @Test
    @DisplayName("should refuse requests beyond max size or after seal")
    void shouldRefuseWhenFullOrSealed() {
        Batch batch = new Batch(handle, 1);
        batch.add(admit(1));

        assertThat(batch.isFull()).isTrue();
        assertThatThrownBy(() -> batch.add(admit(1))).isInstanceOf(IllegalStateException.class);

        batch.seal(SealReason.SIZE);

        assertThat(batch.getState()).isEqualTo(BatchState.SEALED);
        assertThat(batch.getSealReason()).isEqualTo(SealReason.SIZE);
        assertThatThrownBy(() -> batch.seal(SealReason.TIMEOUT)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should drop cancelled requests when claimed for execution")
    void shouldDropCancelledOnClaim() {
        Batch batch = new Batch(handle, 4);
        PendingRequest a = admit(5);
        PendingRequest b = admit(7);
        PendingRequest c = admit(9);
        batch.add(a);
        batch.add(b);
        batch.add(c);
        batch.seal(SealReason.TIMEOUT);

        assertThat(b.tryCancel()).isTrue();
        b.fulfil(InferenceResult.error(b.getRequest(), ErrorType.CANCELLED, "cancelled"));

        List<PendingRequest> live = batch.claimForExecution();

        assertThat(live).containsExactly(a, c);
        assertThat(batch.getPayloadBytes()).isEqualTo(14);
        assertThat(a.getState()).isEqualTo(RequestState.EXECUTING);
        assertThat(a.tryCancel()).isFalse();
        assertThat(a.isCancelRequested()).isTrue();
    }

    @Test
    @DisplayName("should only remove requests while open")
    void shouldRemoveOnlyWhileOpen() {
        Batch batch = new Batch(handle, 4);
        PendingRequest a = admit(5);
        PendingRequest b = admit(5);
        batch.add(a);
        batch.add(b);

        assertThat(batch.remove(a)).isTrue();
        assertThat(batch.remove(a)).isFalse();

        batch.seal(SealReason.FLUSH);

        assertThat(batch.remove(b)).isFalse();
        assertThat(batch.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should finish exactly once")
    void shouldFinishOnce() {
        Batch batch = new Batch(handle, 2);
        batch.add(admit(1));
        batch.seal(SealReason.SIZE);

        assertThat(batch.finish(BatchState.COMPLETED)).isTrue();
        assertThat(batch.finish(BatchState.FAILED)).isFalse();
        assertThat(batch.getState()).isEqualTo(BatchState.COMPLETED);
    }

    @Test
    @DisplayName("should deliver a result and release the handle once")
    void shouldFulfilOnce() {
        PendingRequest pending = admit(3);
        assertThat(handle.getInFlightRequests()).isEqualTo(1);

        InferenceResult result = InferenceResult.error(pending.getRequest(), ErrorType.SHUTDOWN, "stop");
        assertThat(pending.fulfil(result)).isTrue();
        assertThat(pending.fulfil(result)).isFalse();

        assertThat(handle.getInFlightRequests()).isZero();
        assertThat(pending.getCompletion().join().errorType()).isEqualTo(ErrorType.SHUTDOWN);
        assertThat(pending.getState()).isEqualTo(RequestState.COMPLETED);
    }
}
