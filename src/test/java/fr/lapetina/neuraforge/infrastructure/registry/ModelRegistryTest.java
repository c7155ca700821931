package fr.lapetina.neuraforge.infrastructure.registry;

import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.domain.model.ModelState;
import fr.lapetina.neuraforge.executor.BackendException;
import fr.lapetina.neuraforge.executor.BatchInput;
import fr.lapetina.neuraforge.executor.BatchOutput;
import fr.lapetina.neuraforge.executor.ModelExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    private ModelRegistry registry;
    private List<ModelRegistry.RegistryEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry(Duration.ofSeconds(1));
        events = new CopyOnWriteArrayList<>();
        registry.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private static ModelExecutor executor() {
        return (handle, input) -> BatchOutput.ofSegments(List.of());
    }

    @Test
    @DisplayName("should load a model and serve it as Ready")
    void shouldLoadModel() {
        ModelHandle handle = registry.load("resnet50", "v1", executor());

        assertThat(handle.getState()).isEqualTo(ModelState.READY);
        assertThat(registry.lookup("resnet50")).contains(handle);
        assertThat(registry.lookup("resnet50", "v1")).contains(handle);
        assertThat(registry.lookup("resnet50", "v2")).isEmpty();
        assertThat(registry.lookup("unknown")).isEmpty();
        assertThat(events).extracting(ModelRegistry.RegistryEvent::type)
                .containsExactly(ModelRegistry.RegistryEvent.Type.LOADED);
    }

    @Test
    @DisplayName("should refuse to load a name that is already served")
    void shouldRefuseDuplicateLoad() {
        registry.load("resnet50", "v1", executor());

        assertThatThrownBy(() -> registry.load("resnet50", "v2", executor()))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("already loaded");
    }

    @Test
    @DisplayName("should not publish a model whose warm-up fails")
    void shouldNotPublishFailedLoad() {
        ModelExecutor failing = new ModelExecutor() {
            @Override
            public BatchOutput execute(ModelHandle handle, BatchInput input) {
                return BatchOutput.ofSegments(List.of());
            }

            @Override
            public void warmUp(ModelHandle handle) throws BackendException {
                throw new BackendException("weights missing");
            }
        };

        assertThatThrownBy(() -> registry.load("bert", "v1", failing))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("weights missing");

        assertThat(registry.lookup("bert")).isEmpty();
        assertThat(registry.size()).isZero();
        assertThat(events).extracting(ModelRegistry.RegistryEvent::type)
                .containsExactly(ModelRegistry.RegistryEvent.Type.LOAD_FAILED);
    }

    @Test
    @DisplayName("should keep the old version alive until its last request is released")
    void shouldDrainOldVersionOnSwap() throws Exception {
        AtomicInteger unloads = new AtomicInteger(0);
        ModelExecutor v1Executor = new ModelExecutor() {
            @Override
            public BatchOutput execute(ModelHandle handle, BatchInput input) {
                return BatchOutput.ofSegments(List.of());
            }

            @Override
            public void unload(ModelHandle handle) {
                unloads.incrementAndGet();
            }
        };
        ModelHandle v1 = registry.load("bert", "v1", v1Executor);
        assertThat(v1.tryAdmit(10)).isEqualTo(ModelHandle.Admission.ADMITTED);

        ModelHandle v2 = registry.swap("bert", "v2", executor());

        assertThat(registry.lookup("bert")).contains(v2);
        assertThat(v1.getState()).isEqualTo(ModelState.DRAINING);
        assertThat(registry.getRetiringModels()).containsExactly(v1);
        assertThat(unloads.get()).isZero();

        v1.release();
        v1.whenUnloaded().get(5, TimeUnit.SECONDS);

        assertThat(v1.getState()).isEqualTo(ModelState.UNLOADED);
        assertThat(unloads.get()).isEqualTo(1);
        assertThat(registry.getRetiringModels()).isEmpty();
        assertThat(events).extracting(ModelRegistry.RegistryEvent::type).containsExactly(
                ModelRegistry.RegistryEvent.Type.LOADED,
                ModelRegistry.RegistryEvent.Type.LOADED,
                ModelRegistry.RegistryEvent.Type.DRAINING,
                ModelRegistry.RegistryEvent.Type.UNLOADED);
    }

    @Test
    @DisplayName("should refuse to swap to the version already served")
    void shouldRefuseSameVersionSwap() {
        registry.load("bert", "v1", executor());

        assertThatThrownBy(() -> registry.swap("bert", "v1", executor()))
                .isInstanceOf(ModelLoadException.class);
        assertThatThrownBy(() -> registry.swap("gpt", "v1", executor()))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("not loaded");
    }

    @Test
    @DisplayName("should unload an idle model immediately")
    void shouldUnloadIdleModel() {
        registry.load("bert", "v1", executor());

        ModelHandle retired = registry.unload("bert");

        assertThat(retired.getState()).isEqualTo(ModelState.UNLOADED);
        assertThat(registry.lookup("bert")).isEmpty();
        assertThat(registry.size()).isZero();
        assertThatThrownBy(() -> registry.unload("bert")).isInstanceOf(ModelLoadException.class);
    }

    @Test
    @DisplayName("should unload every model on close")
    void shouldUnloadAllOnClose() {
        ModelHandle a = registry.load("a", "v1", executor());
        ModelHandle b = registry.load("b", "v1", executor());

        registry.close();

        assertThat(a.getState()).isEqualTo(ModelState.UNLOADED);
        assertThat(b.getState()).isEqualTo(ModelState.UNLOADED);
        assertThat(registry.size()).isZero();
    }
}
