package fr.lapetina.neuraforge.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        SchedulerConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getBatching().getMaxBatchSize()).isEqualTo(4);
        assertThat(config.getBatching().getBatchTimeoutMs()).isEqualTo(20);
        assertThat(config.getWorkers().getCount()).isEqualTo(2);
        assertThat(config.getBufferPool().getSlotCapacity()).isEqualTo(4096);
        assertThat(config.getAdmission().getLimits()).containsEntry("limited", 3);
        assertThat(config.getDisruptor().getRingBufferSize()).isEqualTo(256);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("neuraforge_test");
    }

    @Test
    @DisplayName("should fill omitted sections with defaults")
    void shouldApplyDefaults() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        SchedulerConfig config = loader.loadFromStream(yaml("batching:\n  maxBatchSize: 16\n"));

        assertThat(config.getBatching().getMaxBatchSize()).isEqualTo(16);
        assertThat(config.getBatching().getBatchTimeoutMs()).isEqualTo(5);
        assertThat(config.getWorkers().getQueuePolicy()).isEqualTo("fifo");
        assertThat(config.getAdmission().getDefaultLimit()).isEqualTo(256);
        assertThat(loader.getCurrentConfig()).isSameAs(config);
    }

    @Test
    @DisplayName("should accept a zero batch timeout")
    void shouldAcceptZeroTimeout() {
        SchedulerConfig config = new ConfigLoader("unused.yaml")
                .loadFromStream(yaml("batching:\n  batchTimeoutMs: 0\n"));

        assertThat(config.getBatching().getBatchTimeoutMs()).isZero();
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("batching:\n  maxBatchSize: 0\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("batching.maxBatchSize");
        assertThatThrownBy(() -> loader.loadFromStream(yaml("workers:\n  queuePolicy: lottery\n")))
                .hasMessageContaining("workers.queuePolicy");
        assertThatThrownBy(() -> loader.loadFromStream(yaml("disruptor:\n  ringBufferSize: 1000\n")))
                .hasMessageContaining("power of 2");
        assertThatThrownBy(() -> loader.loadFromStream(yaml("admission:\n  limits:\n    bert: 0\n")))
                .hasMessageContaining("admission.limits.bert");
        assertThat(loader.getCurrentConfig()).isNull();
    }

    @Test
    @DisplayName("should reject malformed and missing files")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("batching: [1, 2")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should keep the current configuration and report a rejected reload")
    void shouldKeepConfigOnBadReload() throws IOException {
        Path file = tempDir.resolve("scheduler.yaml");
        Files.writeString(file, "batching:\n  maxBatchSize: 8\n  batchTimeoutMs: 10\n");
        ConfigLoader loader = new ConfigLoader(file.toString());
        List<SchedulerConfig> seen = new ArrayList<>();
        List<String> rejections = new ArrayList<>();
        loader.addListener(new ConfigChangeListener() {
            @Override
            public void onConfigChanged(SchedulerConfig oldConfig, SchedulerConfig newConfig) {
                seen.add(newConfig);
            }

            @Override
            public void onReloadRejected(String source, ConfigLoader.ConfigurationException error) {
                rejections.add(error.getMessage());
            }
        });
        SchedulerConfig first = loader.load();

        Files.writeString(file, "batching:\n  maxBatchSize: -1\n");
        SchedulerConfig afterBad = loader.reload();

        assertThat(afterBad).isSameAs(first);
        assertThat(loader.getCurrentConfig()).isSameAs(first);
        assertThat(rejections).hasSize(1);
        assertThat(rejections.get(0)).contains("batching.maxBatchSize");
        assertThat(loader.getRejectedReloads()).isEqualTo(1);

        Files.writeString(file, "batching:\n  maxBatchSize: 32\n  batchTimeoutMs: 10\n");
        SchedulerConfig afterGood = loader.reload();

        assertThat(afterGood.getBatching().getMaxBatchSize()).isEqualTo(32);
        assertThat(seen).containsExactly(first, afterGood);
        assertThat(rejections).hasSize(1);
        loader.close();
    }

    @Test
    @DisplayName("should throw from tryReload after reporting the rejection")
    void shouldThrowFromTryReload() throws IOException {
        Path file = tempDir.resolve("scheduler.yaml");
        Files.writeString(file, "workers:\n  count: 2\n");
        ConfigLoader loader = new ConfigLoader(file.toString());
        SchedulerConfig first = loader.load();

        Files.writeString(file, "workers: [unclosed\n");

        assertThatThrownBy(loader::tryReload)
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Malformed");
        assertThat(loader.getCurrentConfig()).isSameAs(first);
        assertThat(loader.getRejectedReloads()).isEqualTo(1);
        loader.close();
    }

    @Test
    @DisplayName("should reload from the watcher only when the file content changed")
    void shouldReloadOnlyChangedContent() throws IOException {
        Path file = tempDir.resolve("scheduler.yaml");
        String content = "batching:\n  maxBatchSize: 8\n";
        Files.writeString(file, content);
        ConfigLoader loader = new ConfigLoader(file.toString());
        List<SchedulerConfig> seen = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> seen.add(newConfig));
        loader.load();

        Files.writeString(file, content);
        assertThat(loader.reloadIfChanged()).isFalse();

        Files.writeString(file, "batching:\n  maxBatchSize: 12\n");
        assertThat(loader.reloadIfChanged()).isTrue();

        assertThat(seen).hasSize(2);
        assertThat(loader.getCurrentConfig().getBatching().getMaxBatchSize()).isEqualTo(12);
        assertThat(loader.reloadIfChanged()).isFalse();
        loader.close();
    }
}
