package fr.lapetina.neuraforge.integration;

import fr.lapetina.neuraforge.SchedulerFactory;
import fr.lapetina.neuraforge.domain.model.ModelHandle;

/**
 * Test extension of SchedulerFactory that serves stub backends.
 */
final class TestSchedulerFactory extends SchedulerFactory {

    private TestSchedulerFactory(String configPath) {
        super(configPath);
    }

    /**
     * Creates a started factory from the default test configuration.
     */
    public static TestSchedulerFactory create() {
        return create("test-config.yaml");
    }

    public static TestSchedulerFactory create(String configPath) {
        TestSchedulerFactory factory = new TestSchedulerFactory(configPath);
        factory.start();
        return factory;
    }

    /**
     * Loads a model served by the given stub.
     */
    ModelHandle loadStub(String name, String version, StubExecutor executor) {
        return getModelRegistry().load(name, version, executor);
    }
}
