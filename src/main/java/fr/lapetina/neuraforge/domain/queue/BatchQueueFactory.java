package fr.lapetina.neuraforge.domain.queue;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Creates ready queues by policy name.
 */
public final class BatchQueueFactory {

    private static final Map<String, Supplier<BatchQueue>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("fifo", FifoBatchQueue::new);
        register("round-robin", RoundRobinBatchQueue::new);
    }

    private BatchQueueFactory() {
        // Utility class
    }

    /**
     * Registers a custom queue policy.
     *
     * @param name Policy name (used in configuration)
     * @param supplier Factory for creating queue instances
     */
    public static void register(String name, Supplier<BatchQueue> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    public static Optional<BatchQueue> create(String name) {
        Supplier<BatchQueue> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static BatchQueue createOrDefault(String name, Supplier<BatchQueue> defaultQueue) {
        return create(name).orElseGet(defaultQueue);
    }

    /**
     * Returns all registered policy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
