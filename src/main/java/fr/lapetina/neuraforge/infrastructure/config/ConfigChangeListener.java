package fr.lapetina.neuraforge.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when a validated configuration has become current.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(SchedulerConfig oldConfig, SchedulerConfig newConfig);

    /**
     * Called when a reload was refused. The previous configuration is still current.
     *
     * @param source The file or resource that was read
     * @param error Why the content could not be used
     */
    default void onReloadRejected(String source, ConfigLoader.ConfigurationException error) {
    }
}
