/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing and runtime configuration updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.neuraforge.infrastructure.config.SchedulerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.neuraforge.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.neuraforge.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Only the batching thresholds and admission limits are applied to a running scheduler.
 * Pool size, slot capacity, worker count and ring buffer size take effect on restart.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code batching} - Max batch size and batch timeout</li>
 *   <li>{@code workers} - Worker count, ready queue policy, shutdown timeout</li>
 *   <li>{@code bufferPool} - Staging slot count and capacity</li>
 *   <li>{@code admission} - Per-model in-flight request limits</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code server} - Admin HTTP server settings</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.neuraforge.infrastructure.config.SchedulerConfig
 * @see fr.lapetina.neuraforge.infrastructure.config.ConfigLoader
 */
package fr.lapetina.neuraforge.infrastructure.config;
