/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML is bound onto {@link fr.lapetina.avatar.delivery.infrastructure.config.AvatarClientConfig}
 * with SnakeYAML. {@link fr.lapetina.avatar.delivery.infrastructure.config.ConfigLoader} watches
 * the file and notifies {@link fr.lapetina.avatar.delivery.infrastructure.config.ConfigChangeListener}s;
 * only the provider list is applied at runtime, every other section is read once at startup.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings</li>
 *   <li>{@code providers} - avatar backends and their capabilities</li>
 *   <li>{@code retry} - per-provider retry and backoff</li>
 *   <li>{@code health} - state machine thresholds, cooldown and probe loop</li>
 *   <li>{@code rateLimit} - default token bucket</li>
 *   <li>{@code cache} - response cache TTL and size</li>
 *   <li>{@code timeouts} - connect and per-attempt timeouts</li>
 *   <li>{@code validation} - request limits</li>
 *   <li>{@code events} - outcome ring buffer</li>
 *   <li>{@code metrics} - Prometheus metrics</li>
 * </ul>
 */
package fr.lapetina.avatar.delivery.infrastructure.config;
