package fr.lapetina.avatar.delivery.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from classpath or file system
 * - File watching for automatic reload
 * - Listener notification on changes
 *
 * A configuration that fails validation is rejected as a whole; on reload the
 * current configuration stays in place.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<AvatarClientConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(AvatarClientConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public AvatarClientConfig load() {
        AvatarClientConfig config = validate(loadFromPath());
        AvatarClientConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private AvatarClientConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private AvatarClientConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private AvatarClientConfig parse(InputStream is, String source) {
        try {
            AvatarClientConfig config = yaml.load(is);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in: " + source, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public AvatarClientConfig loadFromStream(InputStream inputStream) {
        AvatarClientConfig config = validate(parse(inputStream, "stream"));
        AvatarClientConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public AvatarClientConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce: editors fire several events per save
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload.
     */
    public AvatarClientConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(AvatarClientConfig oldConfig, AvatarClientConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Checks structural rules that YAML binding cannot express.
     *
     * @throws ConfigurationException on the first violation found
     */
    public static AvatarClientConfig validate(AvatarClientConfig config) {
        Set<String> names = new HashSet<>();
        for (AvatarClientConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getName() == null || provider.getName().isBlank()) {
                throw new ConfigurationException("Provider without a name");
            }
            if (!names.add(provider.getName())) {
                throw new ConfigurationException("Duplicate provider name: " + provider.getName());
            }
            try {
                provider.toDescriptor();
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigurationException("Invalid provider '" + provider.getName() + "': " + e.getMessage(), e);
            }
        }
        AvatarClientConfig.HealthConfig health = config.getHealth();
        if (health.getDegradedThreshold() < 1 || health.getUnhealthyThreshold() < 1 || health.getRecoveryThreshold() < 1) {
            throw new ConfigurationException("Health thresholds must be at least 1");
        }
        if (health.getCooldownBaseMs() <= 0 || health.getCooldownMaxMs() < health.getCooldownBaseMs()) {
            throw new ConfigurationException("Cooldown must satisfy 0 < cooldownBaseMs <= cooldownMaxMs");
        }
        if (config.getRetry().getMaxAttempts() < 1) {
            throw new ConfigurationException("retry.maxAttempts must be at least 1");
        }
        if (config.getRateLimit().getBucketCapacity() < 1 || config.getRateLimit().getRefillPerSecond() <= 0) {
            throw new ConfigurationException("rateLimit needs a positive capacity and refill rate");
        }
        if (config.getCache().getTtlMs() <= 0 || config.getCache().getMaxEntries() < 1) {
            throw new ConfigurationException("cache needs a positive ttlMs and maxEntries");
        }
        int ringSize = config.getEvents().getRingBufferSize();
        if (ringSize < 1 || Integer.bitCount(ringSize) != 1) {
            throw new ConfigurationException("events.ringBufferSize must be a power of 2");
        }
        return config;
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Creates a default configuration with no providers.
     */
    public static AvatarClientConfig createDefault() {
        return new AvatarClientConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
