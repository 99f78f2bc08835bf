package fr.lapetina.avatar.delivery.infrastructure.health;

import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Registry of live provider descriptors.
 *
 * Readers see an immutable map that is swapped atomically; writers are
 * serialized. Descriptors are never mutated, an update replaces the
 * descriptor under the same name. Listeners (health monitor, rate limiter)
 * reconcile their per-provider state from the emitted events.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final AtomicReference<Map<String, ProviderDescriptor>> providers =
            new AtomicReference<>(Map.of());
    private final List<Consumer<ProviderRegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    /**
     * Registers a new provider or replaces the descriptor of an existing one.
     */
    public void register(ProviderDescriptor descriptor) {
        ProviderRegistryEvent event;
        synchronized (writeLock) {
            Map<String, ProviderDescriptor> next = new LinkedHashMap<>(providers.get());
            ProviderDescriptor previous = next.put(descriptor.getName(), descriptor);
            providers.set(Collections.unmodifiableMap(next));
            event = eventFor(previous, descriptor);
        }
        if (event != null) {
            logEvent(event);
            notifyListeners(event);
        }
    }

    /**
     * Removes a provider by name.
     */
    public Optional<ProviderDescriptor> remove(String name) {
        ProviderDescriptor removed;
        synchronized (writeLock) {
            Map<String, ProviderDescriptor> next = new LinkedHashMap<>(providers.get());
            removed = next.remove(name);
            providers.set(Collections.unmodifiableMap(next));
        }
        if (removed != null) {
            ProviderRegistryEvent event = new ProviderRegistryEvent(ProviderRegistryEvent.Type.REMOVED, removed, removed);
            logEvent(event);
            notifyListeners(event);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ProviderDescriptor> get(String name) {
        return Optional.ofNullable(providers.get().get(name));
    }

    /**
     * All registered providers in registration order.
     */
    public List<ProviderDescriptor> getProviders() {
        return List.copyOf(providers.get().values());
    }

    public List<ProviderDescriptor> getEnabledProviders() {
        return providers.get().values().stream()
                .filter(ProviderDescriptor::isEnabled)
                .toList();
    }

    /**
     * Replaces the whole provider set, as done on configuration reload.
     *
     * Providers whose name persists keep their runtime state; unchanged
     * descriptors emit no event.
     *
     * @throws IllegalArgumentException if two descriptors share a name
     */
    public void replaceAll(Collection<ProviderDescriptor> newProviders) {
        Map<String, ProviderDescriptor> next = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : newProviders) {
            if (next.putIfAbsent(descriptor.getName(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate provider name: " + descriptor.getName());
            }
        }

        List<ProviderRegistryEvent> events = new ArrayList<>();
        synchronized (writeLock) {
            Map<String, ProviderDescriptor> current = providers.get();
            for (ProviderDescriptor descriptor : next.values()) {
                ProviderRegistryEvent event = eventFor(current.get(descriptor.getName()), descriptor);
                if (event != null) {
                    events.add(event);
                }
            }
            for (ProviderDescriptor existing : current.values()) {
                if (!next.containsKey(existing.getName())) {
                    events.add(new ProviderRegistryEvent(ProviderRegistryEvent.Type.REMOVED, existing, existing));
                }
            }
            providers.set(Collections.unmodifiableMap(next));
        }

        for (ProviderRegistryEvent event : events) {
            logEvent(event);
            notifyListeners(event);
        }
        log.info("Provider registry replaced: {} providers, {} changes", next.size(), events.size());
    }

    private static ProviderRegistryEvent eventFor(ProviderDescriptor previous, ProviderDescriptor current) {
        if (previous == null) {
            return new ProviderRegistryEvent(ProviderRegistryEvent.Type.ADDED, current, null);
        }
        if (!previous.equals(current)) {
            return new ProviderRegistryEvent(ProviderRegistryEvent.Type.UPDATED, current, previous);
        }
        return null;
    }

    private static void logEvent(ProviderRegistryEvent event) {
        switch (event.type()) {
            case ADDED -> log.info("Provider registered: {}", event.descriptor());
            case UPDATED -> log.info("Provider updated: {}", event.descriptor());
            case REMOVED -> log.info("Provider removed: {}", event.descriptor());
        }
    }

    public void addListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ProviderRegistryEvent event) {
        for (Consumer<ProviderRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    public int size() {
        return providers.get().size();
    }

    /**
     * Event for provider registry changes.
     *
     * @param previous the replaced descriptor for UPDATED, the removed one for REMOVED, null for ADDED
     */
    public record ProviderRegistryEvent(Type type, ProviderDescriptor descriptor, ProviderDescriptor previous) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }

        public String name() {
            return descriptor.getName();
        }
    }
}
