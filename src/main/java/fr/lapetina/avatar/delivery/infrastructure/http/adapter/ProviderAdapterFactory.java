package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a provider type to its adapter.
 */
public final class ProviderAdapterFactory {

    private final Map<ProviderType, ProviderAdapter> adapters = new EnumMap<>(ProviderType.class);

    public ProviderAdapterFactory() {
        for (ProviderType type : ProviderType.values()) {
            adapters.put(type, create(type));
        }
    }

    /**
     * Creates the adapter for a type.
     */
    public static ProviderAdapter create(ProviderType type) {
        return switch (type) {
            case DUIX -> new DuixAdapter();
            case SENSE_AVATAR -> new SenseAvatarAdapter();
            case AKOOL -> new AkoolAdapter();
            case LOCAL -> new LocalAdapter();
            case MOCK -> new MockAdapter();
        };
    }

    public ProviderAdapter forType(ProviderType type) {
        return adapters.get(type);
    }
}
