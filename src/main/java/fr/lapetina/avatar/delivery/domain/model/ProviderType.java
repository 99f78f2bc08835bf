package fr.lapetina.avatar.delivery.domain.model;

import java.util.Locale;

/**
 * Kind of avatar backend. Selects the wire adapter used for a provider.
 */
public enum ProviderType {
    DUIX,
    SENSE_AVATAR,
    AKOOL,
    LOCAL,
    MOCK;

    /**
     * Parses a configuration value such as {@code "sense-avatar"} or {@code "SENSE_AVATAR"}.
     */
    public static ProviderType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
