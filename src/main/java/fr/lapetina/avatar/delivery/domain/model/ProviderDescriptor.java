package fr.lapetina.avatar.delivery.domain.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static identity of one avatar backend.
 *
 * Immutable: a configuration reload builds new descriptors and replaces
 * the old ones wholesale. Runtime state (health, tokens, in-flight slots)
 * lives in the components that own it, keyed by {@link #getName()}.
 */
public final class ProviderDescriptor {

    private final String name;
    private final ProviderType type;
    private final URI baseUrl;
    private final String credentialRef;
    private final Set<String> supportedLanguages;
    private final Set<String> supportedEmotions;
    private final int priority;
    private final int maxConcurrent;
    private final int bucketCapacity;
    private final double refillPerSecond;
    private final boolean enabled;
    private final Map<String, String> metadata;

    private ProviderDescriptor(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Provider name is required");
        this.type = Objects.requireNonNull(builder.type, "Provider type is required");
        if (builder.baseUrl == null && type != ProviderType.MOCK) {
            throw new IllegalArgumentException("Base URL is required for provider: " + name);
        }
        this.baseUrl = builder.baseUrl;
        this.credentialRef = builder.credentialRef;
        this.supportedLanguages = normalize(builder.supportedLanguages);
        this.supportedEmotions = normalize(builder.supportedEmotions);
        this.priority = builder.priority;
        this.maxConcurrent = builder.maxConcurrent;
        this.bucketCapacity = builder.bucketCapacity;
        this.refillPerSecond = builder.refillPerSecond;
        this.enabled = builder.enabled;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    private static Set<String> normalize(Set<String> tags) {
        Set<String> copy = new TreeSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                copy.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    public String getName() {
        return name;
    }

    public ProviderType getType() {
        return type;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public String getCredentialRef() {
        return credentialRef;
    }

    public Set<String> getSupportedLanguages() {
        return supportedLanguages;
    }

    public Set<String> getSupportedEmotions() {
        return supportedEmotions;
    }

    /**
     * Static priority weight; higher values are preferred within a health tier.
     */
    public int getPriority() {
        return priority;
    }

    /**
     * Maximum concurrent in-flight deliveries, or 0 for no bound.
     */
    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Token bucket capacity override, or 0 to use the client default.
     */
    public int getBucketCapacity() {
        return bucketCapacity;
    }

    /**
     * Token refill rate override, or 0 to use the client default.
     */
    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String metadata(String key, String defaultValue) {
        return metadata.getOrDefault(key, defaultValue);
    }

    /**
     * An empty capability set means the provider accepts any tag.
     */
    public boolean supportsLanguage(String language) {
        return supports(supportedLanguages, language);
    }

    public boolean supportsEmotion(String emotion) {
        return supports(supportedEmotions, emotion);
    }

    private static boolean supports(Set<String> tags, String tag) {
        if (tags.isEmpty()) {
            return true;
        }
        if (tag == null) {
            return false;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        if (tags.contains(normalized)) {
            return true;
        }
        // "en-US" is served by a provider declaring "en"
        int dash = normalized.indexOf('-');
        return dash > 0 && tags.contains(normalized.substring(0, dash));
    }

    /**
     * Checks whether this provider is enabled and declares every capability the request needs.
     */
    public boolean canServe(DeliveryRequest request) {
        return enabled
                && supportsLanguage(request.language())
                && supportsEmotion(request.emotion());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderDescriptor that = (ProviderDescriptor) o;
        return priority == that.priority
                && maxConcurrent == that.maxConcurrent
                && bucketCapacity == that.bucketCapacity
                && Double.compare(refillPerSecond, that.refillPerSecond) == 0
                && enabled == that.enabled
                && name.equals(that.name)
                && type == that.type
                && Objects.equals(baseUrl, that.baseUrl)
                && Objects.equals(credentialRef, that.credentialRef)
                && supportedLanguages.equals(that.supportedLanguages)
                && supportedEmotions.equals(that.supportedEmotions)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, baseUrl);
    }

    @Override
    public String toString() {
        return "ProviderDescriptor{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", baseUrl=" + baseUrl +
                ", priority=" + priority +
                ", enabled=" + enabled +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private ProviderType type = ProviderType.LOCAL;
        private URI baseUrl;
        private String credentialRef;
        private final Set<String> supportedLanguages = new TreeSet<>();
        private final Set<String> supportedEmotions = new TreeSet<>();
        private int priority = 1;
        private int maxConcurrent;
        private int bucketCapacity;
        private double refillPerSecond;
        private boolean enabled = true;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(ProviderType type) {
            this.type = type;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = url != null ? URI.create(url) : null;
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder credentialRef(String credentialRef) {
            this.credentialRef = credentialRef;
            return this;
        }

        public Builder addLanguage(String language) {
            this.supportedLanguages.add(language);
            return this;
        }

        public Builder languages(Set<String> languages) {
            if (languages != null) {
                this.supportedLanguages.addAll(languages);
            }
            return this;
        }

        public Builder addEmotion(String emotion) {
            this.supportedEmotions.add(emotion);
            return this;
        }

        public Builder emotions(Set<String> emotions) {
            if (emotions != null) {
                this.supportedEmotions.addAll(emotions);
            }
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder bucketCapacity(int bucketCapacity) {
            this.bucketCapacity = bucketCapacity;
            return this;
        }

        public Builder refillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public ProviderDescriptor build() {
            return new ProviderDescriptor(this);
        }
    }
}
