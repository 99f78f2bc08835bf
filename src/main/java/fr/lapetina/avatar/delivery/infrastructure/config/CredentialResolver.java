package fr.lapetina.avatar.delivery.infrastructure.config;

import java.util.Map;
import java.util.function.Function;

/**
 * Turns a provider's credential reference into the secret sent on the wire.
 *
 * <ul>
 *   <li>{@code env:NAME} reads environment variable {@code NAME}</li>
 *   <li>any other non-blank value is used literally</li>
 *   <li>null or blank means the provider needs no credential</li>
 * </ul>
 */
public final class CredentialResolver {

    private static final String ENV_PREFIX = "env:";

    private final Function<String, String> environment;

    public CredentialResolver() {
        this(System::getenv);
    }

    public CredentialResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    public static CredentialResolver fromMap(Map<String, String> values) {
        return new CredentialResolver(values::get);
    }

    /**
     * @return the secret, or null when the reference is empty or the variable is unset
     */
    public String resolve(String credentialRef) {
        if (credentialRef == null || credentialRef.isBlank()) {
            return null;
        }
        if (credentialRef.startsWith(ENV_PREFIX)) {
            String value = environment.apply(credentialRef.substring(ENV_PREFIX.length()));
            return value == null || value.isBlank() ? null : value;
        }
        return credentialRef;
    }
}
