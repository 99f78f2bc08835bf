package fr.lapetina.avatar.delivery.integration;

import fr.lapetina.avatar.delivery.AvatarClientFactory;
import fr.lapetina.avatar.delivery.testing.StubTransport;

/**
 * Factory wired from a config file but talking to a scripted transport.
 */
class TestAvatarClientFactory extends AvatarClientFactory {

    private final StubTransport stubTransport;

    private TestAvatarClientFactory(String configPath, StubTransport transport) {
        super(configPath, transport);
        this.stubTransport = transport;
    }

    static TestAvatarClientFactory create(String configPath, StubTransport transport) {
        return new TestAvatarClientFactory(configPath, transport);
    }

    StubTransport stub() {
        return stubTransport;
    }
}
