package fr.lapetina.avatar.delivery;

import fr.lapetina.avatar.delivery.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the standalone avatar delivery service.
 */
public class AvatarDeliveryApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AvatarDeliveryApplication.class);

    private final AvatarClientFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public AvatarDeliveryApplication(String configPath) throws Exception {
        log.info("Starting Avatar Delivery service...");

        this.factory = AvatarClientFactory.create(configPath).start();

        this.httpServer = new HttpServer(
                factory.getConfig().getServer(),
                factory.getClient(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader()
        );

        log.info("Avatar Delivery service initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Avatar Delivery service started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public AvatarClientFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Avatar Delivery service...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Avatar Delivery service shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            AvatarDeliveryApplication app = new AvatarDeliveryApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Avatar Delivery service", e);
            System.exit(1);
        }
    }
}
