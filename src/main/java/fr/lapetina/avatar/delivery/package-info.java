/**
 * Avatar delivery client - resilient delivery of generated utterances to avatar "speak" providers.
 *
 * <p>Several interchangeable, independently unreliable providers (DUIX, SenseAvatar, Akool,
 * a local renderer) sit behind one façade that selects, rate limits, retries and fails over
 * without letting a degraded provider drag the others down.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.avatar.delivery.AvatarClient} - The {@code speak} façade</li>
 *   <li>{@link fr.lapetina.avatar.delivery.AvatarClientFactory} - Wires a client from YAML configuration</li>
 *   <li>{@link fr.lapetina.avatar.delivery.AvatarDeliveryApplication} - Standalone HTTP service</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (AvatarClientFactory factory = AvatarClientFactory.create("config.yaml").start()) {
 *     AvatarClient client = factory.getClient();
 *
 *     DeliveryRequest request = DeliveryRequest.builder()
 *             .text("What a goal!")
 *             .emotion("excited")
 *             .language("en")
 *             .timeout(Duration.ofSeconds(5))
 *             .build();
 *
 *     DeliveryResult result = client.speak(request);
 *     System.out.println(result.providerUsed() + " -> " + result.mediaReference());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Health-tiered provider selection with canary re-admission</li>
 *   <li>Bounded retries with full-jitter exponential backoff</li>
 *   <li>Per-provider token buckets and concurrency bounds</li>
 *   <li>Short-lived response cache keyed by request fingerprint</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.avatar.delivery.AvatarClient
 * @see fr.lapetina.avatar.delivery.disruptor.DeliveryEventBus
 */
package fr.lapetina.avatar.delivery;
