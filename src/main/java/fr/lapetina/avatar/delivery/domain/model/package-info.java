/**
 * Domain model of the avatar delivery client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.avatar.delivery.domain.model.DeliveryRequest} - utterance to deliver, with its fingerprint</li>
 *   <li>{@link fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor} - immutable identity of one avatar backend</li>
 *   <li>{@link fr.lapetina.avatar.delivery.domain.model.AttemptOutcome} - classified result of one provider call</li>
 *   <li>{@link fr.lapetina.avatar.delivery.domain.model.DeliveryResult} - successful delivery, possibly served from cache</li>
 *   <li>{@link fr.lapetina.avatar.delivery.domain.model.HealthSnapshot} - read-only copy of a provider's health</li>
 *   <li>{@link fr.lapetina.avatar.delivery.domain.model.ErrorType} - error taxonomy and its handling policy</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything here is immutable. Mutable runtime state is owned by the
 * infrastructure components and exposed through snapshots.
 */
package fr.lapetina.avatar.delivery.domain.model;
