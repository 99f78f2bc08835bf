/**
 * Provider selection and failover ordering.
 *
 * <p>{@link fr.lapetina.avatar.delivery.domain.selection.ProviderSelector} turns the live
 * provider set into an ordered candidate list for one request. The default
 * {@link fr.lapetina.avatar.delivery.domain.selection.HealthTieredSelector} ranks by health
 * tier, then priority, and spreads load across equally ranked providers.
 */
package fr.lapetina.avatar.delivery.domain.selection;
