package fr.lapetina.avatar.delivery.domain.selection;

import fr.lapetina.avatar.delivery.domain.exception.NoAvailableProviderException;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.HealthState;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthMonitor;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Failover ordering by health tier, then priority, then round-robin.
 *
 * <ol>
 *   <li>Providers that are disabled or lack a capability the request needs are dropped.</li>
 *   <li>HEALTHY providers come before DEGRADED ones.</li>
 *   <li>Within a tier, higher priority comes first.</li>
 *   <li>Providers sharing tier and priority are rotated by a shared counter.</li>
 *   <li>UNHEALTHY providers are left out, except at most one whose cooldown has
 *       elapsed and whose canary claim succeeds; it is appended last.</li>
 * </ol>
 *
 * Thread-safe via atomic counter; health is read through the monitor's own
 * per-provider synchronization.
 */
public final class HealthTieredSelector implements ProviderSelector {

    private static final Logger log = LoggerFactory.getLogger(HealthTieredSelector.class);

    private static final Comparator<ProviderCandidate> RANKING =
            Comparator.<ProviderCandidate>comparingInt(c -> c.state().selectionTier())
                    .thenComparing(c -> c.descriptor().getPriority(), Comparator.reverseOrder());

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final AtomicLong rotation = new AtomicLong();

    public HealthTieredSelector(ProviderRegistry registry, HealthMonitor healthMonitor) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
    }

    @Override
    public String getName() {
        return "health-tiered";
    }

    @Override
    public List<ProviderCandidate> candidates(DeliveryRequest request) {
        List<ProviderDescriptor> capable = new ArrayList<>();
        for (ProviderDescriptor descriptor : registry.getProviders()) {
            if (descriptor.canServe(request)) {
                capable.add(descriptor);
            }
        }
        if (capable.isEmpty()) {
            throw new NoAvailableProviderException(
                    "No provider supports language=" + request.language() + ", emotion=" + request.emotion());
        }

        List<ProviderCandidate> ranked = new ArrayList<>();
        ProviderCandidate canary = null;
        int excluded = 0;

        for (ProviderDescriptor descriptor : capable) {
            HealthState state = healthMonitor.stateOf(descriptor.getName());
            if (state != HealthState.UNHEALTHY) {
                ranked.add(new ProviderCandidate(descriptor, state, false));
            } else if (canary == null && healthMonitor.tryClaimCanary(descriptor.getName())) {
                canary = new ProviderCandidate(descriptor, state, true);
            } else {
                excluded++;
            }
        }

        ranked.sort(RANKING);
        rotateEqualGroups(ranked, rotation.getAndIncrement());

        if (canary != null) {
            ranked.add(canary);
            log.info("Canary candidate offered: requestId={}, provider={}", request.requestId(), canary.name());
        }

        if (ranked.isEmpty()) {
            throw new NoAvailableProviderException(
                    "All " + excluded + " capable providers are unhealthy and cooling down");
        }

        if (log.isDebugEnabled()) {
            log.debug("Candidates built: requestId={}, order={}, excludedUnhealthy={}",
                    request.requestId(), ranked.stream().map(ProviderCandidate::name).toList(), excluded);
        }
        return ranked;
    }

    /**
     * Rotates every run of candidates that share tier and priority by the same offset.
     */
    static void rotateEqualGroups(List<ProviderCandidate> ranked, long counter) {
        int start = 0;
        while (start < ranked.size()) {
            int end = start + 1;
            while (end < ranked.size() && RANKING.compare(ranked.get(start), ranked.get(end)) == 0) {
                end++;
            }
            int size = end - start;
            if (size > 1) {
                Collections.rotate(ranked.subList(start, end), -(int) (counter % size));
            }
            start = end;
        }
    }
}
