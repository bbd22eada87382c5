package com.drover.core.escalation;

import com.drover.core.agents.AgentRegistry;
import com.drover.core.events.DroverEvent;
import com.drover.core.events.EventBus;
import com.drover.core.metrics.DroverMetrics;
import com.drover.core.model.Escalation;
import com.drover.core.model.EscalationStatus;
import com.drover.core.model.EscalationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory store of escalations and the gate between a suspended branch and a human choice.
 * <p>
 * Each escalation is resolved exactly once. Resolution runs the hook registered by whoever raised
 * it, which resumes or redirects the suspended branch. Escalations whose mission is cancelled are
 * discarded instead. Closed escalations beyond {@code drover.escalation.max-retained} are evicted,
 * oldest first. Nothing here survives a restart.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    private final EscalationProperties properties;
    private final AgentRegistry agentRegistry;
    private final EventBus eventBus;
    private final DroverMetrics metrics;

    private final Map<String, Escalation> escalations = new ConcurrentHashMap<>();
    private final Map<String, Consumer<Escalation>> resumeHooks = new ConcurrentHashMap<>();

    public EscalationService(EscalationProperties properties,
                             @Autowired(required = false) AgentRegistry agentRegistry,
                             EventBus eventBus,
                             @Autowired(required = false) DroverMetrics metrics) {
        this.properties = properties;
        this.agentRegistry = agentRegistry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Raises an escalation that no scheduler branch waits on.
     */
    public Escalation requestEscalation(String missionId, String reason, String findingsSoFar) {
        return requestEscalation(missionId, null, reason, findingsSoFar, null);
    }

    /**
     * Raises an escalation for a suspended task.
     *
     * @param onResolved called once, on the resolving thread, with the resolved escalation
     */
    public Escalation requestEscalation(String missionId, String taskId, String reason, String findingsSoFar,
                                        Consumer<Escalation> onResolved) {
        var escalation = new Escalation(UUID.randomUUID().toString().substring(0, 12), missionId, taskId,
                reason, findingsSoFar == null ? "" : findingsSoFar, currentTargets(), EscalationStatus.PENDING,
                null, Instant.now());
        escalations.put(escalation.id(), escalation);
        if (onResolved != null) {
            resumeHooks.put(escalation.id(), onResolved);
        }
        log.info("Escalation {} raised for mission {} task {}: {}", escalation.id(), missionId, taskId, reason);
        eventBus.publish(DroverEvent.of("escalation.requested", missionId, taskId,
                Map.of("escalation_id", escalation.id(), "reason", String.valueOf(reason))));
        if (metrics != null) {
            metrics.incrementEscalations("requested");
        }
        return escalation;
    }

    /**
     * Resolves a pending escalation with one of its targets.
     *
     * @throws EscalationNotFoundException if the id is unknown, already resolved or discarded
     * @throws IllegalArgumentException    if the target is unknown or currently unavailable
     */
    public Escalation resolveEscalation(String escalationId, String targetKey) {
        Escalation resolved;
        synchronized (this) {
            Escalation escalation = escalations.get(escalationId);
            if (escalation == null) {
                throw new EscalationNotFoundException(escalationId, false);
            }
            if (escalation.status() == EscalationStatus.RESOLVED) {
                throw new EscalationNotFoundException(escalationId, true);
            }
            if (escalation.status() == EscalationStatus.DISCARDED) {
                throw EscalationNotFoundException.discarded(escalationId);
            }
            EscalationTarget target = escalation.target(targetKey)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown escalation target: " + targetKey));
            if (!isAvailable(targetKey)) {
                throw new IllegalArgumentException("Escalation target not available: " + target.label());
            }
            resolved = escalation.resolve(targetKey);
            escalations.put(escalationId, resolved);
            evictClosed();
        }

        log.info("Escalation {} resolved with target {}", escalationId, targetKey);
        eventBus.publish(DroverEvent.of("escalation.resolved", resolved.missionId(), resolved.taskId(),
                Map.of("escalation_id", escalationId, "target", targetKey)));
        if (metrics != null) {
            metrics.incrementEscalations("resolved");
        }
        Consumer<Escalation> hook = resumeHooks.remove(escalationId);
        if (hook != null) {
            try {
                hook.accept(resolved);
            } catch (Exception e) {
                log.error("Resume hook for escalation {} failed: {}", escalationId, e.getMessage(), e);
            }
        }
        return resolved;
    }

    /**
     * Agent a resolved target redirects work to, if the target is bound to one.
     */
    public Optional<String> redirectAgent(String targetKey) {
        return properties.getTargets().stream()
                .filter(t -> t.getKey().equals(targetKey))
                .map(EscalationProperties.Target::getAgentId)
                .filter(id -> id != null && !id.isBlank())
                .findFirst();
    }

    public Optional<Escalation> get(String escalationId) {
        return Optional.ofNullable(escalations.get(escalationId));
    }

    public List<Escalation> pending() {
        return escalations.values().stream()
                .filter(e -> e.status() == EscalationStatus.PENDING)
                .sorted(Comparator.comparing(Escalation::createdAt))
                .toList();
    }

    /**
     * Discards the pending escalations of a mission whose branches no longer wait, e.g. after
     * cancellation. Their hooks are dropped and they can no longer be resolved.
     *
     * @return number of escalations discarded
     */
    public int discardForMission(String missionId) {
        int discarded = 0;
        synchronized (this) {
            for (Escalation escalation : List.copyOf(escalations.values())) {
                if (escalation.status() == EscalationStatus.PENDING && missionId.equals(escalation.missionId())) {
                    escalations.put(escalation.id(), escalation.discard());
                    resumeHooks.remove(escalation.id());
                    discarded++;
                }
            }
            evictClosed();
        }
        if (discarded > 0) {
            log.info("Discarded {} pending escalation(s) of mission {}", discarded, missionId);
            if (metrics != null) {
                for (int i = 0; i < discarded; i++) {
                    metrics.incrementEscalations("discarded");
                }
            }
        }
        return discarded;
    }

    // Caller holds the monitor.
    private void evictClosed() {
        List<Escalation> closed = escalations.values().stream()
                .filter(e -> e.status() != EscalationStatus.PENDING)
                .sorted(Comparator.comparing(Escalation::createdAt))
                .toList();
        int excess = closed.size() - Math.max(0, properties.getMaxRetained());
        for (int i = 0; i < excess; i++) {
            escalations.remove(closed.get(i).id());
        }
        if (excess > 0) {
            log.debug("Evicted {} closed escalation(s)", excess);
        }
    }

    private List<EscalationTarget> currentTargets() {
        return properties.getTargets().stream()
                .map(t -> new EscalationTarget(t.getKey(), t.getLabel(), t.getDescription(), t.getMemoryCost(),
                        isAvailable(t)))
                .toList();
    }

    private boolean isAvailable(String targetKey) {
        return properties.getTargets().stream()
                .filter(t -> t.getKey().equals(targetKey))
                .anyMatch(this::isAvailable);
    }

    private boolean isAvailable(EscalationProperties.Target target) {
        if (target.isAlwaysAvailable()) {
            return true;
        }
        return target.getAgentId() != null && agentRegistry != null && agentRegistry.get(target.getAgentId()).isPresent();
    }
}
