package com.drover.core.escalation;

import com.drover.core.agents.AgentRegistry;
import com.drover.core.agents.StubAgent;
import com.drover.core.events.DroverEvent;
import com.drover.core.events.EventBus;
import com.drover.core.metrics.DroverMetrics;
import com.drover.core.model.Escalation;
import com.drover.core.model.EscalationStatus;
import com.drover.core.model.EscalationTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EscalationServiceTest {

    private AgentRegistry registry;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private EscalationProperties properties;
    private EscalationService service;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry("hermes");
        registry.register(StubAgent.echo("hermes"));
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        properties = new EscalationProperties();
        properties.getTargets().add(new EscalationProperties.Target("specialist", "Local specialist",
                "Hand the task to the larger local model", 24, false, "specialist"));
        properties.getTargets().add(new EscalationProperties.Target("cloud", "Cloud model",
                "Send the findings to a hosted model", 0, false, null));
        service = new EscalationService(properties, registry, eventBus, new DroverMetrics(meterRegistry));
    }

    @Nested
    @DisplayName("requestEscalation")
    class Request {

        @Test
        @DisplayName("creates a pending escalation with the configured targets")
        void createsPending() {
            var events = new ArrayList<DroverEvent>();
            eventBus.subscribe("m1", events::add);

            Escalation escalation = service.requestEscalation("m1", "too hard", "partial findings");

            assertEquals(EscalationStatus.PENDING, escalation.status());
            assertEquals("partial findings", escalation.findingsSoFar());
            assertEquals(List.of("user", "specialist", "cloud"),
                    escalation.targets().stream().map(EscalationTarget::key).toList());
            assertEquals(1, events.size());
            assertEquals("escalation.requested", events.get(0).eventType());
            assertEquals(escalation.id(), events.get(0).payload().get("escalation_id"));
            assertEquals(1.0, meterRegistry.find("drover.escalations.total")
                    .tag("outcome", "requested").counter().count());
        }

        @Test
        @DisplayName("targets bound to unregistered agents are unavailable")
        void availability() {
            Escalation escalation = service.requestEscalation("m1", "too hard", null);

            assertTrue(escalation.target("user").orElseThrow().available());
            assertFalse(escalation.target("specialist").orElseThrow().available());
            assertFalse(escalation.target("cloud").orElseThrow().available());
            assertEquals("", escalation.findingsSoFar());
        }

        @Test
        @DisplayName("pending lists unresolved escalations oldest first")
        void pendingOrder() throws InterruptedException {
            Escalation first = service.requestEscalation("m1", "a", "");
            Thread.sleep(5);
            Escalation second = service.requestEscalation("m2", "b", "");
            Thread.sleep(5);
            Escalation third = service.requestEscalation("m3", "c", "");
            service.resolveEscalation(second.id(), "user");

            assertEquals(List.of(first.id(), third.id()), service.pending().stream().map(Escalation::id).toList());
        }
    }

    @Nested
    @DisplayName("resolveEscalation")
    class Resolve {

        @Test
        @DisplayName("resolves once and runs the hook once")
        void resolvesOnce() {
            var calls = new AtomicInteger();
            Escalation escalation = service.requestEscalation("m1", "t2", "why", "", e -> calls.incrementAndGet());

            Escalation resolved = service.resolveEscalation(escalation.id(), "user");

            assertEquals(EscalationStatus.RESOLVED, resolved.status());
            assertEquals("user", resolved.chosenTarget());
            assertEquals("t2", resolved.taskId());
            assertEquals(1, calls.get());
            assertEquals(resolved, service.get(escalation.id()).orElseThrow());

            var again = assertThrows(EscalationNotFoundException.class,
                    () -> service.resolveEscalation(escalation.id(), "user"));
            assertTrue(again.isAlreadyResolved());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("unknown ids are rejected")
        void unknownId() {
            var e = assertThrows(EscalationNotFoundException.class, () -> service.resolveEscalation("nope", "user"));
            assertFalse(e.isAlreadyResolved());
            assertEquals("Unknown escalation: nope", e.getMessage());
        }

        @Test
        @DisplayName("unknown or unavailable targets leave the escalation pending")
        void badTargets() {
            var calls = new AtomicInteger();
            Escalation escalation = service.requestEscalation("m1", "t1", "why", "", e -> calls.incrementAndGet());

            assertThrows(IllegalArgumentException.class, () -> service.resolveEscalation(escalation.id(), "oracle"));
            var unavailable = assertThrows(IllegalArgumentException.class,
                    () -> service.resolveEscalation(escalation.id(), "specialist"));
            assertTrue(unavailable.getMessage().contains("Local specialist"));

            assertEquals(EscalationStatus.PENDING, service.get(escalation.id()).orElseThrow().status());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("a target becomes available once its agent registers")
        void agentRegistersLater() {
            Escalation escalation = service.requestEscalation("m1", "t1", "why", "", null);
            registry.register(StubAgent.echo("specialist"));

            assertEquals("specialist", service.resolveEscalation(escalation.id(), "specialist").chosenTarget());
            assertEquals("specialist", service.redirectAgent("specialist").orElseThrow());
            assertTrue(service.redirectAgent("user").isEmpty());
            assertTrue(service.redirectAgent("missing").isEmpty());
        }

        @Test
        @DisplayName("a failing hook does not undo the resolution")
        void failingHook() {
            Escalation escalation = service.requestEscalation("m1", "t1", "why", "", e -> {
                throw new IllegalStateException("branch gone");
            });

            assertEquals(EscalationStatus.RESOLVED, service.resolveEscalation(escalation.id(), "user").status());
            assertEquals(1.0, meterRegistry.find("drover.escalations.total")
                    .tag("outcome", "resolved").counter().count());
        }

        @Test
        @DisplayName("discarded escalations leave the pending list and cannot be resolved")
        void discard() {
            var calls = new AtomicInteger();
            Escalation escalation = service.requestEscalation("m1", "t1", "why", "", e -> calls.incrementAndGet());
            Escalation other = service.requestEscalation("m2", "t1", "why", "", null);

            assertEquals(1, service.discardForMission("m1"));

            assertEquals(List.of(other.id()), service.pending().stream().map(Escalation::id).toList());
            assertEquals(EscalationStatus.DISCARDED, service.get(escalation.id()).orElseThrow().status());
            var e = assertThrows(EscalationNotFoundException.class,
                    () -> service.resolveEscalation(escalation.id(), "user"));
            assertFalse(e.isAlreadyResolved());
            assertTrue(e.getMessage().contains("discarded"));
            assertEquals(0, calls.get());
            assertEquals(1.0, meterRegistry.find("drover.escalations.total")
                    .tag("outcome", "discarded").counter().count());
            assertEquals(0, service.discardForMission("m1"));
        }

        @Test
        @DisplayName("closed escalations beyond the cap are evicted oldest first")
        void evictsClosed() throws InterruptedException {
            properties.setMaxRetained(1);
            Escalation first = service.requestEscalation("m1", "first", "");
            Thread.sleep(5);
            Escalation second = service.requestEscalation("m1", "second", "");
            Thread.sleep(5);
            Escalation open = service.requestEscalation("m2", "third", "");

            service.resolveEscalation(first.id(), "user");
            assertTrue(service.get(first.id()).isPresent());
            service.resolveEscalation(second.id(), "user");

            assertTrue(service.get(first.id()).isEmpty());
            assertEquals(EscalationStatus.RESOLVED, service.get(second.id()).orElseThrow().status());
            assertEquals(List.of(open.id()), service.pending().stream().map(Escalation::id).toList());
        }
    }
}
