package com.drover.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for mission lifecycle events.
 * <p>
 * Listeners subscribe to one mission or to all of them. A listener that throws is logged and
 * skipped; it never disturbs the publisher or other listeners.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<DroverEvent>>> missionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<DroverEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(DroverEvent event) {
        log.debug("Publishing {} for mission {}", event.eventType(), event.missionId());

        if (event.missionId() != null) {
            List<Consumer<DroverEvent>> missionSubs = missionSubscribers.get(event.missionId());
            if (missionSubs != null) {
                for (Consumer<DroverEvent> subscriber : missionSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<DroverEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribes to the events of one mission.
     *
     * @return handle that removes the subscription
     */
    public Subscription subscribe(String missionId, Consumer<DroverEvent> consumer) {
        missionSubscribers.computeIfAbsent(missionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<DroverEvent>> subs = missionSubscribers.get(missionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    missionSubscribers.remove(missionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<DroverEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<DroverEvent> subscriber, DroverEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
