package com.adaptivetutor.feed;

import com.adaptivetutor.domain.model.SignalUpdate;
import com.adaptivetutor.event.SignalUpdateEvent;
import com.adaptivetutor.exception.InvalidInputException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link SignalFeed} backed by Spring application events.
 *
 * <p>Every {@link SignalUpdateEvent} is routed by session ID to the one live subscription for
 * that session, on the publishing thread. Lookup is O(1) regardless of how many sessions are live.
 * Updates for a session with no live subscription are dropped at DEBUG. A handler failure is
 * logged and contained, so one bad update never reaches the publisher.
 */
@Component
public class ApplicationEventSignalFeed implements SignalFeed {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventSignalFeed.class);

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    /**
     * Registers the handler for a session.
     *
     * @throws IllegalStateException if the session already has a live subscription
     */
    @Override
    public FeedSubscription subscribe(String sessionId, Consumer<SignalUpdate> handler) {
        Subscription subscription = new Subscription(sessionId, handler);
        Subscription existing = subscriptions.putIfAbsent(sessionId, subscription);
        if (existing != null) {
            throw new IllegalStateException("Session " + sessionId + " is already subscribed");
        }
        log.debug("Signal feed subscribed for session {}", sessionId);
        return subscription;
    }

    @EventListener
    @Order(1)
    public void onSignalUpdate(SignalUpdateEvent event) {
        SignalUpdate update = event.getUpdate();
        if (update == null || update.getSessionId() == null) {
            log.warn("Dropping signal update without a session ID");
            return;
        }

        Subscription subscription = subscriptions.get(update.getSessionId());
        if (subscription == null) {
            log.debug("No subscription for session {}, dropping signal update", update.getSessionId());
            return;
        }
        subscription.deliver(update);
    }

    public boolean isSubscribed(String sessionId) {
        return subscriptions.containsKey(sessionId);
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    private final class Subscription implements FeedSubscription {

        private final String sessionId;
        private final Consumer<SignalUpdate> handler;
        private volatile boolean cancelled;

        private Subscription(String sessionId, Consumer<SignalUpdate> handler) {
            this.sessionId = sessionId;
            this.handler = handler;
        }

        private void deliver(SignalUpdate update) {
            if (cancelled) {
                return;
            }
            try {
                handler.accept(update);
            } catch (InvalidInputException e) {
                log.warn("Rejected signal update for session {}: {}", sessionId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Signal handler failed for session {}: {}", sessionId, e.getMessage(), e);
            }
        }

        @Override
        public String getSessionId() {
            return sessionId;
        }

        @Override
        public void cancel() {
            if (cancelled) {
                return;
            }
            cancelled = true;
            // remove(key, value) so a late cancel never drops a newer subscription
            subscriptions.remove(sessionId, this);
            log.debug("Signal feed unsubscribed for session {}", sessionId);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
