package com.adaptivetutor.feed;

import com.adaptivetutor.domain.model.SignalUpdate;
import java.util.function.Consumer;

/**
 * Source of engagement signals, subscribed per session.
 *
 * <p>The engine subscribes when a session starts and cancels the subscription when it ends.
 * Implementations deliver updates for a session only while its subscription is live; updates
 * for sessions with no live subscription are dropped.
 */
public interface SignalFeed {

    FeedSubscription subscribe(String sessionId, Consumer<SignalUpdate> handler);
}
