package com.adaptivetutor.feed;

/**
 * Handle for one session's subscription to a {@link SignalFeed}. Cancelling is idempotent.
 */
public interface FeedSubscription {

    String getSessionId();

    void cancel();

    boolean isCancelled();
}
