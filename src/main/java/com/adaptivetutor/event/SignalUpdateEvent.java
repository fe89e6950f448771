package com.adaptivetutor.event;

import com.adaptivetutor.domain.model.SignalUpdate;
import org.springframework.context.ApplicationEvent;

/**
 * Inbound engagement signal for one session, as delivered by the instrumentation transport.
 *
 * <p>This is the highest-frequency event in the system. It is routed to the session's
 * subscriber by {@link com.adaptivetutor.feed.ApplicationEventSignalFeed}.
 */
public class SignalUpdateEvent extends ApplicationEvent {

    private final SignalUpdate update;

    public SignalUpdateEvent(Object source, SignalUpdate update) {
        super(source);
        this.update = update;
    }

    public SignalUpdate getUpdate() {
        return update;
    }
}
