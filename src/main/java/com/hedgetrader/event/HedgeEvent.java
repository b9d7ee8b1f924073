package com.hedgetrader.event;

import com.hedgetrader.domain.model.Hedge;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every hedge lifecycle transition. Carries a detached copy of the hedge so
 * listeners never observe later mutations.
 */
public class HedgeEvent extends ApplicationEvent {

    private final Hedge hedge;
    private final HedgeEventType eventType;

    public HedgeEvent(Object source, Hedge hedge, HedgeEventType eventType) {
        super(source);
        this.hedge = hedge.copy();
        this.eventType = eventType;
    }

    public Hedge getHedge() {
        return hedge;
    }

    public HedgeEventType getEventType() {
        return eventType;
    }
}
