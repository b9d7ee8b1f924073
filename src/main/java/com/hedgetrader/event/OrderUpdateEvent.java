package com.hedgetrader.event;

import com.hedgetrader.broker.OrderUpdate;
import org.springframework.context.ApplicationEvent;

/**
 * Published by an {@link com.hedgetrader.broker.OrderExecutor} when an order fills or is
 * rejected. The position coordinator listens for it and reconciles the owning hedge.
 */
public class OrderUpdateEvent extends ApplicationEvent {

    private final OrderUpdate update;

    public OrderUpdateEvent(Object source, OrderUpdate update) {
        super(source);
        this.update = update;
    }

    public OrderUpdate getUpdate() {
        return update;
    }
}
