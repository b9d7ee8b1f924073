package com.hedgetrader.event;

import com.hedgetrader.broker.OrderUpdate;
import com.hedgetrader.domain.model.Hedge;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the engine's event types.
 *
 * <p>Delivery is synchronous on the publishing thread unless a listener is declared
 * {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Hedge ----

    public void publishHedge(Object source, Hedge hedge, HedgeEventType eventType) {
        applicationEventPublisher.publishEvent(new HedgeEvent(source, hedge, eventType));
    }

    // ---- Order ----

    public void publishOrderUpdate(Object source, OrderUpdate update) {
        applicationEventPublisher.publishEvent(new OrderUpdateEvent(source, update));
    }

    // ---- Risk ----

    public void publishRisk(RiskEvent riskEvent) {
        applicationEventPublisher.publishEvent(riskEvent);
    }
}
