package com.hedgetrader.status;

import com.hedgetrader.domain.enums.RiskAction;
import com.hedgetrader.domain.enums.RiskScope;
import com.hedgetrader.event.RiskEvent;
import com.hedgetrader.event.RiskEventType;
import java.time.Instant;

public record RiskEventSummary(
        Instant occurredAt, RiskScope scope, RiskEventType type, RiskAction action, String message) {

    public static RiskEventSummary of(RiskEvent event) {
        return new RiskEventSummary(
                event.getOccurredAt(), event.getScope(), event.getEventType(), event.getAction(), event.getMessage());
    }
}
