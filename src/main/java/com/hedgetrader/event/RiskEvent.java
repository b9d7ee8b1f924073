package com.hedgetrader.event;

import com.hedgetrader.domain.enums.RiskAction;
import com.hedgetrader.domain.enums.RiskScope;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Record of a risk-limit breach, warning or operator risk action, and the control action
 * taken in response.
 *
 * <p>Created only by the RiskManager, which appends it to its bounded event log and
 * publishes it. Immutable after creation.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>CooldownTracker: opens a cooldown window for a halted pair</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskScope scope;
    private final RiskEventType eventType;
    private final RiskAction action;
    private final String message;
    private final String pairId;
    private final String accountAddress;
    private final Instant occurredAt;
    private final Map<String, Object> details;

    public RiskEvent(
            Object source,
            RiskScope scope,
            RiskEventType eventType,
            RiskAction action,
            String message,
            String pairId,
            String accountAddress,
            Instant occurredAt,
            Map<String, Object> details) {
        super(source);
        this.scope = scope;
        this.eventType = eventType;
        this.action = action;
        this.message = message;
        this.pairId = pairId;
        this.accountAddress = accountAddress;
        this.occurredAt = occurredAt;
        this.details = details != null ? Collections.unmodifiableMap(new HashMap<>(details)) : Map.of();
    }

    public RiskScope getScope() {
        return scope;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskAction getAction() {
        return action;
    }

    public String getMessage() {
        return message;
    }

    /** Set for PAIR scope events, null otherwise. */
    public String getPairId() {
        return pairId;
    }

    /** Set for ACCOUNT scope events, null otherwise. */
    public String getAccountAddress() {
        return accountAddress;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>ACCOUNT_DAILY_LOSS_BREACH: {"dailyLoss": 520, "limit": 500}</li>
     *   <li>UNWIND_FAILED: {"hedgeId": "...", "attempts": 3}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "RiskEvent[" + scope + "/" + eventType + " -> " + action + ": " + message + "]";
    }
}
