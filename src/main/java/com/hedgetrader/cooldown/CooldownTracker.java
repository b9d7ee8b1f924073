package com.hedgetrader.cooldown;

import com.hedgetrader.config.EngineProperties;
import com.hedgetrader.domain.enums.RiskAction;
import com.hedgetrader.domain.model.CooldownWindow;
import com.hedgetrader.event.RiskEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Per-pair re-entry windows after a hedge closes or fails, or after a pair is halted.
 *
 * <p>At most one window per pair. A new window replaces the current one, even if it ends
 * sooner. Expiry is evaluated lazily against the clock at query time; expired windows are
 * simply ignored.
 */
@Component
public class CooldownTracker {

    private static final Logger log = LoggerFactory.getLogger(CooldownTracker.class);

    private final Clock clock;
    private final EngineProperties engineProperties;
    private final Map<String, CooldownWindow> windows = new ConcurrentHashMap<>();

    public CooldownTracker(Clock clock, EngineProperties engineProperties) {
        this.clock = clock;
        this.engineProperties = engineProperties;
    }

    public CooldownWindow startCooldown(String pairId, Duration duration, String reason) {
        Instant now = clock.instant();
        CooldownWindow window = new CooldownWindow(pairId, now, now.plus(duration), reason);
        windows.put(pairId, window);
        log.info("Cooldown for pair {} until {} ({})", pairId, window.expiresAt(), reason);
        return window;
    }

    public boolean isInCooldown(String pairId) {
        CooldownWindow window = windows.get(pairId);
        return window != null && window.isActive(clock.instant());
    }

    public Duration remaining(String pairId) {
        CooldownWindow window = windows.get(pairId);
        return window != null ? window.remaining(clock.instant()) : Duration.ZERO;
    }

    /** The active window for the pair, if any. */
    public Optional<CooldownWindow> getActiveWindow(String pairId) {
        CooldownWindow window = windows.get(pairId);
        return window != null && window.isActive(clock.instant()) ? Optional.of(window) : Optional.empty();
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        if (event.getAction() == RiskAction.HALT_PAIR && event.getPairId() != null) {
            startCooldown(event.getPairId(), engineProperties.getFailureCooldown(), event.getMessage());
        }
    }
}
