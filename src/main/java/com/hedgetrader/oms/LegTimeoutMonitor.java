package com.hedgetrader.oms;

import com.hedgetrader.core.coordinator.PositionCoordinator;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires legs whose orders have been pending longer than the order timeout,
 * so the engine never waits indefinitely on an unresponsive exchange. A timed-out entry
 * triggers the same unwind as a rejection.
 */
@Component
public class LegTimeoutMonitor {

    private static final Logger log = LoggerFactory.getLogger(LegTimeoutMonitor.class);

    private final PositionCoordinator positionCoordinator;
    private final Clock clock;

    public LegTimeoutMonitor(PositionCoordinator positionCoordinator, Clock clock) {
        this.positionCoordinator = positionCoordinator;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${hedgetrader.engine.leg-timeout-check-interval-ms:1000}")
    public void checkTimeouts() {
        try {
            int expired = positionCoordinator.expireStaleLegs(clock.instant());
            if (expired > 0) {
                log.info("Expired {} stale orders", expired);
            }
        } catch (RuntimeException e) {
            log.error("Leg timeout check failed", e);
        }
    }
}
