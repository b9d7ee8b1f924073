package com.hedgetrader.risk;

import com.hedgetrader.core.coordinator.PositionCoordinator;
import com.hedgetrader.domain.enums.CloseReason;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator stop for the whole engine.
 *
 * <p>Activation first sets the global emergency stop, so no pair can admit a new hedge from
 * that moment on. When {@code closePositions} is requested it then drives every OPEN and
 * OPENING hedge to closing through the coordinator's normal unwind path.
 *
 * <p>Idempotent: an {@link AtomicBoolean} prevents double activation. Deactivation clears
 * the emergency stop only if this switch set it; a stop already raised by a global loss
 * breach, and accounts locked for other causes, stay in place.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final RiskManager riskManager;
    private final PositionCoordinator positionCoordinator;
    private final Clock clock;

    private final AtomicBoolean killSwitchActive = new AtomicBoolean(false);

    /** True while the emergency stop in force is the one this switch set. */
    private final AtomicBoolean ownsEmergencyStop = new AtomicBoolean(false);

    public KillSwitchService(RiskManager riskManager, PositionCoordinator positionCoordinator, Clock clock) {
        this.riskManager = riskManager;
        this.positionCoordinator = positionCoordinator;
        this.clock = clock;
    }

    /**
     * @param reason human-readable reason, recorded on the risk event
     * @param closePositions also close every OPEN and OPENING hedge
     */
    public KillSwitchResult activate(String reason, boolean closePositions) {
        if (killSwitchActive.getAndSet(true)) {
            log.warn("Kill switch already active, ignoring duplicate activation");
            return KillSwitchResult.alreadyActive(clock.instant());
        }

        log.error("KILL SWITCH ACTIVATED: {} (close positions: {})", reason, closePositions);

        boolean stopped = riskManager.emergencyStop("Kill switch: " + reason);
        ownsEmergencyStop.set(stopped);
        int closing = closePositions ? positionCoordinator.closeAll(CloseReason.OPERATOR_STOP) : 0;

        log.info("Kill switch complete: emergency stop {}, {} hedges closing",
                stopped ? "activated" : "already active", closing);

        return KillSwitchResult.builder()
                .success(true)
                .emergencyStopActivated(stopped)
                .hedgesClosing(closing)
                .reason(reason)
                .activatedAt(clock.instant())
                .build();
    }

    /**
     * Releases the switch. An emergency stop raised by the risk limits before activation is
     * left in force, together with the account locks it placed; only an operator clears it.
     */
    public void deactivate() {
        if (!killSwitchActive.getAndSet(false)) {
            return;
        }
        if (ownsEmergencyStop.getAndSet(false)) {
            riskManager.clearEmergencyStop();
            log.info("Kill switch deactivated -- admissions may resume");
        } else {
            log.warn("Kill switch deactivated; emergency stop raised by risk limits stays active ({})",
                    riskManager.getEmergencyReason());
        }
    }

    public boolean isActive() {
        return killSwitchActive.get();
    }
}
