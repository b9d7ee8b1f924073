package com.hedgetrader.recovery;

import com.hedgetrader.core.coordinator.PositionCoordinator;
import com.hedgetrader.core.engine.HedgeTradingEngine;
import com.hedgetrader.domain.model.Hedge;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Stops admissions in an orderly way when the application context closes.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase so it stops before the executors
 * and schedulers. Hedges are left as they are, NOT closed: exit orders are not placed
 * during an uncertain shutdown. Anything still open is logged for the operator.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final HedgeTradingEngine hedgeTradingEngine;
    private final PositionCoordinator positionCoordinator;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(HedgeTradingEngine hedgeTradingEngine, PositionCoordinator positionCoordinator) {
        this.hedgeTradingEngine = hedgeTradingEngine;
        this.positionCoordinator = positionCoordinator;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            hedgeTradingEngine.pause();

            List<Hedge> active = positionCoordinator.getActiveHedges();
            if (active.isEmpty()) {
                log.info("No active hedges at shutdown");
            } else {
                log.warn("{} hedges still active at shutdown:", active.size());
                for (Hedge hedge : active) {
                    log.warn("  hedge {} on pair {} is {} on accounts {}", hedge.getId(), hedge.getPairId(),
                            hedge.getStatus(), hedge.getAccountAddresses());
                }
            }
            log.info("Graceful shutdown completed successfully");
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }
}
