package com.hedgetrader.simulator;

import com.hedgetrader.broker.OrderExecutor;
import com.hedgetrader.broker.OrderUpdate;
import com.hedgetrader.domain.enums.PositionSide;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.event.EventPublisherHelper;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper trading {@link OrderExecutor}. Orders are accepted immediately and resolved after
 * {@code fillDelayMs} on a background thread, which publishes the fill (at the last
 * simulated price plus slippage against the order) or, with {@code rejectProbability},
 * a rejection.
 */
@Service
@ConditionalOnProperty(prefix = "hedgetrader.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PaperOrderExecutor implements OrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaperOrderExecutor.class);

    private final SimulatorProperties simulatorProperties;
    private final PaperMarketDataProvider paperMarketDataProvider;
    private final EventPublisherHelper eventPublisherHelper;
    private final Random random;

    private final Map<String, ScheduledFuture<?>> workingOrders = new ConcurrentHashMap<>();

    private final ScheduledExecutorService fillScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "paper-fills");
        thread.setDaemon(true);
        return thread;
    });

    public PaperOrderExecutor(
            SimulatorProperties simulatorProperties,
            PaperMarketDataProvider paperMarketDataProvider,
            EventPublisherHelper eventPublisherHelper) {
        this.simulatorProperties = simulatorProperties;
        this.paperMarketDataProvider = paperMarketDataProvider;
        this.eventPublisherHelper = eventPublisherHelper;
        this.random = simulatorProperties.getSeed() != 0 ? new Random(simulatorProperties.getSeed()) : new Random();
    }

    @Override
    public String placeOrder(Account account, String marketId, PositionSide side, BigDecimal size) {
        String orderRef = "SIM-" + UUID.randomUUID().toString().substring(0, 8);
        log.debug("Paper placeOrder {}: {} {} {} on {}", orderRef, side, size, marketId, account.getAddress());

        ScheduledFuture<?> resolution = fillScheduler.schedule(
                () -> resolve(orderRef, marketId, side, size),
                simulatorProperties.getFillDelayMs(),
                TimeUnit.MILLISECONDS);
        workingOrders.put(orderRef, resolution);
        return orderRef;
    }

    @Override
    public void cancelOrder(String orderRef) {
        ScheduledFuture<?> resolution = workingOrders.remove(orderRef);
        if (resolution != null) {
            resolution.cancel(false);
            log.debug("Paper cancelOrder {}", orderRef);
        }
    }

    private void resolve(String orderRef, String marketId, PositionSide side, BigDecimal size) {
        if (workingOrders.remove(orderRef) == null) {
            return;
        }
        try {
            if (random.nextDouble() < simulatorProperties.getRejectProbability()) {
                eventPublisherHelper.publishOrderUpdate(this, OrderUpdate.rejected(orderRef, "Simulated rejection"));
                return;
            }
            BigDecimal price = paperMarketDataProvider.getLastPrice(marketId);
            BigDecimal slip = price.multiply(simulatorProperties.getSlippage());
            BigDecimal fillPrice = (side == PositionSide.LONG ? price.add(slip) : price.subtract(slip))
                    .setScale(8, RoundingMode.HALF_UP);
            eventPublisherHelper.publishOrderUpdate(this, OrderUpdate.filled(orderRef, size, fillPrice));
        } catch (RuntimeException e) {
            log.error("Paper resolution of order {} failed", orderRef, e);
        }
    }

    public int getWorkingOrderCount() {
        return workingOrders.size();
    }

    @PreDestroy
    public void shutdown() {
        fillScheduler.shutdownNow();
    }
}
