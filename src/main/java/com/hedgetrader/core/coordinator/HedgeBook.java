package com.hedgetrader.core.coordinator;

import com.hedgetrader.broker.OrderUpdate;
import com.hedgetrader.domain.model.Hedge;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory arena of every hedge created since startup, plus the order-reference index used
 * to route asynchronous order updates to the right hedge and leg.
 *
 * <p>Terminal hedges are kept for audit and never removed.
 *
 * <p>Order updates can overtake the placement call that produced their reference. Such
 * updates are buffered by {@link #resolveOrBuffer} and handed back by {@link #index} once
 * the reference is registered. Buffered updates that never match are dropped by
 * {@link #purgeUnmatched}.
 *
 * <p><b>Thread safety:</b> all methods synchronize on the book and never call out while
 * holding it. Hedge contents are guarded by their pair lock, not by the book.
 */
@Component
public class HedgeBook {

    private static final Logger log = LoggerFactory.getLogger(HedgeBook.class);

    private final Map<String, Hedge> hedges = new LinkedHashMap<>();
    private final Map<String, OrderLink> orderIndex = new HashMap<>();
    private final Map<String, BufferedUpdate> unmatched = new LinkedHashMap<>();

    public synchronized void add(Hedge hedge) {
        hedges.put(hedge.getId(), hedge);
    }

    public synchronized Optional<Hedge> get(String hedgeId) {
        return Optional.ofNullable(hedges.get(hedgeId));
    }

    /** All hedges in creation order, terminal ones included. */
    public synchronized List<Hedge> getHedges() {
        return new ArrayList<>(hedges.values());
    }

    public synchronized List<Hedge> getHedgesForPair(String pairId) {
        return hedges.values().stream()
                .filter(hedge -> hedge.getPairId().equals(pairId))
                .collect(Collectors.toList());
    }

    public synchronized List<Hedge> getActiveHedges() {
        return hedges.values().stream().filter(hedge -> !hedge.isTerminal()).collect(Collectors.toList());
    }

    // ========================
    // ORDER INDEX
    // ========================

    /**
     * Registers an order reference.
     *
     * @return an update for this reference that arrived before it was indexed, if any
     */
    public synchronized Optional<OrderUpdate> index(String orderRef, OrderLink link) {
        orderIndex.put(orderRef, link);
        BufferedUpdate buffered = unmatched.remove(orderRef);
        if (buffered != null) {
            log.debug("Replaying early {} update for order {}", buffered.update().type(), orderRef);
            return Optional.of(buffered.update());
        }
        return Optional.empty();
    }

    public synchronized Optional<OrderLink> lookup(String orderRef) {
        return Optional.ofNullable(orderIndex.get(orderRef));
    }

    /**
     * Resolves the update's order reference, or buffers the update if the reference is not
     * indexed yet. Only the first update per unknown reference is kept.
     */
    public synchronized Optional<OrderLink> resolveOrBuffer(OrderUpdate update, Instant receivedAt) {
        OrderLink link = orderIndex.get(update.orderRef());
        if (link == null) {
            unmatched.putIfAbsent(update.orderRef(), new BufferedUpdate(update, receivedAt));
        }
        return Optional.ofNullable(link);
    }

    /** Drops buffered updates received before {@code cutoff}. Returns the number dropped. */
    public synchronized int purgeUnmatched(Instant cutoff) {
        int purged = 0;
        Iterator<BufferedUpdate> iterator = unmatched.values().iterator();
        while (iterator.hasNext()) {
            BufferedUpdate buffered = iterator.next();
            if (buffered.receivedAt().isBefore(cutoff)) {
                log.warn("Dropping {} update for unknown order {}", buffered.update().type(),
                        buffered.update().orderRef());
                iterator.remove();
                purged++;
            }
        }
        return purged;
    }

    public synchronized int getUnmatchedCount() {
        return unmatched.size();
    }

    private record BufferedUpdate(OrderUpdate update, Instant receivedAt) {
    }
}
