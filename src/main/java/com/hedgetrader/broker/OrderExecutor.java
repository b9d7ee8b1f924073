package com.hedgetrader.broker;

import com.hedgetrader.domain.enums.PositionSide;
import com.hedgetrader.domain.model.Account;
import java.math.BigDecimal;

/**
 * Exchange-facing order placement used by the position coordinator.
 *
 * <p>Placement is asynchronous: {@link #placeOrder} returns as soon as the exchange has
 * accepted the order and yields its reference. The outcome (fill or rejection) arrives
 * later as an {@link com.hedgetrader.event.OrderUpdateEvent} carrying that reference.
 * Updates may arrive in any order, including before {@code placeOrder} returns.
 *
 * <p>Implementations own all network concerns (auth, signing, retries at the HTTP level).
 */
public interface OrderExecutor {

    /**
     * Places a market order.
     *
     * @param account the account to trade on
     * @param marketId exchange market identifier
     * @param side LONG to buy, SHORT to sell
     * @param size order size in quote currency
     * @return the exchange order reference
     * @throws com.hedgetrader.exception.OrderRejectedException if the exchange rejects the order outright
     * @throws com.hedgetrader.exception.ExchangeException if the exchange cannot be reached
     */
    String placeOrder(Account account, String marketId, PositionSide side, BigDecimal size);

    /**
     * Requests cancellation of a working order. Cancelling an order that already reached a
     * final state is a no-op.
     *
     * @throws com.hedgetrader.exception.ExchangeException if the exchange cannot be reached
     */
    void cancelOrder(String orderRef);
}
