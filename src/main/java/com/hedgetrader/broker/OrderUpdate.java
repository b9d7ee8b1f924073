package com.hedgetrader.broker;

import java.math.BigDecimal;

/** Asynchronous outcome of a placed order, matched to its leg by order reference. */
public record OrderUpdate(
        String orderRef, OrderUpdateType type, BigDecimal filledSize, BigDecimal averagePrice, String reason) {

    public static OrderUpdate filled(String orderRef, BigDecimal filledSize, BigDecimal averagePrice) {
        return new OrderUpdate(orderRef, OrderUpdateType.FILLED, filledSize, averagePrice, null);
    }

    public static OrderUpdate rejected(String orderRef, String reason) {
        return new OrderUpdate(orderRef, OrderUpdateType.REJECTED, null, null, reason);
    }
}
