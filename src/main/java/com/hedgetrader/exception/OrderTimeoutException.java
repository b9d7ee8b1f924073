package com.hedgetrader.exception;

import java.time.Duration;
import java.util.Map;

public class OrderTimeoutException extends BaseException {

    public OrderTimeoutException(String orderRef, Duration elapsed) {
        super(ErrorCode.ORDER_TIMEOUT, "Order " + orderRef + " unfilled after " + elapsed.toSeconds() + "s",
                Map.of("orderRef", orderRef, "elapsedSeconds", elapsed.toSeconds()));
    }
}
