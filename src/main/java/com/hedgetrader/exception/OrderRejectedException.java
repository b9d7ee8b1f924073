package com.hedgetrader.exception;

public class OrderRejectedException extends BaseException {

    public OrderRejectedException(String message) {
        super(ErrorCode.ORDER_REJECTED, message);
    }
}
