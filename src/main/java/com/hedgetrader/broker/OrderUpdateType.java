package com.hedgetrader.broker;

public enum OrderUpdateType {
    FILLED,
    REJECTED
}
