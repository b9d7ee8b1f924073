package com.hedgetrader.event;

public enum HedgeEventType {
    OPENING,
    OPENED,
    CLOSING,
    CLOSED,
    FAILED
}
