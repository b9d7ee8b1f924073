package com.hedgetrader.core.coordinator;

/** Whether an indexed order opens a leg or closes it. */
public enum OrderRole {
    ENTRY,
    EXIT
}
