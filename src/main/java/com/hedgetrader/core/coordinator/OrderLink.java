package com.hedgetrader.core.coordinator;

import com.hedgetrader.domain.model.Hedge;

/** Where an order reference belongs: the owning hedge, the leg, and which of its orders. */
public record OrderLink(Hedge hedge, String legId, OrderRole role) {
}
