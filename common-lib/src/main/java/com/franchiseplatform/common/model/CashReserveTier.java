package com.franchiseplatform.common.model;

/**
 * Owner cash position, distinct from cap space. Read by callers to gate signing
 * bonuses; the negotiation engine itself reasons only about cap space.
 */
public enum CashReserveTier {
    WEALTHY,
    COMFORTABLE,
    TIGHT,
    CRISIS
}
