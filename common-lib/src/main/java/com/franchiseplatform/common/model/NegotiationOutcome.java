package com.franchiseplatform.common.model;

/**
 * Why a round ended the way it did. Every value is a normal negotiation result,
 * never an error.
 */
public enum NegotiationOutcome {
    ACCEPTED,
    COUNTERED,
    REJECTED,
    TERM_TOO_LONG,
    CAP_INFEASIBLE,
    PHONE_DEAD,
    LOCKED_OUT,
    ALREADY_AGREED;

    /** True for outcomes that returned without evaluating the offer. */
    public boolean isShortCircuit() {
        return this == PHONE_DEAD || this == LOCKED_OUT || this == ALREADY_AGREED;
    }
}
