package com.franchiseplatform.common.exception;

/**
 * Structurally malformed contract offer. Thrown at construction time, so an
 * invalid offer never reaches evaluation.
 */
public class InvalidOfferException extends IllegalArgumentException {
    private final String offerId;

    public InvalidOfferException(String offerId, String message) {
        super("[offer " + offerId + "] " + message);
        this.offerId = offerId;
    }

    public String getOfferId() {
        return offerId;
    }
}
