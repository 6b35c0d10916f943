package com.franchiseplatform.common.exception;

/**
 * Raised when an operation targets a player with no open negotiation session.
 */
public class SessionNotFoundException extends NegotiationException {

    public SessionNotFoundException(String playerId) {
        super(playerId, "No active negotiation session");
    }
}
