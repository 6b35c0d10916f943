package com.franchiseplatform.common.exception;

/**
 * Base for programmer-facing negotiation failures. Domain outcomes such as a
 * rejected offer or a lockout are never thrown; they travel as responses.
 */
public class NegotiationException extends RuntimeException {
    private final String playerId;

    public NegotiationException(String playerId, String message) {
        super("[" + playerId + "] " + message);
        this.playerId = playerId;
    }

    public NegotiationException(String playerId, String message, Throwable cause) {
        super("[" + playerId + "] " + message, cause);
        this.playerId = playerId;
    }

    public String getPlayerId() {
        return playerId;
    }
}
