package com.franchiseplatform.negotiation.finance;

/**
 * Signing bonus the team cannot fund from cash reserves. Raised before the offer
 * reaches the engine, so no session changes.
 */
public class InsufficientCashException extends RuntimeException {
    private final String teamId;
    private final long   signingBonus;

    public InsufficientCashException(String teamId, long signingBonus, String message) {
        super("[" + teamId + "] " + message);
        this.teamId       = teamId;
        this.signingBonus = signingBonus;
    }

    public String getTeamId() {
        return teamId;
    }

    public long getSigningBonus() {
        return signingBonus;
    }
}
