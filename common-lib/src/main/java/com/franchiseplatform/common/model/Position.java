package com.franchiseplatform.common.model;

/**
 * Roster positions with the league-wide salary multiplier used for market value.
 */
public enum Position {
    QB(2.5),
    RB(1.5),
    WR(1.5),
    TE(1.2),
    OL(2.0),
    DL(2.0),
    LB(1.0),
    CB(2.0),
    S(1.0),
    K(0.5),
    P(0.5);

    private final double marketMultiplier;

    Position(double marketMultiplier) {
        this.marketMultiplier = marketMultiplier;
    }

    public double marketMultiplier() {
        return marketMultiplier;
    }
}
