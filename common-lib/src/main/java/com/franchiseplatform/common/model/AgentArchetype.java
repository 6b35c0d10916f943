package com.franchiseplatform.common.model;

/**
 * Behavioral profile of a player's representation.
 *
 * <p>Each archetype carries the base values the profile factory jitters per player
 * and the fixed behavioral knobs the evaluator and scheduler read.
 *
 * <ul>
 *   <li>{@link #SHARK}: impatient, volatile, chases peak money and guarantees</li>
 *   <li>{@link #FAMILY_FRIEND}: patient, steady, takes value for security and a ring</li>
 *   <li>{@link #BRAND_BUILDER}: short deals, drawn to contenders and guarantees</li>
 *   <li>{@link #SELF_REPRESENTED}: most patient and most literal, never theatrical</li>
 * </ul>
 */
public enum AgentArchetype {
    //                 patience volatility maxYears nearMiss thresholdAdj contenderDisc ringFactor temper lowballTol leakAffinity shadowAffinity
    SHARK(             0.25,    0.80,      10,      0.85,    0.01,        0.00,         0.25,      0.10,  2,         1.5,         1.5),
    FAMILY_FRIEND(     0.75,    0.20,      7,       0.78,    0.00,        0.05,         1.00,     -0.05,  4,         0.3,         0.2),
    BRAND_BUILDER(     0.50,    0.45,      2,       0.80,    0.00,        0.02,         0.75,      0.05,  3,         1.0,         1.5),
    SELF_REPRESENTED(  0.90,    0.10,      5,       0.90,    0.00,        0.01,         0.50,      0.00,  3,         0.8,         2.0);

    private final double basePatience;
    private final double baseMoodVolatility;
    private final int    baseMaxContractLength;
    private final double nearMissFloor;
    private final double thresholdOffset;
    private final double contenderDiscount;
    private final double ringFactor;
    private final double temperament;
    private final int    lowballTolerance;
    private final double pressLeakAffinity;
    private final double shadowAdvisorAffinity;

    AgentArchetype(double basePatience, double baseMoodVolatility, int baseMaxContractLength,
                   double nearMissFloor, double thresholdOffset, double contenderDiscount,
                   double ringFactor, double temperament, int lowballTolerance,
                   double pressLeakAffinity, double shadowAdvisorAffinity) {
        this.basePatience          = basePatience;
        this.baseMoodVolatility    = baseMoodVolatility;
        this.baseMaxContractLength = baseMaxContractLength;
        this.nearMissFloor         = nearMissFloor;
        this.thresholdOffset       = thresholdOffset;
        this.contenderDiscount     = contenderDiscount;
        this.ringFactor            = ringFactor;
        this.temperament           = temperament;
        this.lowballTolerance      = lowballTolerance;
        this.pressLeakAffinity     = pressLeakAffinity;
        this.shadowAdvisorAffinity = shadowAdvisorAffinity;
    }

    public double basePatience()          { return basePatience; }
    public double baseMoodVolatility()    { return baseMoodVolatility; }
    public int    baseMaxContractLength() { return baseMaxContractLength; }

    /** Lowest fit that still draws a counter-offer rather than a rejection. */
    public double nearMissFloor()         { return nearMissFloor; }

    /** Added to the acceptance threshold for every offer. */
    public double thresholdOffset()       { return thresholdOffset; }

    /**
     * Subtracted from the threshold when the offering team is a contender, or when it
     * has a starting spot open and the archetype {@linkplain #prizesStartingSpot() prizes one}.
     */
    public double contenderDiscount()     { return contenderDiscount; }

    /** Scales how much contender status shifts leverage toward the team. */
    public double ringFactor()            { return ringFactor; }

    /** Added to agent leverage; positive for agents that posture harder. */
    public double temperament()           { return temperament; }

    /** Lowball offers tolerated before the agent walks away for good. */
    public int    lowballTolerance()      { return lowballTolerance; }

    public double pressLeakAffinity()     { return pressLeakAffinity; }
    public double shadowAdvisorAffinity() { return shadowAdvisorAffinity; }

    /** Minimum guaranteed share this archetype writes into its own counter-offers. */
    public double counterGuaranteeFloor() {
        return this == SHARK ? 0.87 : 0.0;
    }

    /** Brand builders hold every player to the same short term. */
    public boolean jittersContractLength() {
        return this != BRAND_BUILDER;
    }

    /** Family friends weigh a guaranteed starting role like a shot at a ring. */
    public boolean prizesStartingSpot() {
        return this == FAMILY_FRIEND;
    }

    /**
     * Whether the archetype's mood can fall to {@link AgentMood#ANGRY}.
     * Self-represented players stay businesslike.
     */
    public boolean canAnger() {
        return this != SELF_REPRESENTED;
    }
}
