package com.franchiseplatform.common.leverage;

import com.franchiseplatform.common.model.Leverage;

/**
 * Reads a {@link Leverage} pair for display and caller-side strategy.
 */
public final class LeverageInterpreter {

    /** Minimum gap before one side counts as dominant. */
    public static final double DOMINANCE_MARGIN = 0.2;

    public enum Party { USER, AGENT, BALANCED }

    private LeverageInterpreter() {}

    public static Party dominantParty(Leverage leverage) {
        double gap = gap(leverage);
        if (gap > DOMINANCE_MARGIN)  return Party.USER;
        if (gap < -DOMINANCE_MARGIN) return Party.AGENT;
        return Party.BALANCED;
    }

    /** Positive when the user holds more leverage than the agent. */
    public static double gap(Leverage leverage) {
        return leverage.userLeverage() - leverage.agentLeverage();
    }

    public static String describe(Leverage leverage) {
        return switch (dominantParty(leverage)) {
            case USER     -> "You hold the leverage in this negotiation.";
            case AGENT    -> "The agent holds the leverage in this negotiation.";
            case BALANCED -> "Leverage is roughly balanced.";
        };
    }
}
