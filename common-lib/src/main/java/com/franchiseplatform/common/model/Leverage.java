package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bilateral negotiating power. Each side is computed independently and clamped
 * to [0.0, 1.0]; the two values need not sum to 1.
 */
public record Leverage(
    @JsonProperty("userLeverage")  double userLeverage,
    @JsonProperty("agentLeverage") double agentLeverage
) {

    public static Leverage balanced() {
        return new Leverage(0.5, 0.5);
    }

    public static Leverage clamped(double userLeverage, double agentLeverage) {
        return new Leverage(clamp(userLeverage), clamp(agentLeverage));
    }

    public Leverage withUserLeverage(double userLeverage) {
        return clamped(userLeverage, agentLeverage);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
