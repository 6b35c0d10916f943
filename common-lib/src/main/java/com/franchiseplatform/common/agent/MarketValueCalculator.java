package com.franchiseplatform.common.agent;

import com.franchiseplatform.common.model.PlayerProfile;
import com.franchiseplatform.common.model.Position;

/**
 * Estimates a player's annual market value from rating, position and age.
 *
 * <pre>
 * value = overall × 500,000 × position multiplier × age factor
 * age factor: under 25 → 1.3, over 30 → 0.6, otherwise 1.0
 * </pre>
 */
public final class MarketValueCalculator {

    public static final long   VALUE_PER_OVERALL_POINT = 500_000L;
    public static final double YOUNG_PREMIUM           = 1.3;
    public static final double VETERAN_DISCOUNT        = 0.6;

    private MarketValueCalculator() {}

    public static long estimate(PlayerProfile player) {
        double value = player.overall() * (double) VALUE_PER_OVERALL_POINT;
        Position position = player.position();
        value *= position != null ? position.marketMultiplier() : 1.0;
        if (player.age() < 25) {
            value *= YOUNG_PREMIUM;
        } else if (player.age() > 30) {
            value *= VETERAN_DISCOUNT;
        }
        return Math.round(value);
    }

    /** The profile's own market value when present, otherwise {@link #estimate}. */
    public static long resolve(PlayerProfile player) {
        return player.marketValue() != null ? player.marketValue() : estimate(player);
    }
}
