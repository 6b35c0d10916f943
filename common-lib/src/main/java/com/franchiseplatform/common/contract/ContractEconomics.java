package com.franchiseplatform.common.contract;

import java.util.List;

/**
 * Pure cap-accounting calculator. Converts the raw terms of a {@link ContractOffer}
 * into the figures the negotiation engine, cap checks, restructures and releases use.
 *
 * <p>No state. No logging. Every function is total for any constructible offer.
 *
 * <h3>Accounting policy</h3>
 * <pre>
 * totalValue        = sum(baseSalaryPerYear) + signingBonus
 * bonus proration   = signingBonus / max(1, years + voidYears)
 * year-1 cap hit    = baseSalaryPerYear[0] + bonus proration
 * guarantee layout  = signing bonus first, then base salaries front-loaded year by year
 * </pre>
 * Void years carry proration only; they never carry base salary.
 */
public final class ContractEconomics {

    private ContractEconomics() {}

    // ── value ────────────────────────────────────────────────────────────────

    public static long totalValue(ContractOffer offer) {
        return sum(offer.baseSalaryPerYear()) + offer.signingBonus();
    }

    public static double averagePerYear(ContractOffer offer) {
        return (double) totalValue(offer) / offer.years();
    }

    /** Guaranteed share of total value in [0.0, 1.0]; 0 for a zero-value offer. */
    public static double guaranteedPercentage(ContractOffer offer) {
        long total = totalValue(offer);
        if (total == 0) return 0.0;
        return (double) offer.guaranteedMoney() / total;
    }

    public static long ltbeTotal(ContractOffer offer) {
        return sum(offer.ltbeIncentives());
    }

    public static long nltbeTotal(ContractOffer offer) {
        return sum(offer.nltbeIncentives());
    }

    /** Total value including every incentive, likely or not. */
    public static long totalValueWithIncentives(ContractOffer offer) {
        return totalValue(offer) + ltbeTotal(offer) + nltbeTotal(offer);
    }

    // ── cap hits ─────────────────────────────────────────────────────────────

    public static double signingBonusProration(ContractOffer offer) {
        return (double) offer.signingBonus() / prorationSeasons(offer);
    }

    public static double capHitYear1(ContractOffer offer) {
        return offer.baseSalaryPerYear().get(0) + signingBonusProration(offer);
    }

    /**
     * Cap charge for a zero-based season index. Void seasons carry proration only;
     * seasons past the last void year carry nothing.
     */
    public static double capHitForSeason(ContractOffer offer, int season) {
        if (season < 0 || season >= prorationSeasons(offer)) return 0.0;
        double proration = offer.signingBonus() > 0 ? signingBonusProration(offer) : 0.0;
        if (season < offer.years()) {
            return offer.baseSalaryPerYear().get(season) + proration;
        }
        return proration;
    }

    // ── dead cap ─────────────────────────────────────────────────────────────

    /**
     * Dead cap if the player is released after {@code yearsElapsed} completed seasons:
     * the unamortized bonus proration for every remaining season (void years included)
     * plus guaranteed base salary not yet paid.
     *
     * <p>With {@code offsetLanguage} the figure is advisory; the release side applies
     * any offset reduction.
     */
    public static double deadCapOnRelease(ContractOffer offer, int yearsElapsed) {
        int seasons = prorationSeasons(offer);
        int elapsed = Math.max(0, Math.min(yearsElapsed, seasons));

        double remainingProration = signingBonusProration(offer) * (seasons - elapsed);

        long[] guaranteedBase = guaranteedBaseBySeason(offer);
        long unpaidGuaranteedBase = 0;
        for (int season = elapsed; season < offer.years(); season++) {
            unpaidGuaranteedBase += guaranteedBase[season];
        }
        return remainingProration + unpaidGuaranteedBase;
    }

    /**
     * Per-season cap charge created by converting {@code convertedAmount} of the current
     * season's base salary into signing bonus, spread over the remaining contract and
     * void seasons. The conversion is clamped to the current season's base salary.
     */
    public static double restructureProration(ContractOffer offer, long convertedAmount, int yearsElapsed) {
        return clampConversion(offer, convertedAmount, yearsElapsed)
            / (double) remainingSeasons(offer, yearsElapsed);
    }

    /** {@link #deadCapOnRestructure(ContractOffer, long, int)} for a contract in its first season. */
    public static double deadCapOnRestructure(ContractOffer offer, long convertedAmount) {
        return deadCapOnRestructure(offer, convertedAmount, 0);
    }

    /**
     * Incremental dead-cap liability created by a restructure: the converted amount
     * becomes new signing bonus, one season of which is charged now; the rest is
     * pushed into future seasons and accelerates on release.
     */
    public static double deadCapOnRestructure(ContractOffer offer, long convertedAmount, int yearsElapsed) {
        long converted = clampConversion(offer, convertedAmount, yearsElapsed);
        return converted - restructureProration(offer, converted, yearsElapsed);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    static int prorationSeasons(ContractOffer offer) {
        return Math.max(1, offer.years() + offer.voidYears());
    }

    private static int remainingSeasons(ContractOffer offer, int yearsElapsed) {
        int elapsed = Math.max(0, Math.min(yearsElapsed, offer.years() - 1));
        return Math.max(1, offer.years() + offer.voidYears() - elapsed);
    }

    private static long clampConversion(ContractOffer offer, long convertedAmount, int yearsElapsed) {
        int season = Math.max(0, Math.min(yearsElapsed, offer.years() - 1));
        long available = offer.baseSalaryPerYear().get(season);
        return Math.max(0L, Math.min(convertedAmount, available));
    }

    /** Guaranteed base salary per season once the signing bonus has absorbed its share. */
    private static long[] guaranteedBaseBySeason(ContractOffer offer) {
        long[] layout = new long[offer.years()];
        long remaining = Math.max(0L, offer.guaranteedMoney() - offer.signingBonus());
        for (int season = 0; season < offer.years() && remaining > 0; season++) {
            long covered = Math.min(remaining, offer.baseSalaryPerYear().get(season));
            layout[season] = covered;
            remaining -= covered;
        }
        return layout;
    }

    private static long sum(List<Long> amounts) {
        long total = 0;
        for (long amount : amounts) {
            total += amount;
        }
        return total;
    }
}
