package com.franchiseplatform.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunable knobs of the negotiation engine. Immutable; start from {@link #defaults()}
 * and override with the {@code withX} copy-factories.
 */
public record NegotiationPolicy(
    // ── acceptance ───────────────────────────────────────────────────────────
    @JsonProperty("baseAcceptanceThreshold")     double baseAcceptanceThreshold,
    @JsonProperty("minAcceptanceThreshold")      double minAcceptanceThreshold,
    @JsonProperty("maxAcceptanceThreshold")      double maxAcceptanceThreshold,
    @JsonProperty("leverageThresholdWeight")     double leverageThresholdWeight,
    @JsonProperty("patienceBandWidening")        double patienceBandWidening,

    // ── press leaks ──────────────────────────────────────────────────────────
    @JsonProperty("pressLeakBaseChance")         double pressLeakBaseChance,
    @JsonProperty("pressLeakMinRound")           int    pressLeakMinRound,
    @JsonProperty("pressLeakRoundSlope")         double pressLeakRoundSlope,
    @JsonProperty("pressLeakMaxChance")          double pressLeakMaxChance,
    @JsonProperty("pressLeakLeverageStep")       double pressLeakLeverageStep,
    @JsonProperty("pressLeakLeverageCap")        double pressLeakLeverageCap,

    // ── phone dead ───────────────────────────────────────────────────────────
    @JsonProperty("phoneDeadRejectionStreak")    int    phoneDeadRejectionStreak,
    @JsonProperty("phoneDeadCooldownRounds")     int    phoneDeadCooldownRounds,

    // ── shadow advisor ───────────────────────────────────────────────────────
    @JsonProperty("shadowAdvisorBaseChance")     double shadowAdvisorBaseChance,
    @JsonProperty("shadowAdvisorLeverageGate")   double shadowAdvisorLeverageGate,
    @JsonProperty("shadowDemandMultiplier")      double shadowDemandMultiplier,
    @JsonProperty("shadowResponseWindowRounds")  int    shadowResponseWindowRounds,
    @JsonProperty("shadowReportLeveragePenalty") double shadowReportLeveragePenalty,

    // ── rounds ───────────────────────────────────────────────────────────────
    @JsonProperty("maxRounds")                   int    maxRounds,
    @JsonProperty("roundFatigueStep")            double roundFatigueStep,
    @JsonProperty("roundFatigueCap")             double roundFatigueCap
) {

    public NegotiationPolicy {
        if (minAcceptanceThreshold > maxAcceptanceThreshold) {
            throw new IllegalArgumentException("minAcceptanceThreshold must not exceed maxAcceptanceThreshold");
        }
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1, got " + maxRounds);
        }
        if (phoneDeadRejectionStreak < 1 || phoneDeadCooldownRounds < 1 || shadowResponseWindowRounds < 1) {
            throw new IllegalArgumentException("streak, cooldown and response window must be positive");
        }
    }

    public static NegotiationPolicy defaults() {
        return new NegotiationPolicy(
            0.95, 0.80, 1.10, 0.04, 0.04,
            0.10, 2, 0.03, 0.90, 0.05, 0.20,
            2, 2,
            0.05, 0.50, 1.15, 2, 0.05,
            12, 0.03, 0.15);
    }

    public NegotiationPolicy withMaxRounds(int maxRounds) {
        return new NegotiationPolicy(baseAcceptanceThreshold, minAcceptanceThreshold, maxAcceptanceThreshold,
            leverageThresholdWeight, patienceBandWidening,
            pressLeakBaseChance, pressLeakMinRound, pressLeakRoundSlope, pressLeakMaxChance,
            pressLeakLeverageStep, pressLeakLeverageCap,
            phoneDeadRejectionStreak, phoneDeadCooldownRounds,
            shadowAdvisorBaseChance, shadowAdvisorLeverageGate, shadowDemandMultiplier,
            shadowResponseWindowRounds, shadowReportLeveragePenalty,
            maxRounds, roundFatigueStep, roundFatigueCap);
    }

    public NegotiationPolicy withPressLeakBaseChance(double pressLeakBaseChance) {
        return new NegotiationPolicy(baseAcceptanceThreshold, minAcceptanceThreshold, maxAcceptanceThreshold,
            leverageThresholdWeight, patienceBandWidening,
            pressLeakBaseChance, pressLeakMinRound, pressLeakRoundSlope, pressLeakMaxChance,
            pressLeakLeverageStep, pressLeakLeverageCap,
            phoneDeadRejectionStreak, phoneDeadCooldownRounds,
            shadowAdvisorBaseChance, shadowAdvisorLeverageGate, shadowDemandMultiplier,
            shadowResponseWindowRounds, shadowReportLeveragePenalty,
            maxRounds, roundFatigueStep, roundFatigueCap);
    }

    public NegotiationPolicy withPressLeakRoundSlope(double pressLeakRoundSlope) {
        return new NegotiationPolicy(baseAcceptanceThreshold, minAcceptanceThreshold, maxAcceptanceThreshold,
            leverageThresholdWeight, patienceBandWidening,
            pressLeakBaseChance, pressLeakMinRound, pressLeakRoundSlope, pressLeakMaxChance,
            pressLeakLeverageStep, pressLeakLeverageCap,
            phoneDeadRejectionStreak, phoneDeadCooldownRounds,
            shadowAdvisorBaseChance, shadowAdvisorLeverageGate, shadowDemandMultiplier,
            shadowResponseWindowRounds, shadowReportLeveragePenalty,
            maxRounds, roundFatigueStep, roundFatigueCap);
    }

    public NegotiationPolicy withShadowAdvisorBaseChance(double shadowAdvisorBaseChance) {
        return new NegotiationPolicy(baseAcceptanceThreshold, minAcceptanceThreshold, maxAcceptanceThreshold,
            leverageThresholdWeight, patienceBandWidening,
            pressLeakBaseChance, pressLeakMinRound, pressLeakRoundSlope, pressLeakMaxChance,
            pressLeakLeverageStep, pressLeakLeverageCap,
            phoneDeadRejectionStreak, phoneDeadCooldownRounds,
            shadowAdvisorBaseChance, shadowAdvisorLeverageGate, shadowDemandMultiplier,
            shadowResponseWindowRounds, shadowReportLeveragePenalty,
            maxRounds, roundFatigueStep, roundFatigueCap);
    }

    public NegotiationPolicy withShadowAdvisorLeverageGate(double shadowAdvisorLeverageGate) {
        return new NegotiationPolicy(baseAcceptanceThreshold, minAcceptanceThreshold, maxAcceptanceThreshold,
            leverageThresholdWeight, patienceBandWidening,
            pressLeakBaseChance, pressLeakMinRound, pressLeakRoundSlope, pressLeakMaxChance,
            pressLeakLeverageStep, pressLeakLeverageCap,
            phoneDeadRejectionStreak, phoneDeadCooldownRounds,
            shadowAdvisorBaseChance, shadowAdvisorLeverageGate, shadowDemandMultiplier,
            shadowResponseWindowRounds, shadowReportLeveragePenalty,
            maxRounds, roundFatigueStep, roundFatigueCap);
    }

    /** Disables both random events; deterministic lockouts and phone-dead still apply. */
    public NegotiationPolicy withoutRandomEvents() {
        return withPressLeakBaseChance(0.0).withPressLeakRoundSlope(0.0).withShadowAdvisorBaseChance(0.0);
    }
}
