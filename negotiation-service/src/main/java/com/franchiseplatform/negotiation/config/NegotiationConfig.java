package com.franchiseplatform.negotiation.config;

import com.franchiseplatform.common.engine.NegotiationEngine;
import com.franchiseplatform.common.engine.NegotiationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Binds {@code negotiation.*} properties into a {@link NegotiationPolicy} and exposes a
 * single engine instance. Every key falls back to the policy default.
 */
@Configuration
public class NegotiationConfig {

    private static final Logger log = LoggerFactory.getLogger(NegotiationConfig.class);

    // ── acceptance ───────────────────────────────────────────────────────────
    @Value("${negotiation.base-acceptance-threshold:0.95}")
    private double baseAcceptanceThreshold;

    @Value("${negotiation.min-acceptance-threshold:0.80}")
    private double minAcceptanceThreshold;

    @Value("${negotiation.max-acceptance-threshold:1.10}")
    private double maxAcceptanceThreshold;

    @Value("${negotiation.leverage-threshold-weight:0.04}")
    private double leverageThresholdWeight;

    @Value("${negotiation.patience-band-widening:0.04}")
    private double patienceBandWidening;

    // ── press leaks ──────────────────────────────────────────────────────────
    @Value("${negotiation.press-leak.base-chance:0.10}")
    private double pressLeakBaseChance;

    @Value("${negotiation.press-leak.min-round:2}")
    private int pressLeakMinRound;

    @Value("${negotiation.press-leak.round-slope:0.03}")
    private double pressLeakRoundSlope;

    @Value("${negotiation.press-leak.max-chance:0.90}")
    private double pressLeakMaxChance;

    @Value("${negotiation.press-leak.leverage-step:0.05}")
    private double pressLeakLeverageStep;

    @Value("${negotiation.press-leak.leverage-cap:0.20}")
    private double pressLeakLeverageCap;

    // ── phone dead ───────────────────────────────────────────────────────────
    @Value("${negotiation.phone-dead.rejection-streak:2}")
    private int phoneDeadRejectionStreak;

    @Value("${negotiation.phone-dead.cooldown-rounds:2}")
    private int phoneDeadCooldownRounds;

    // ── shadow advisor ───────────────────────────────────────────────────────
    @Value("${negotiation.shadow-advisor.base-chance:0.05}")
    private double shadowAdvisorBaseChance;

    @Value("${negotiation.shadow-advisor.leverage-gate:0.50}")
    private double shadowAdvisorLeverageGate;

    @Value("${negotiation.shadow-advisor.demand-multiplier:1.15}")
    private double shadowDemandMultiplier;

    @Value("${negotiation.shadow-advisor.response-window-rounds:2}")
    private int shadowResponseWindowRounds;

    @Value("${negotiation.shadow-advisor.report-leverage-penalty:0.05}")
    private double shadowReportLeveragePenalty;

    // ── rounds ───────────────────────────────────────────────────────────────
    @Value("${negotiation.max-rounds:12}")
    private int maxRounds;

    @Value("${negotiation.round-fatigue.step:0.03}")
    private double roundFatigueStep;

    @Value("${negotiation.round-fatigue.cap:0.15}")
    private double roundFatigueCap;

    @Value("${negotiation.random-seed:42}")
    private long randomSeed;

    @Bean
    public NegotiationPolicy negotiationPolicy() {
        return new NegotiationPolicy(
            baseAcceptanceThreshold, minAcceptanceThreshold, maxAcceptanceThreshold,
            leverageThresholdWeight, patienceBandWidening,
            pressLeakBaseChance, pressLeakMinRound, pressLeakRoundSlope, pressLeakMaxChance,
            pressLeakLeverageStep, pressLeakLeverageCap,
            phoneDeadRejectionStreak, phoneDeadCooldownRounds,
            shadowAdvisorBaseChance, shadowAdvisorLeverageGate, shadowDemandMultiplier,
            shadowResponseWindowRounds, shadowReportLeveragePenalty,
            maxRounds, roundFatigueStep, roundFatigueCap);
    }

    @Bean
    public NegotiationEngine negotiationEngine(NegotiationPolicy negotiationPolicy) {
        log.info("[NegotiationConfig] Engine ready. maxRounds={} baseThreshold={} randomSeed={}",
            negotiationPolicy.maxRounds(), negotiationPolicy.baseAcceptanceThreshold(), randomSeed);
        return new NegotiationEngine(negotiationPolicy, new Random(randomSeed));
    }
}
