package com.franchiseplatform.common.leverage;

import com.franchiseplatform.common.contract.ContractEconomics;
import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.engine.NegotiationPolicy;
import com.franchiseplatform.common.model.Agent;
import com.franchiseplatform.common.model.Leverage;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.TeamContext;

/**
 * Computes bilateral leverage for one round. Stateless: the result depends only on
 * the session's round, press-leak count and reported shadow approaches plus the given
 * offer and team context.
 *
 * <pre>
 * agent = 0.20
 *       + 0.25 × clamp((marketValue − capSpace) / marketValue)      cap squeeze
 *       + 0.25 × clamp((4 − positionDepth) / 4)                     scarcity
 *       + 0.10 if age ≤ 26, −0.10 if age ≥ 31                        career stage
 *       + archetype temperament
 *       + fatigue
 *
 * user  = 0.20
 *       + 0.30 × min(1, max(0, capSpace − capHitYear1) / marketValue)   cap margin
 *       + 0.20 × ringFactor if contender
 *       + min(leakCap, leakStep × pressLeaks)
 *       − reportPenalty × shadowReports                                 agent distrust
 *       + fatigue
 *
 * fatigue = min(fatigueCap, fatigueStep × (round − 1))
 * </pre>
 * Both sides are clamped to [0, 1] independently.
 */
public final class LeverageModel {

    private static final double BASE            = 0.20;
    private static final double CAP_SQUEEZE_W   = 0.25;
    private static final double SCARCITY_W      = 0.25;
    private static final int    DEEP_ROSTER     = 4;
    private static final double CAREER_STAGE_W  = 0.10;
    private static final double CAP_MARGIN_W    = 0.30;
    private static final double CONTENDER_W     = 0.20;

    private final NegotiationPolicy policy;

    public LeverageModel(NegotiationPolicy policy) {
        this.policy = policy;
    }

    public Leverage computeLeverage(NegotiationSession session, ContractOffer offer, TeamContext team) {
        double fatigue = fatigue(session.negotiationRound());
        return Leverage.clamped(
            userSide(session, ContractEconomics.capHitYear1(offer), team) + fatigue,
            agentSide(session, team) + fatigue);
    }

    /**
     * Leverage before any offer is on the table: the cap margin is measured against
     * a year-one hit equal to the player's market value.
     */
    public Leverage computeOpeningLeverage(NegotiationSession session, TeamContext team) {
        double fatigue = fatigue(session.negotiationRound());
        return Leverage.clamped(
            userSide(session, session.marketValue(), team) + fatigue,
            agentSide(session, team) + fatigue);
    }

    private double agentSide(NegotiationSession session, TeamContext team) {
        Agent agent = session.agent();
        double marketValue = Math.max(1.0, session.marketValue());

        double capSqueeze = unit((marketValue - team.capSpace()) / marketValue);
        double scarcity   = unit((DEEP_ROSTER - team.positionDepth()) / (double) DEEP_ROSTER);

        double careerStage = 0.0;
        if (session.playerAge() > 0 && session.playerAge() <= 26) {
            careerStage = CAREER_STAGE_W;
        } else if (session.playerAge() >= 31) {
            careerStage = -CAREER_STAGE_W;
        }

        return BASE
            + CAP_SQUEEZE_W * capSqueeze
            + SCARCITY_W * scarcity
            + careerStage
            + agent.archetype().temperament();
    }

    private double userSide(NegotiationSession session, double capHitYear1, TeamContext team) {
        double marketValue = Math.max(1.0, session.marketValue());
        double margin = Math.max(0.0, team.capSpace() - capHitYear1);

        double capMargin = Math.min(1.0, margin / marketValue);
        double ring = team.isContender() ? CONTENDER_W * session.agent().archetype().ringFactor() : 0.0;
        double leaks = Math.min(policy.pressLeakLeverageCap(),
            policy.pressLeakLeverageStep() * session.pressLeaks().size());

        double distrust = policy.shadowReportLeveragePenalty() * session.shadowReports();

        return BASE + CAP_MARGIN_W * capMargin + ring + leaks - distrust;
    }

    double fatigue(int round) {
        return Math.min(policy.roundFatigueCap(), policy.roundFatigueStep() * Math.max(0, round - 1));
    }

    private static double unit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
