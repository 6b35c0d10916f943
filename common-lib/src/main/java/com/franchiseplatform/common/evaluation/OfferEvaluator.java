package com.franchiseplatform.common.evaluation;

import com.franchiseplatform.common.contract.ContractEconomics;
import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.engine.NegotiationPolicy;
import com.franchiseplatform.common.model.Agent;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.AgentMood;
import com.franchiseplatform.common.model.Leverage;
import com.franchiseplatform.common.model.NegotiationOutcome;
import com.franchiseplatform.common.model.NegotiationResponse;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.SessionState;
import com.franchiseplatform.common.model.TeamContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The agent's accept / counter / reject decision for one offer.
 *
 * <p>Checks run in a fixed order and the first that applies decides the outcome:
 * <ol>
 *   <li>locked out → {@code LOCKED_OUT}</li>
 *   <li>deal already agreed → {@code ALREADY_AGREED}</li>
 *   <li>phone dead for this round → {@code PHONE_DEAD}</li>
 *   <li>term longer than the agent allows → {@code TERM_TOO_LONG}</li>
 *   <li>year-one cap hit above cap space → {@code CAP_INFEASIBLE}</li>
 *   <li>fit ≥ threshold → {@code ACCEPTED}</li>
 *   <li>fit ≥ near-miss floor → {@code COUNTERED}</li>
 *   <li>otherwise → {@code REJECTED}, a lowball strike</li>
 * </ol>
 * {@code fit = averagePerYear / marketValue}. Leverage is read from the session, so the
 * caller refreshes it before evaluating. Pure: no session is modified here.
 */
public final class OfferEvaluator {

    private static final double VOLATILE_AGENT = 0.65;
    private static final double MAX_AGENT_LEVERAGE_SHIFT = 0.01;
    private static final int    OPEN_STARTING_SPOT_DEPTH = 1;

    private final NegotiationPolicy policy;

    public OfferEvaluator(NegotiationPolicy policy) {
        this.policy = policy;
    }

    public OfferEvaluation evaluate(NegotiationSession session, ContractOffer offer, TeamContext team) {
        AgentMood mood = session.agentMood();
        Agent agent = session.agent();

        // ── short circuits ───────────────────────────────────────────────────
        if (session.isLockedOut()) {
            String reason = session.lockoutReason().orElse("negotiations terminated");
            return OfferEvaluation.shortCircuit(NegotiationResponse.declined(
                NegotiationOutcome.LOCKED_OUT, mood, "Negotiations terminated: " + reason));
        }
        if (session.state() instanceof SessionState.Accepted) {
            return OfferEvaluation.shortCircuit(NegotiationResponse.declined(
                NegotiationOutcome.ALREADY_AGREED, mood, "We already have a deal. Send the paperwork."));
        }
        if (session.isPhoneDead()) {
            int until = session.phoneDeadUntilRound().orElse(session.negotiationRound());
            return OfferEvaluation.shortCircuit(NegotiationResponse.declined(
                NegotiationOutcome.PHONE_DEAD, mood,
                agent.name() + " is not taking calls until round " + until + "."));
        }

        // ── hard limits ──────────────────────────────────────────────────────
        if (offer.years() > agent.maxContractLength()) {
            AgentMood next = floorMood(agent, mood.stepToward(AgentMood.ANGRY));
            return new OfferEvaluation(NegotiationResponse.declined(NegotiationOutcome.TERM_TOO_LONG, next,
                "My client won't commit to more than " + agent.maxContractLength() + " years."),
                Double.NaN, Double.NaN, Double.NaN, false);
        }
        double capHit = ContractEconomics.capHitYear1(offer);
        if (capHit > team.capSpace()) {
            return new OfferEvaluation(NegotiationResponse.declined(NegotiationOutcome.CAP_INFEASIBLE, mood,
                "Cap infeasible: a year-one cap hit of " + money(capHit)
                    + " does not fit in " + money(team.capSpace()) + " of cap space."),
                Double.NaN, Double.NaN, Double.NaN, false);
        }

        // ── scoring ──────────────────────────────────────────────────────────
        double fit = fit(offer, session.marketValue());
        double threshold = acceptanceThreshold(agent, mood, session.leverage(), offer, team);
        double floor = nearMissFloor(agent);

        if (fit >= threshold) {
            return new OfferEvaluation(NegotiationResponse.accepted(AgentMood.EXCITED, acceptLine(agent)),
                fit, threshold, floor, false);
        }
        if (fit >= floor) {
            ContractOffer counter = counterOffer(session, offer, threshold);
            AgentMood next = mood.stepToward(AgentMood.INTERESTED);
            return new OfferEvaluation(NegotiationResponse.countered(next,
                "Close, but not there yet. We need " + money(ContractEconomics.averagePerYear(counter))
                    + " per year.", counter),
                fit, threshold, floor, false);
        }

        int steps = agent.moodVolatility() >= VOLATILE_AGENT ? 2 : 1;
        AgentMood next = floorMood(agent, mood.worsen(steps));
        return new OfferEvaluation(NegotiationResponse.declined(NegotiationOutcome.REJECTED, next, rejectLine(agent)),
            fit, threshold, floor, true);
    }

    // ── thresholds ───────────────────────────────────────────────────────────

    public static double fit(ContractOffer offer, long marketValue) {
        return ContractEconomics.averagePerYear(offer) / Math.max(1L, marketValue);
    }

    /**
     * Minimum fit the agent accepts:
     * base + archetype offset + mood offset + leverage shift
     * − contender discount + guarantee adjustment, clamped to the policy range.
     * The leverage shift is {@code weight × (agent − user leverage)}; an agent-side
     * advantage raises the threshold by at most {@value #MAX_AGENT_LEVERAGE_SHIFT}.
     * The discount also applies when the archetype prizes a starting spot and the
     * position depth leaves one open.
     */
    public double acceptanceThreshold(Agent agent, AgentMood mood, Leverage leverage,
                                      ContractOffer offer, TeamContext team) {
        AgentArchetype archetype = agent.archetype();
        double leverageShift = Math.min(MAX_AGENT_LEVERAGE_SHIFT,
            policy.leverageThresholdWeight() * (leverage.agentLeverage() - leverage.userLeverage()));
        double threshold = policy.baseAcceptanceThreshold()
            + archetype.thresholdOffset()
            + moodOffset(mood)
            + leverageShift;

        boolean startingSpot = archetype.prizesStartingSpot() && team.positionDepth() <= OPEN_STARTING_SPOT_DEPTH;
        if (team.isContender() || startingSpot) {
            threshold -= archetype.contenderDiscount();
        }
        threshold += guaranteeAdjustment(archetype, ContractEconomics.guaranteedPercentage(offer));

        return Math.max(policy.minAcceptanceThreshold(), Math.min(policy.maxAcceptanceThreshold(), threshold));
    }

    /** Lowest fit that still earns a counter; patient agents tolerate a wider band. */
    public double nearMissFloor(Agent agent) {
        return agent.archetype().nearMissFloor() - policy.patienceBandWidening() * agent.patience();
    }

    private static double moodOffset(AgentMood mood) {
        return switch (mood) {
            case EXCITED    -> -0.03;
            case INTERESTED -> -0.01;
            case NEUTRAL    ->  0.0;
            case ANGRY      ->  0.04;
        };
    }

    private static double guaranteeAdjustment(AgentArchetype archetype, double guaranteePct) {
        return switch (archetype) {
            case SHARK            -> 0.0;
            case BRAND_BUILDER    -> guaranteePct >= 0.60 ? -0.02 : 0.0;
            case FAMILY_FRIEND    -> guaranteePct >= 0.50 ? -0.01 : 0.0;
            case SELF_REPRESENTED -> 0.0;
        };
    }

    // ── counter-offer ────────────────────────────────────────────────────────

    /**
     * Same term, average per year moved to {@code marketValue × threshold}. The signing
     * bonus is kept and base salary spread evenly with the rounding remainder in the
     * final year. Guarantees rise with the total, never below the original amount or
     * the archetype's guarantee floor.
     */
    ContractOffer counterOffer(NegotiationSession session, ContractOffer offer, double threshold) {
        int years = offer.years();
        long targetTotal = Math.round(session.marketValue() * threshold) * years;
        long bonus = Math.min(offer.signingBonus(), targetTotal);
        long baseTotal = Math.max(0L, targetTotal - bonus);

        long perYear = baseTotal / years;
        List<Long> base = new ArrayList<>(years);
        for (int i = 0; i < years; i++) {
            base.add(perYear);
        }
        base.set(years - 1, perYear + (baseTotal - perYear * years));

        long total = baseTotal + bonus;
        double pct = ContractEconomics.guaranteedPercentage(offer);
        long guaranteed = Math.max(Math.round(pct * total), offer.guaranteedMoney());
        guaranteed = Math.max(guaranteed, Math.round(session.agent().archetype().counterGuaranteeFloor() * total));
        guaranteed = Math.min(guaranteed, total);

        return new ContractOffer(
            offer.id() + "-counter-" + session.negotiationRound(),
            years, base, bonus, guaranteed,
            offer.ltbeIncentives(), offer.nltbeIncentives(),
            offer.voidYears(), offer.offsetLanguage());
    }

    // ── mood and messages ────────────────────────────────────────────────────

    private static AgentMood floorMood(Agent agent, AgentMood mood) {
        if (!agent.archetype().canAnger() && mood.isWorseThan(AgentMood.NEUTRAL)) {
            return AgentMood.NEUTRAL;
        }
        return mood;
    }

    private static String acceptLine(Agent agent) {
        return switch (agent.archetype()) {
            case SHARK            -> "You've got yourself a deal. My client is ready to sign.";
            case FAMILY_FRIEND    -> "This feels right for the family. We accept.";
            case BRAND_BUILDER    -> "Great fit for the brand. Let's make it official.";
            case SELF_REPRESENTED -> "The numbers work. I accept.";
        };
    }

    private static String rejectLine(Agent agent) {
        return switch (agent.archetype()) {
            case SHARK            -> "That's insulting. Call me when you're serious.";
            case FAMILY_FRIEND    -> "We appreciate the interest, but that's well short of what he's worth.";
            case BRAND_BUILDER    -> "That number doesn't reflect his market. We'll pass.";
            case SELF_REPRESENTED -> "The offer is below my valuation. Rejected.";
        };
    }

    static String money(double amount) {
        return String.format(Locale.ROOT, "$%.1fM", amount / 1_000_000.0);
    }
}
