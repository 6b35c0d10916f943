package com.franchiseplatform.common.event;

import com.franchiseplatform.common.contract.ContractEconomics;
import com.franchiseplatform.common.engine.NegotiationPolicy;
import com.franchiseplatform.common.evaluation.OfferEvaluation;
import com.franchiseplatform.common.model.Agent;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.AgentMood;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.PressLeak;
import com.franchiseplatform.common.model.SessionState;
import com.franchiseplatform.common.model.ShadowAdvisorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Decides which special events fire after a round. All probability rolls come from
 * the injected {@link Random}, so a fixed seed replays the same event sequence.
 *
 * <p>After an evaluated offer, checks run in this order, each gated on its own:
 * <ol>
 *   <li><b>Press leak</b>: past {@code pressLeakMinRound}, more likely as mood sours
 *       and rounds pile up. Appends to {@code pressLeaks}.</li>
 *   <li><b>Phone dead</b>: after a streak of rejections that left the agent ANGRY.
 *       Patient agents need one extra rejection.</li>
 *   <li><b>Shadow advisor</b>: rare, needs high agent leverage, weighted by archetype.</li>
 *   <li><b>Lockout</b>: deterministic: round cap exceeded, lowball tolerance reached,
 *       or a shadow approach left unanswered past its deadline.</li>
 * </ol>
 * After a short-circuited call only the lockout check runs, so a dead phone never
 * produces leaks or approaches.
 */
public class EventScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventScheduler.class);

    private static final double PATIENT_AGENT = 0.70;

    private static final List<String> SHADOW_ADVISORS = List.of(
        "Cousin Ray", "Coach Dupree", "A former teammate", "His business manager");

    private final NegotiationPolicy policy;
    private final Random random;

    public EventScheduler(NegotiationPolicy policy, Random random) {
        this.policy = policy;
        this.random = random;
    }

    /** Scheduler output: the successor session plus what fired, in firing order. */
    public record Result(NegotiationSession session, List<NegotiationEvent> events) {
        public Result {
            events = List.copyOf(events);
        }
    }

    /**
     * Runs every check after an offer was actually evaluated. {@code session} is the
     * successor already advanced by the evaluation.
     */
    public Result afterEvaluation(NegotiationSession session, OfferEvaluation evaluation) {
        List<NegotiationEvent> events = new ArrayList<>();
        if (session.isTerminal()) {
            return new Result(session, events);
        }

        session = maybeLeak(session, evaluation, events);
        session = maybePhoneDead(session, events);
        session = maybeShadowAdvisor(session, events);
        session = checkLockout(session, events);
        return new Result(session, events);
    }

    /** Deterministic lockout check only, for calls that never reached evaluation. */
    public Result afterShortCircuit(NegotiationSession session) {
        List<NegotiationEvent> events = new ArrayList<>();
        if (session.isTerminal()) {
            return new Result(session, events);
        }
        return new Result(checkLockout(session, events), events);
    }

    // ── press leak ───────────────────────────────────────────────────────────

    private NegotiationSession maybeLeak(NegotiationSession session, OfferEvaluation evaluation,
                                         List<NegotiationEvent> events) {
        int round = session.negotiationRound();
        if (round <= policy.pressLeakMinRound() || session.lastOffer() == null) {
            return session;
        }
        double chance = pressLeakChance(session.agent(), session.agentMood(), round);
        if (random.nextDouble() >= chance) {
            return session;
        }

        double offerAmount = ContractEconomics.averagePerYear(session.lastOffer());
        String headline = PressHeadlines.headline(session.playerName(), session.teamContext().teamName(),
            session.agentMood(), offerAmount, session.marketValue(), random);
        PressLeak leak = new PressLeak(round, headline, offerAmount, session.marketValue());

        log.info("[EventScheduler] Press leak. playerId={} round={} outcome={} headline='{}'",
            session.playerId(), round, evaluation.outcome(), headline);
        events.add(new NegotiationEvent.PressLeakPublished(session.playerId(), round, leak));
        return session.withPressLeak(leak);
    }

    /** {@code base × moodFactor × archetype affinity + slope × rounds past the minimum}, capped. */
    double pressLeakChance(Agent agent, AgentMood mood, int round) {
        double moodFactor = switch (mood) {
            case ANGRY      -> 3.0;
            case NEUTRAL    -> 1.5;
            case INTERESTED -> 0.5;
            case EXCITED    -> 0.0;
        };
        double chance = policy.pressLeakBaseChance() * moodFactor * agent.archetype().pressLeakAffinity()
            + policy.pressLeakRoundSlope() * (round - policy.pressLeakMinRound());
        return Math.max(0.0, Math.min(policy.pressLeakMaxChance(), chance));
    }

    // ── phone dead ───────────────────────────────────────────────────────────

    private NegotiationSession maybePhoneDead(NegotiationSession session, List<NegotiationEvent> events) {
        if (!(session.state() instanceof SessionState.Normal)) {
            return session;
        }
        int needed = policy.phoneDeadRejectionStreak()
            + (session.agent().patience() >= PATIENT_AGENT ? 1 : 0);
        if (session.angryRejectionStreak() < needed) {
            return session;
        }

        int round = session.negotiationRound();
        int until = round + policy.phoneDeadCooldownRounds();
        log.info("[EventScheduler] Agent went dark. playerId={} round={} untilRound={}",
            session.playerId(), round, until);
        events.add(new NegotiationEvent.PhoneWentDead(session.playerId(), round, until));
        return session.withState(new SessionState.PhoneDead(until)).withAngryRejectionStreak(0);
    }

    // ── shadow advisor ───────────────────────────────────────────────────────

    private NegotiationSession maybeShadowAdvisor(NegotiationSession session, List<NegotiationEvent> events) {
        if (!(session.state() instanceof SessionState.Normal)
                || session.leverage().agentLeverage() < policy.shadowAdvisorLeverageGate()) {
            return session;
        }
        AgentArchetype archetype = session.agent().archetype();
        double chance = policy.shadowAdvisorBaseChance() * archetype.shadowAdvisorAffinity();
        if (random.nextDouble() >= chance) {
            return session;
        }

        int round = session.negotiationRound();
        ShadowAdvisorEvent approach = new ShadowAdvisorEvent(
            SHADOW_ADVISORS.get(random.nextInt(SHADOW_ADVISORS.size())),
            session.playerName(),
            Math.round(session.marketValue() * policy.shadowDemandMultiplier()),
            round + policy.shadowResponseWindowRounds());

        log.info("[EventScheduler] Shadow advisor approach. playerId={} round={} advisor='{}' demand={} deadline={}",
            session.playerId(), round, approach.advisorName(), approach.demand(), approach.deadlineRound());
        events.add(new NegotiationEvent.ShadowAdvisorApproached(session.playerId(), round, approach));
        return session.withState(new SessionState.ShadowPending(approach));
    }

    // ── lockout ──────────────────────────────────────────────────────────────

    private NegotiationSession checkLockout(NegotiationSession session, List<NegotiationEvent> events) {
        Optional<String> reason = lockoutReason(session);
        if (reason.isEmpty()) {
            return session;
        }
        int round = session.negotiationRound();
        log.info("[EventScheduler] Negotiations locked out. playerId={} round={} reason='{}'",
            session.playerId(), round, reason.get());
        events.add(new NegotiationEvent.NegotiationsLockedOut(session.playerId(), round, reason.get()));
        return session.withState(new SessionState.LockedOut(reason.get()));
    }

    Optional<String> lockoutReason(NegotiationSession session) {
        if (session.negotiationRound() > policy.maxRounds()) {
            return Optional.of("talks dragged past " + policy.maxRounds() + " rounds");
        }
        if (session.lowballStrikes() >= session.agent().archetype().lowballTolerance()) {
            return Optional.of("too many lowball offers (" + session.lowballStrikes() + ")");
        }
        Optional<ShadowAdvisorEvent> pending = session.pendingShadowEvent();
        if (pending.isPresent() && session.negotiationRound() > pending.get().deadlineRound()) {
            return Optional.of("shadow advisor approach from " + pending.get().advisorName() + " was mishandled");
        }
        return Optional.empty();
    }
}
