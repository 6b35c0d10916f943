package com.franchiseplatform.common.engine;

import com.franchiseplatform.common.agent.AgentProfileFactory;
import com.franchiseplatform.common.agent.MarketValueCalculator;
import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.evaluation.OfferEvaluation;
import com.franchiseplatform.common.evaluation.OfferEvaluator;
import com.franchiseplatform.common.event.EventScheduler;
import com.franchiseplatform.common.exception.NegotiationException;
import com.franchiseplatform.common.exception.SessionNotFoundException;
import com.franchiseplatform.common.leverage.LeverageModel;
import com.franchiseplatform.common.model.Agent;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.AgentMood;
import com.franchiseplatform.common.model.Leverage;
import com.franchiseplatform.common.model.NegotiationOutcome;
import com.franchiseplatform.common.model.NegotiationResponse;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.PlayerProfile;
import com.franchiseplatform.common.model.SessionState;
import com.franchiseplatform.common.model.ShadowAdvisorAction;
import com.franchiseplatform.common.model.ShadowAdvisorEvent;
import com.franchiseplatform.common.model.TeamContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the session registry and sequences one negotiation round:
 * <pre>
 *   LeverageModel → OfferEvaluator → EventScheduler → registry
 * </pre>
 *
 * <p>Every round builds a new immutable {@link NegotiationSession} and swaps it into the
 * registry only once evaluation and scheduling have both finished, so a failure
 * part-way leaves the previous session in place. At most one session exists per
 * player id.
 *
 * <p>Round accounting:
 * <ul>
 *   <li>Locked-out and agreed sessions absorb offers unchanged.</li>
 *   <li>While the agent's phone is dead the round advances without evaluation, so
 *       the cooldown elapses, and only the deterministic lockout check runs.</li>
 *   <li>Otherwise leverage is recomputed from the offer, the offer evaluated, the
 *       round advanced and the scheduler run.</li>
 * </ul>
 */
public class NegotiationEngine {

    private static final Logger log = LoggerFactory.getLogger(NegotiationEngine.class);

    private final NegotiationPolicy   policy;
    private final AgentProfileFactory profileFactory;
    private final LeverageModel       leverageModel;
    private final OfferEvaluator      evaluator;
    private final EventScheduler      scheduler;

    private final Map<String, NegotiationSession> sessions = new ConcurrentHashMap<>();

    public NegotiationEngine(NegotiationPolicy policy,
                             AgentProfileFactory profileFactory,
                             LeverageModel leverageModel,
                             OfferEvaluator evaluator,
                             EventScheduler scheduler) {
        this.policy         = policy;
        this.profileFactory = profileFactory;
        this.leverageModel  = leverageModel;
        this.evaluator      = evaluator;
        this.scheduler      = scheduler;
    }

    public NegotiationEngine(NegotiationPolicy policy, Random random) {
        this(policy,
             new AgentProfileFactory(),
             new LeverageModel(policy),
             new OfferEvaluator(policy),
             new EventScheduler(policy, random));
    }

    // ── begin ────────────────────────────────────────────────────────────────

    public NegotiationSession beginNegotiation(PlayerProfile player, long capSpace,
                                               int positionDepth, boolean isContender) {
        return beginNegotiation(player, TeamContext.of(capSpace, positionDepth, isContender));
    }

    /**
     * Opens a session for {@code player} unless one already exists, in which case the
     * existing session is returned untouched.
     */
    public NegotiationSession beginNegotiation(PlayerProfile player, TeamContext team) {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(team, "team");

        NegotiationSession existing = sessions.get(player.id());
        if (existing != null) {
            log.debug("[NegotiationEngine] Session already open. playerId={} round={}",
                player.id(), existing.negotiationRound());
            return existing;
        }
        return sessions.computeIfAbsent(player.id(), id -> open(player, team));
    }

    private NegotiationSession open(PlayerProfile player, TeamContext team) {
        Agent agent = profileFactory.createAgent(player);
        long marketValue = MarketValueCalculator.resolve(player);
        AgentMood mood = initialMood(agent, team);

        NegotiationSession session = NegotiationSession.open(player.id(), player.fullName(), player.age(),
            agent, mood, marketValue, Leverage.balanced(), team);
        session = session.withLeverage(leverageModel.computeOpeningLeverage(session, team));

        log.info("[NegotiationEngine] Session opened. playerId={} agent='{}' archetype={} marketValue={} mood={}",
            player.id(), agent.name(), agent.archetype(), marketValue, mood);
        return session;
    }

    static AgentMood initialMood(Agent agent, TeamContext team) {
        return agent.archetype() == AgentArchetype.FAMILY_FRIEND && team.isContender()
            ? AgentMood.INTERESTED
            : AgentMood.NEUTRAL;
    }

    // ── offers ───────────────────────────────────────────────────────────────

    /** Evaluates {@code offer} against the team context captured when the session opened. */
    public NegotiationResponse submitOffer(String playerId, ContractOffer offer) {
        return negotiate(playerId, offer, null).response();
    }

    public NegotiationResponse submitOffer(String playerId, ContractOffer offer, TeamContext team) {
        return negotiate(playerId, offer, team).response();
    }

    /**
     * One full round. {@code team} may be null to reuse the session's stored context.
     *
     * @throws SessionNotFoundException when no session is open for {@code playerId}
     */
    public NegotiationRound negotiate(String playerId, ContractOffer offer, TeamContext team) {
        Objects.requireNonNull(offer, "offer");
        NegotiationSession before = requireSession(playerId);

        if (before.isTerminal()) {
            NegotiationResponse response = evaluator.evaluate(before, offer, before.teamContext()).response();
            log.debug("[NegotiationEngine] Offer absorbed by terminal session. playerId={} outcome={}",
                playerId, response.outcome());
            return new NegotiationRound(before, before, response, List.of());
        }

        NegotiationSession working = team != null ? before.withTeamContext(team) : before;
        TeamContext context = working.teamContext();

        NegotiationResponse response;
        EventScheduler.Result scheduled;
        if (working.isPhoneDead()) {
            response = evaluator.evaluate(working, offer, context).response();
            scheduled = scheduler.afterShortCircuit(working.nextRound());
        } else {
            Leverage leverage = leverageModel.computeLeverage(working, offer, context);
            NegotiationSession scored = working.withLeverage(leverage);
            OfferEvaluation evaluation = evaluator.evaluate(scored, offer, context);
            response = evaluation.response();

            log.debug("[NegotiationEngine] Offer scored. playerId={} round={} fit={} threshold={} "
                    + "userLeverage={} agentLeverage={} outcome={}",
                playerId, scored.negotiationRound(), evaluation.fit(), evaluation.threshold(),
                leverage.userLeverage(), leverage.agentLeverage(), response.outcome());

            NegotiationSession advanced = scored.afterEvaluatedRound(
                response.newMood(),
                leverage,
                nextState(scored.state(), response, offer),
                scored.lowballStrikes() + (evaluation.lowballStrike() ? 1 : 0),
                nextAngryStreak(scored.angryRejectionStreak(), evaluation),
                offer,
                response.counterOffer());
            scheduled = scheduler.afterEvaluation(advanced, evaluation);
        }

        NegotiationSession after = scheduled.session();
        sessions.put(playerId, after);

        if (response.accepted()) {
            log.info("[NegotiationEngine] Offer accepted. playerId={} offerId={} round={}",
                playerId, offer.id(), before.negotiationRound());
        }
        return new NegotiationRound(before, after, response, scheduled.events());
    }

    private static SessionState nextState(SessionState current, NegotiationResponse response, ContractOffer offer) {
        if (response.accepted()) {
            return new SessionState.Accepted(offer.id());
        }
        if (current instanceof SessionState.PhoneDead) {
            return SessionState.normal();
        }
        return current;
    }

    private static int nextAngryStreak(int streak, OfferEvaluation evaluation) {
        if (evaluation.outcome() == NegotiationOutcome.CAP_INFEASIBLE) {
            return streak;
        }
        return evaluation.isRejection() && evaluation.response().newMood() == AgentMood.ANGRY
            ? streak + 1
            : 0;
    }

    // ── shadow advisor ───────────────────────────────────────────────────────

    /**
     * Answers a pending shadow-advisor approach. Does nothing when none is pending.
     * <ul>
     *   <li>{@code ENGAGE} lifts the player's market value to the advisor's demand.</li>
     *   <li>{@code REPORT} improves the agent's mood one step but costs user leverage
     *       for the rest of the session.</li>
     * </ul>
     *
     * @throws SessionNotFoundException when no session is open for {@code playerId}
     */
    public NegotiationSession respondToShadowAdvisor(String playerId, ShadowAdvisorAction action) {
        Objects.requireNonNull(action, "action");
        NegotiationSession session = requireSession(playerId);

        Optional<ShadowAdvisorEvent> pending = session.pendingShadowEvent();
        if (pending.isEmpty()) {
            log.debug("[NegotiationEngine] No shadow approach pending. playerId={} action={}", playerId, action);
            return session;
        }

        NegotiationSession resolved = switch (action) {
            case ENGAGE -> session.withMarketValue(pending.get().demand());
            case REPORT -> session
                .withMood(session.agentMood().improve())
                .withShadowReport()
                .withLeverage(session.leverage().withUserLeverage(
                    session.leverage().userLeverage() - policy.shadowReportLeveragePenalty()));
        };
        resolved = resolved.withState(SessionState.normal());
        sessions.put(playerId, resolved);

        log.info("[NegotiationEngine] Shadow approach resolved. playerId={} action={} marketValue={} mood={}",
            playerId, action, resolved.marketValue(), resolved.agentMood());
        return resolved;
    }

    // ── registry ─────────────────────────────────────────────────────────────

    public Optional<NegotiationSession> getSession(String playerId) {
        return Optional.ofNullable(sessions.get(playerId));
    }

    /**
     * Removes an agreed session once the caller has committed the signing.
     *
     * @throws NegotiationException when the session has no agreed deal
     */
    public NegotiationSession completeSigning(String playerId) {
        NegotiationSession session = requireSession(playerId);
        if (!session.isAccepted()) {
            throw new NegotiationException(playerId, "no agreed deal to sign, state=" + session.state());
        }
        sessions.remove(playerId, session);
        log.info("[NegotiationEngine] Signing completed, session closed. playerId={}", playerId);
        return session;
    }

    /** Drops the session, if any. Returns whether one was open. */
    public boolean abandon(String playerId) {
        NegotiationSession removed = sessions.remove(playerId);
        if (removed != null) {
            log.info("[NegotiationEngine] Session abandoned. playerId={} round={}",
                playerId, removed.negotiationRound());
        }
        return removed != null;
    }

    /** Ends the negotiation window: every session is discarded. Returns how many were open. */
    public int closeWindow() {
        int closed = sessions.size();
        sessions.clear();
        log.info("[NegotiationEngine] Negotiation window closed. sessionsClosed={}", closed);
        return closed;
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public NegotiationPolicy policy() {
        return policy;
    }

    private NegotiationSession requireSession(String playerId) {
        NegotiationSession session = sessions.get(playerId);
        if (session == null) {
            log.warn("[NegotiationEngine] No active session. playerId={}", playerId);
            throw new SessionNotFoundException(playerId);
        }
        return session;
    }
}
