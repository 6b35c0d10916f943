package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.franchiseplatform.common.contract.ContractOffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable snapshot of one player's negotiation window, keyed by {@code playerId}.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 *   <li>Created once by {@code NegotiationEngine.beginNegotiation} in round 1.</li>
 *   <li>Replaced by a successor value after every offer or shadow-advisor answer;
 *       an instance handed to a caller never changes.</li>
 *   <li>Removed from the engine when the signing is committed, the session is
 *       abandoned, or the negotiation window closes.</li>
 * </ol>
 *
 * <h3>Fields</h3>
 * <ul>
 *   <li>{@code state}: exactly one of the {@link SessionState} phases</li>
 *   <li>{@code teamContext}: context captured at begin, refreshed when the caller supplies one</li>
 *   <li>{@code lowballStrikes}: offers rejected below the near-miss band</li>
 *   <li>{@code angryRejectionStreak}: consecutive rejections that left the agent ANGRY</li>
 *   <li>{@code lastOffer}: nullable; most recent offer evaluated</li>
 *   <li>{@code lastCounterOffer}: nullable; most recent counter-offer the agent made</li>
 *   <li>{@code shadowReports}: shadow approaches the team reported; the agent holds them against it</li>
 * </ul>
 */
public record NegotiationSession(
    @JsonProperty("playerId")             String           playerId,
    @JsonProperty("playerName")           String           playerName,
    @JsonProperty("playerAge")            int              playerAge,
    @JsonProperty("agent")                Agent            agent,
    @JsonProperty("agentMood")            AgentMood        agentMood,
    @JsonProperty("marketValue")          long             marketValue,
    @JsonProperty("negotiationRound")     int              negotiationRound,
    @JsonProperty("leverage")             Leverage         leverage,
    @JsonProperty("teamContext")          TeamContext      teamContext,
    @JsonProperty("sessionState")         SessionState     state,
    @JsonProperty("pressLeaks")           List<PressLeak>  pressLeaks,
    @JsonProperty("lowballStrikes")       int              lowballStrikes,
    @JsonProperty("angryRejectionStreak") int              angryRejectionStreak,
    @JsonProperty("lastOffer")            ContractOffer    lastOffer,
    @JsonProperty("lastCounterOffer")     ContractOffer    lastCounterOffer,
    @JsonProperty("shadowReports")        int              shadowReports
) {

    public NegotiationSession {
        pressLeaks = pressLeaks == null ? List.of() : List.copyOf(pressLeaks);
        state = state == null ? SessionState.normal() : state;
    }

    /**
     * Opening snapshot for a freshly begun negotiation.
     */
    public static NegotiationSession open(String playerId, String playerName, int playerAge,
                                          Agent agent, AgentMood mood, long marketValue,
                                          Leverage leverage, TeamContext teamContext) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, mood, marketValue,
            1, leverage, teamContext, SessionState.normal(), List.of(), 0, 0, null, null, 0);
    }

    // ── derived views ────────────────────────────────────────────────────────

    @JsonIgnore
    public boolean isLockedOut() {
        return state instanceof SessionState.LockedOut;
    }

    @JsonIgnore
    public boolean isAccepted() {
        return state instanceof SessionState.Accepted;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Optional<String> lockoutReason() {
        return state instanceof SessionState.LockedOut locked
            ? Optional.of(locked.reason())
            : Optional.empty();
    }

    public OptionalInt phoneDeadUntilRound() {
        return state instanceof SessionState.PhoneDead dead
            ? OptionalInt.of(dead.untilRound())
            : OptionalInt.empty();
    }

    @JsonIgnore
    public boolean isPhoneDead() {
        return state instanceof SessionState.PhoneDead dead && dead.isActiveAt(negotiationRound);
    }

    public Optional<ShadowAdvisorEvent> pendingShadowEvent() {
        return state instanceof SessionState.ShadowPending pending
            ? Optional.of(pending.event())
            : Optional.empty();
    }

    // ── copy-factories ───────────────────────────────────────────────────────

    public NegotiationSession withState(SessionState state) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    public NegotiationSession withMood(AgentMood agentMood) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    public NegotiationSession withLeverage(Leverage leverage) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    public NegotiationSession withMarketValue(long marketValue) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    public NegotiationSession withTeamContext(TeamContext teamContext) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    public NegotiationSession withAngryRejectionStreak(int angryRejectionStreak) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    /** Advances the round counter only; used for calls that short-circuit. */
    public NegotiationSession nextRound() {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound + 1, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    /** Records one more reported shadow approach. */
    public NegotiationSession withShadowReport() {
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports + 1);
    }

    public NegotiationSession withPressLeak(PressLeak leak) {
        List<PressLeak> leaks = new ArrayList<>(pressLeaks);
        leaks.add(leak);
        return new NegotiationSession(playerId, playerName, playerAge, agent, agentMood, marketValue,
            negotiationRound, leverage, teamContext, state, leaks,
            lowballStrikes, angryRejectionStreak, lastOffer, lastCounterOffer, shadowReports);
    }

    /**
     * Successor after an evaluated offer: next round, new mood and leverage, updated
     * strike counters and offer history. The original instance is never mutated.
     */
    public NegotiationSession afterEvaluatedRound(AgentMood mood,
                                                  Leverage leverage,
                                                  SessionState state,
                                                  int lowballStrikes,
                                                  int angryRejectionStreak,
                                                  ContractOffer offer,
                                                  ContractOffer counterOffer) {
        return new NegotiationSession(playerId, playerName, playerAge, agent, mood, marketValue,
            negotiationRound + 1, leverage, teamContext, state, pressLeaks,
            lowballStrikes, angryRejectionStreak, offer,
            counterOffer != null ? counterOffer : lastCounterOffer, shadowReports);
    }
}
