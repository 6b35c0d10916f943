package com.franchiseplatform.negotiation.service;

import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.engine.NegotiationEngine;
import com.franchiseplatform.common.engine.NegotiationRound;
import com.franchiseplatform.common.model.NegotiationResponse;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.Position;
import com.franchiseplatform.common.model.ShadowAdvisorAction;
import com.franchiseplatform.common.model.TeamContext;
import com.franchiseplatform.negotiation.finance.FinanceService;
import com.franchiseplatform.negotiation.finance.InsufficientCashException;
import com.franchiseplatform.negotiation.roster.RosterCommitService;
import com.franchiseplatform.negotiation.roster.SignedContract;
import com.franchiseplatform.negotiation.team.RosterLookupException;
import com.franchiseplatform.negotiation.team.RosterPlayer;
import com.franchiseplatform.negotiation.team.Team;
import com.franchiseplatform.negotiation.team.TeamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Front-office entry point for contract talks.
 *
 * <ol>
 *   <li>Builds a fresh {@link TeamContext} from the registry on every call.</li>
 *   <li>Refuses offers whose signing bonus the team cannot fund, before the engine
 *       sees them.</li>
 *   <li>On acceptance commits the signing to the roster and closes the session.</li>
 * </ol>
 */
@Service
public class NegotiationService {

    private static final Logger log = LoggerFactory.getLogger(NegotiationService.class);

    private final NegotiationEngine   engine;
    private final TeamRegistry        teamRegistry;
    private final FinanceService      financeService;
    private final RosterCommitService rosterCommitService;

    public NegotiationService(NegotiationEngine engine,
                              TeamRegistry teamRegistry,
                              FinanceService financeService,
                              RosterCommitService rosterCommitService) {
        this.engine              = engine;
        this.teamRegistry        = teamRegistry;
        this.financeService      = financeService;
        this.rosterCommitService = rosterCommitService;
    }

    public NegotiationSession openNegotiation(String teamId, String playerId) {
        Team team = requireTeam(teamId);
        RosterPlayer player = requirePlayer(playerId);
        return engine.beginNegotiation(player.toProfile(), teamContext(team, player.getPosition()));
    }

    /**
     * Submits {@code offer} on behalf of {@code teamId}. An accepted offer is committed
     * to the roster before the response is returned.
     *
     * @throws InsufficientCashException when the signing bonus is not affordable
     */
    public NegotiationResponse submitOffer(String teamId, String playerId, ContractOffer offer) {
        return negotiate(teamId, playerId, offer).response();
    }

    public NegotiationRound negotiate(String teamId, String playerId, ContractOffer offer) {
        Team team = requireTeam(teamId);
        RosterPlayer player = requirePlayer(playerId);

        if (!financeService.canAffordSigningBonus(teamId, offer.signingBonus())) {
            log.warn("[NegotiationService] Offer blocked, bonus unaffordable. teamId={} playerId={} bonus={}",
                teamId, playerId, offer.signingBonus());
            throw new InsufficientCashException(teamId, offer.signingBonus(),
                "signing bonus " + offer.signingBonus() + " exceeds what reserves can cover");
        }

        NegotiationRound round = engine.negotiate(playerId, offer, teamContext(team, player.getPosition()));
        round.events().forEach(event ->
            log.info("[NegotiationService] Event. playerId={} type={} round={}",
                playerId, event.eventType(), event.round()));

        if (round.response().accepted()) {
            SignedContract contract = rosterCommitService.commitSigning(playerId, offer, teamId);
            engine.completeSigning(playerId);
            log.info("[NegotiationService] Deal done. teamId={} playerId={} totalValue={}",
                teamId, playerId, contract.totalValue());
        }
        return round;
    }

    public NegotiationSession respondToShadowAdvisor(String playerId, ShadowAdvisorAction action) {
        return engine.respondToShadowAdvisor(playerId, action);
    }

    public Optional<NegotiationSession> getSession(String playerId) {
        return engine.getSession(playerId);
    }

    public boolean abandon(String playerId) {
        return engine.abandon(playerId);
    }

    public int closeNegotiationWindow() {
        return engine.closeWindow();
    }

    TeamContext teamContext(Team team, Position position) {
        int depth = (int) teamRegistry.findPlayersByTeam(team.getId()).stream()
            .filter(p -> p.getPosition() == position)
            .count();
        return new TeamContext(team.getName(), team.getCapSpace(), depth, team.isContender(),
            FinanceService.tierFor(team.getCashReserves()));
    }

    private Team requireTeam(String teamId) {
        return teamRegistry.findTeam(teamId)
            .orElseThrow(() -> new RosterLookupException("team", teamId));
    }

    private RosterPlayer requirePlayer(String playerId) {
        return teamRegistry.findPlayer(playerId)
            .orElseThrow(() -> new RosterLookupException("player", playerId));
    }
}
