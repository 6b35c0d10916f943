package com.franchiseplatform.negotiation.roster;

import com.franchiseplatform.common.contract.ContractEconomics;
import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.negotiation.finance.FinanceService;
import com.franchiseplatform.negotiation.team.RosterLookupException;
import com.franchiseplatform.negotiation.team.RosterPlayer;
import com.franchiseplatform.negotiation.team.Team;
import com.franchiseplatform.negotiation.team.TeamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an agreed offer into a roster contract: pays the bonus, books the year-one
 * cap hit and moves the player onto the team.
 */
@Service
public class RosterCommitService {

    private static final Logger log = LoggerFactory.getLogger(RosterCommitService.class);

    private final TeamRegistry   teamRegistry;
    private final FinanceService financeService;

    public RosterCommitService(TeamRegistry teamRegistry, FinanceService financeService) {
        this.teamRegistry   = teamRegistry;
        this.financeService = financeService;
    }

    public SignedContract commitSigning(String playerId, ContractOffer offer, String teamId) {
        RosterPlayer player = teamRegistry.findPlayer(playerId)
            .orElseThrow(() -> new RosterLookupException("player", playerId));
        Team team = teamRegistry.findTeam(teamId)
            .orElseThrow(() -> new RosterLookupException("team", teamId));

        SignedContract contract = toSignedContract(offer);

        // bonus first: a refusal leaves the cap books untouched
        financeService.applySigningBonus(teamId, offer.signingBonus());

        team = teamRegistry.findTeam(teamId).orElse(team);
        team.setCommittedCap(team.getCommittedCap() + contract.currentYearCap());
        teamRegistry.saveTeam(team);

        player.setTeamId(teamId);
        player.setContract(contract);
        teamRegistry.savePlayer(player);

        log.info("[RosterCommitService] Signing committed. playerId={} teamId={} totalValue={} years={} capHit={}",
            playerId, teamId, contract.totalValue(), contract.years(), contract.currentYearCap());
        return contract;
    }

    static SignedContract toSignedContract(ContractOffer offer) {
        return new SignedContract(
            offer.id(),
            ContractEconomics.totalValue(offer),
            offer.years(),
            offer.guaranteedMoney(),
            Math.round(ContractEconomics.capHitYear1(offer)),
            offer.signingBonus(),
            ContractEconomics.ltbeTotal(offer),
            Math.round(ContractEconomics.deadCapOnRelease(offer, 0)));
    }
}
