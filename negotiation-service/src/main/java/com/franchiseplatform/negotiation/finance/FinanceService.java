package com.franchiseplatform.negotiation.finance;

import com.franchiseplatform.common.model.CashReserveTier;
import com.franchiseplatform.negotiation.team.RosterLookupException;
import com.franchiseplatform.negotiation.team.Team;
import com.franchiseplatform.negotiation.team.TeamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cash-side checks for signing bonuses.
 *
 * <h3>Reserve tiers</h3>
 * <ul>
 *   <li>&gt; 100M → WEALTHY</li>
 *   <li>&gt; 50M  → COMFORTABLE</li>
 *   <li>&gt; 10M  → TIGHT</li>
 *   <li>otherwise → CRISIS</li>
 * </ul>
 * A bonus is affordable outside CRISIS when it leaves more than 10M in reserve.
 */
@Service
public class FinanceService {

    private static final Logger log = LoggerFactory.getLogger(FinanceService.class);

    static final long WEALTHY_RESERVES     = 100_000_000L;
    static final long COMFORTABLE_RESERVES = 50_000_000L;
    static final long TIGHT_RESERVES       = 10_000_000L;
    static final long MINIMUM_RESERVE      = 10_000_000L;

    private final TeamRegistry teamRegistry;

    public FinanceService(TeamRegistry teamRegistry) {
        this.teamRegistry = teamRegistry;
    }

    public static CashReserveTier tierFor(long cashReserves) {
        if (cashReserves > WEALTHY_RESERVES)     return CashReserveTier.WEALTHY;
        if (cashReserves > COMFORTABLE_RESERVES) return CashReserveTier.COMFORTABLE;
        if (cashReserves > TIGHT_RESERVES)       return CashReserveTier.TIGHT;
        return CashReserveTier.CRISIS;
    }

    public CashReserveTier cashReserveTier(String teamId) {
        return tierFor(requireTeam(teamId).getCashReserves());
    }

    public boolean canAffordSigningBonus(String teamId, long signingBonus) {
        return canAfford(requireTeam(teamId), signingBonus);
    }

    /**
     * Pays {@code signingBonus} out of the team's reserves.
     *
     * @throws InsufficientCashException when the bonus is not affordable
     */
    public void applySigningBonus(String teamId, long signingBonus) {
        Team team = requireTeam(teamId);
        if (!canAfford(team, signingBonus)) {
            log.warn("[FinanceService] Signing bonus refused. teamId={} bonus={} reserves={}",
                teamId, signingBonus, team.getCashReserves());
            throw new InsufficientCashException(teamId, signingBonus,
                "cannot fund signing bonus " + signingBonus + " from reserves " + team.getCashReserves());
        }
        team.setCashReserves(team.getCashReserves() - signingBonus);
        teamRegistry.saveTeam(team);
        log.info("[FinanceService] Signing bonus paid. teamId={} bonus={} reservesLeft={}",
            teamId, signingBonus, team.getCashReserves());
    }

    private static boolean canAfford(Team team, long signingBonus) {
        if (signingBonus <= 0) return true;
        return tierFor(team.getCashReserves()) != CashReserveTier.CRISIS
            && team.getCashReserves() - signingBonus > MINIMUM_RESERVE;
    }

    private Team requireTeam(String teamId) {
        return teamRegistry.findTeam(teamId)
            .orElseThrow(() -> new RosterLookupException("team", teamId));
    }
}
