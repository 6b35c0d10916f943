package com.franchiseplatform.negotiation.team;

import java.util.List;
import java.util.Optional;

/**
 * Read/write port onto the league's teams and players. Negotiation reads cap and depth
 * from it; the roster commit writes signings back.
 */
public interface TeamRegistry {

    Optional<Team> findTeam(String teamId);

    Optional<RosterPlayer> findPlayer(String playerId);

    List<RosterPlayer> findPlayersByTeam(String teamId);

    void saveTeam(Team team);

    void savePlayer(RosterPlayer player);
}
