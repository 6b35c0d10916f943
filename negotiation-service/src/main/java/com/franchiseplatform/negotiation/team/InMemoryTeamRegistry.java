package com.franchiseplatform.negotiation.team;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryTeamRegistry implements TeamRegistry {

    private final Map<String, Team>         teams   = new ConcurrentHashMap<>();
    private final Map<String, RosterPlayer> players = new ConcurrentHashMap<>();

    @Override
    public Optional<Team> findTeam(String teamId) {
        return Optional.ofNullable(teams.get(teamId));
    }

    @Override
    public Optional<RosterPlayer> findPlayer(String playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    @Override
    public List<RosterPlayer> findPlayersByTeam(String teamId) {
        return players.values().stream()
            .filter(p -> teamId.equals(p.getTeamId()))
            .collect(Collectors.toList());
    }

    @Override
    public void saveTeam(Team team) {
        teams.put(team.getId(), team);
    }

    @Override
    public void savePlayer(RosterPlayer player) {
        players.put(player.getId(), player);
    }
}
