package io.fantasymcp.mcp_gateway.model;

import java.util.List;
import java.util.Optional;

/** upstream のリーグ応答から名前・チーム・順位だけを取り出した形。 */
public record BasicLeagueInfo(
    String leagueName, int seasonYear, List<TeamSummary> teams, List<StandingEntry> standings) {

  public BasicLeagueInfo {
    teams = teams == null ? List.of() : List.copyOf(teams);
    standings = standings == null ? List.of() : List.copyOf(standings);
  }

  public Optional<TeamSummary> findTeam(String teamId) {
    if (teamId == null) {
      return Optional.empty();
    }
    return teams.stream().filter(team -> teamId.equals(team.teamId())).findFirst();
  }
}
