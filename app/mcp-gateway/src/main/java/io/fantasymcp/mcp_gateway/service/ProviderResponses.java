/*
 * どこで: MCP Gateway サービス層
 * 何を: provider のリーグ応答 DTO をツール出力用のモデルへ変換する
 * なぜ: upstream 固有の構造(location/nickname、record.overall 等)の解釈を 1 か所に閉じ込めるため
 */
package io.fantasymcp.mcp_gateway.service;

import io.fantasymcp.mcp_gateway.model.BasicLeagueInfo;
import io.fantasymcp.mcp_gateway.model.MatchupSummary;
import io.fantasymcp.mcp_gateway.model.RosterPlayer;
import io.fantasymcp.mcp_gateway.model.StandingEntry;
import io.fantasymcp.mcp_gateway.model.TeamSummary;
import io.fantasymcp.mcp_gateway.service.dto.ProviderLeagueResponse;
import io.fantasymcp.mcp_gateway.service.dto.ProviderScheduleItem;
import io.fantasymcp.mcp_gateway.service.dto.ProviderTeam;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class ProviderResponses {

  private ProviderResponses() {}

  /** league 名が無い応答では leagueName を null のまま返す。 */
  public static BasicLeagueInfo toBasicLeagueInfo(
      ProviderLeagueResponse response, String leagueId, int seasonYear) {
    final List<ProviderTeam> teams = teams(response);
    final Map<String, String> ownerNames = ownerNames(response);
    final List<TeamSummary> summaries =
        teams.stream()
            .map(
                team ->
                    new TeamSummary(
                        teamId(team),
                        teamName(team),
                        team.primaryOwner() == null ? null : ownerNames.get(team.primaryOwner())))
            .toList();
    final String leagueName =
        response.settings() == null || isBlank(response.settings().name())
            ? null
            : response.settings().name();
    return new BasicLeagueInfo(leagueName, seasonYear, summaries, toStandings(teams));
  }

  public static List<StandingEntry> toStandings(List<ProviderTeam> teams) {
    final List<StandingEntry> unranked = new ArrayList<>();
    for (ProviderTeam team : teams) {
      final ProviderTeam.Overall overall =
          team.record() == null ? null : team.record().overall();
      final int wins = overall == null ? 0 : valueOrZero(overall.wins());
      final int losses = overall == null ? 0 : valueOrZero(overall.losses());
      final int ties = overall == null ? 0 : valueOrZero(overall.ties());
      final int games = wins + losses + ties;
      final double winPercentage = games > 0 ? Math.round(wins * 1000.0 / games) / 1000.0 : 0.0;
      unranked.add(
          new StandingEntry(
              teamId(team),
              teamName(team),
              wins,
              losses,
              ties,
              winPercentage,
              0,
              team.playoffSeed()));
    }
    final List<StandingEntry> sorted =
        unranked.stream()
            .sorted(
                Comparator.comparingDouble(StandingEntry::winPercentage)
                    .reversed()
                    .thenComparing(Comparator.comparingInt(StandingEntry::wins).reversed()))
            .toList();
    final List<StandingEntry> ranked = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      final StandingEntry entry = sorted.get(i);
      ranked.add(
          new StandingEntry(
              entry.teamId(),
              entry.teamName(),
              entry.wins(),
              entry.losses(),
              entry.ties(),
              entry.winPercentage(),
              i + 1,
              entry.playoffSeed()));
    }
    return ranked;
  }

  public static Optional<List<RosterPlayer>> toRoster(
      ProviderLeagueResponse response, String teamId) {
    return teams(response).stream()
        .filter(team -> teamId.equals(teamId(team)))
        .findFirst()
        .map(
            team ->
                team.roster() == null || team.roster().entries() == null
                    ? List.<RosterPlayer>of()
                    : team.roster().entries().stream()
                        .filter(Objects::nonNull)
                        .map(ProviderResponses::toRosterPlayer)
                        .toList());
  }

  /** matchupPeriodId が null なら応答中の全対戦を返す。 */
  public static List<MatchupSummary> toMatchups(
      ProviderLeagueResponse response, Integer matchupPeriodId) {
    final Map<String, String> names =
        teams(response).stream()
            .collect(
                Collectors.toMap(
                    ProviderResponses::teamId,
                    ProviderResponses::teamName,
                    (first, second) -> first));
    final List<ProviderScheduleItem> schedule =
        response.schedule() == null ? List.of() : response.schedule();
    return schedule.stream()
        .filter(Objects::nonNull)
        .filter(
            item -> matchupPeriodId == null || matchupPeriodId.equals(item.matchupPeriodId()))
        .map(item -> toMatchup(item, names::get))
        .toList();
  }

  public static String teamName(ProviderTeam team) {
    if (!isBlank(team.location()) && !isBlank(team.nickname())) {
      return team.location() + " " + team.nickname();
    }
    if (!isBlank(team.name())) {
      return team.name();
    }
    return "Team " + team.id();
  }

  private static MatchupSummary toMatchup(
      ProviderScheduleItem item, Function<String, String> teamNames) {
    final String homeId = sideTeamId(item.home());
    final String awayId = sideTeamId(item.away());
    return new MatchupSummary(
        item.matchupPeriodId(),
        homeId,
        homeId == null ? null : teamNames.apply(homeId),
        item.home() == null ? null : item.home().totalPoints(),
        awayId,
        awayId == null ? null : teamNames.apply(awayId),
        item.away() == null ? null : item.away().totalPoints(),
        item.winner());
  }

  private static RosterPlayer toRosterPlayer(ProviderTeam.RosterEntry entry) {
    final ProviderTeam.PlayerPoolEntry pool = entry.playerPoolEntry();
    final ProviderTeam.Player player = pool == null ? null : pool.player();
    return new RosterPlayer(
        entry.playerId(),
        player == null ? null : player.fullName(),
        entry.lineupSlotId(),
        player == null ? null : player.defaultPositionId(),
        player == null ? null : player.proTeamId(),
        player == null ? null : player.injuryStatus(),
        pool == null ? null : pool.appliedStatTotal());
  }

  private static String sideTeamId(ProviderScheduleItem.Side side) {
    return side == null || side.teamId() == null ? null : side.teamId().toString();
  }

  private static List<ProviderTeam> teams(ProviderLeagueResponse response) {
    if (response.teams() == null) {
      return List.of();
    }
    return response.teams().stream().filter(Objects::nonNull).toList();
  }

  private static Map<String, String> ownerNames(ProviderLeagueResponse response) {
    if (response.members() == null) {
      return Map.of();
    }
    return response.members().stream()
        .filter(member -> member != null && member.id() != null)
        .collect(
            Collectors.toMap(
                ProviderLeagueResponse.ProviderMember::id,
                member ->
                    isBlank(member.displayName())
                        ? Objects.toString(member.firstName(), "")
                        : member.displayName(),
                (first, second) -> first));
  }

  private static String teamId(ProviderTeam team) {
    return team.id() == null ? "" : team.id().toString();
  }

  private static int valueOrZero(Integer value) {
    return value == null ? 0 : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
