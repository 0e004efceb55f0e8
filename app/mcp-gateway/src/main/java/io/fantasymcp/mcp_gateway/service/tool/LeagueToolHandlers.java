package io.fantasymcp.mcp_gateway.service.tool;

import io.fantasymcp.mcp_gateway.model.BasicLeagueInfo;
import io.fantasymcp.mcp_gateway.model.MatchupSummary;
import io.fantasymcp.mcp_gateway.model.RosterPlayer;
import io.fantasymcp.mcp_gateway.model.Sport;
import io.fantasymcp.mcp_gateway.model.ToolCallResult;
import io.fantasymcp.mcp_gateway.model.UpstreamCredentials;
import io.fantasymcp.mcp_gateway.service.FantasyProviderClient;
import io.fantasymcp.mcp_gateway.service.ProviderResponses;
import io.fantasymcp.mcp_gateway.service.ProviderResult;
import io.fantasymcp.mcp_gateway.service.dto.ProviderLeagueResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** リーグ系ツールの upstream 取得と出力整形。 */
@Component
@RequiredArgsConstructor
public class LeagueToolHandlers {

  private final FantasyProviderClient fantasyProviderClient;
  private final ToolResultWriter toolResultWriter;

  public ToolCallResult handle(
      ToolKind kind, Sport sport, ResolvedArguments arguments, UpstreamCredentials credentials) {
    return switch (kind) {
      case LEAGUE_INFO -> leagueInfo(sport, arguments, credentials);
      case TEAM_ROSTER -> teamRoster(sport, arguments, credentials);
      case MATCHUPS -> matchups(sport, arguments, credentials);
      case STANDINGS -> standings(sport, arguments, credentials);
      case SESSION -> throw new IllegalArgumentException("session tool has no league handler");
    };
  }

  private ToolCallResult leagueInfo(
      Sport sport, ResolvedArguments arguments, UpstreamCredentials credentials) {
    final ProviderResult<ProviderLeagueResponse> result =
        fantasyProviderClient.fetchLeague(
            sport,
            arguments.leagueId(),
            arguments.seasonYear(),
            credentials,
            List.of("mSettings", "mTeam", "mStatus"),
            Map.of());
    if (!result.isOk()) {
      return providerError(result, arguments);
    }
    final ProviderLeagueResponse response = result.value();
    final BasicLeagueInfo info =
        ProviderResponses.toBasicLeagueInfo(
            response, arguments.leagueId(), arguments.seasonYear());
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("leagueId", arguments.leagueId());
    body.put("sport", sport.label());
    body.put("seasonYear", arguments.seasonYear());
    body.put("leagueName", leagueName(info, sport, arguments.leagueId()));
    body.put("size", response.settings() == null ? null : response.settings().size());
    body.put(
        "matchupPeriodCount",
        response.settings() == null || response.settings().scheduleSettings() == null
            ? null
            : response.settings().scheduleSettings().matchupPeriodCount());
    body.put(
        "currentMatchupPeriod",
        response.status() == null ? null : response.status().currentMatchupPeriod());
    body.put("teams", info.teams());
    return toolResultWriter.success(body);
  }

  private ToolCallResult teamRoster(
      Sport sport, ResolvedArguments arguments, UpstreamCredentials credentials) {
    if (arguments.teamId() == null) {
      return ToolCallResult.error(
          "teamId is required. Call get_user_session to find your teamId for league "
              + arguments.leagueId()
              + ".");
    }
    final Map<String, String> params =
        arguments.week() == null
            ? Map.of()
            : Map.of("scoringPeriodId", arguments.week().toString());
    final ProviderResult<ProviderLeagueResponse> result =
        fantasyProviderClient.fetchLeague(
            sport,
            arguments.leagueId(),
            arguments.seasonYear(),
            credentials,
            List.of("mRoster", "mTeam"),
            params);
    if (!result.isOk()) {
      return providerError(result, arguments);
    }
    final Optional<List<RosterPlayer>> roster =
        ProviderResponses.toRoster(result.value(), arguments.teamId());
    if (roster.isEmpty()) {
      return ToolCallResult.error(
          "ESPN_NOT_FOUND: Team "
              + arguments.teamId()
              + " not found in league "
              + arguments.leagueId()
              + " for season "
              + arguments.seasonYear()
              + ".");
    }
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("leagueId", arguments.leagueId());
    body.put("teamId", arguments.teamId());
    body.put("sport", sport.label());
    body.put("seasonYear", arguments.seasonYear());
    body.put("players", roster.get());
    return toolResultWriter.success(body);
  }

  private ToolCallResult matchups(
      Sport sport, ResolvedArguments arguments, UpstreamCredentials credentials) {
    final ProviderResult<ProviderLeagueResponse> result =
        fantasyProviderClient.fetchLeague(
            sport,
            arguments.leagueId(),
            arguments.seasonYear(),
            credentials,
            List.of("mMatchupScore", "mTeam", "mStatus"),
            Map.of());
    if (!result.isOk()) {
      return providerError(result, arguments);
    }
    final ProviderLeagueResponse response = result.value();
    final Integer matchupPeriod =
        arguments.week() != null
            ? arguments.week()
            : response.status() == null ? null : response.status().currentMatchupPeriod();
    final List<MatchupSummary> matchups = ProviderResponses.toMatchups(response, matchupPeriod);
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("leagueId", arguments.leagueId());
    body.put("sport", sport.label());
    body.put("seasonYear", arguments.seasonYear());
    body.put("matchupPeriod", matchupPeriod);
    body.put("matchups", matchups);
    return toolResultWriter.success(body);
  }

  private ToolCallResult standings(
      Sport sport, ResolvedArguments arguments, UpstreamCredentials credentials) {
    final ProviderResult<BasicLeagueInfo> result =
        fantasyProviderClient.fetchBasicLeagueInfo(
            sport, arguments.leagueId(), arguments.seasonYear(), credentials);
    if (!result.isOk()) {
      return providerError(result, arguments);
    }
    final BasicLeagueInfo info = result.value();
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("leagueId", arguments.leagueId());
    body.put("sport", sport.label());
    body.put("seasonYear", arguments.seasonYear());
    body.put("leagueName", leagueName(info, sport, arguments.leagueId()));
    body.put("standings", info.standings());
    return toolResultWriter.success(body);
  }

  /** upstream 失敗を安定したエラーコード接頭辞付きのツールエラーへ変換する。 */
  static ToolCallResult providerError(ProviderResult<?> result, ResolvedArguments arguments) {
    final String message =
        switch (result.status()) {
          case UNAUTHORIZED -> result.httpStatus() == 403
              ? "ESPN_ACCESS_DENIED: Access denied to league "
                  + arguments.leagueId()
                  + ". This league may be private - update your ESPN credentials in settings."
              : "ESPN_COOKIES_EXPIRED: ESPN session expired. Update your ESPN credentials in"
                  + " settings.";
          case NON_JSON -> "ESPN_COOKIES_EXPIRED: ESPN returned a login page instead of data."
              + " Update your ESPN credentials in settings.";
          case NOT_FOUND -> "ESPN_NOT_FOUND: League "
              + arguments.leagueId()
              + " not found for season "
              + arguments.seasonYear()
              + ".";
          case RATE_LIMITED -> "ESPN_RATE_LIMIT: Too many requests to ESPN. Please wait and try"
              + " again.";
          case TIMEOUT -> "ESPN_TIMEOUT: ESPN did not respond in time. Please try again.";
          case INVALID_RESPONSE -> "ESPN_INVALID_RESPONSE: " + result.message();
          case SERVER_ERROR, FAILED -> "ESPN_API_ERROR: " + result.message();
          case OK -> throw new IllegalArgumentException("successful result is not an error");
        };
    return ToolCallResult.error(message);
  }

  private String leagueName(BasicLeagueInfo info, Sport sport, String leagueId) {
    return info.leagueName() != null ? info.leagueName() : sport.label() + " League " + leagueId;
  }
}
