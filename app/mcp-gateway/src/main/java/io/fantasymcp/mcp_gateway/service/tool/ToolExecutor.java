/*
 * どこで: MCP Gateway ツール層
 * 何を: ツール名と引数からリーグ文脈を解決し、upstream 取得を実行して結果を返す
 * なぜ: JSON-RPC と REST の両入口で同じ実行経路を共有し、失敗をツール結果(isError)として返すため
 */
package io.fantasymcp.mcp_gateway.service.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.fantasymcp.mcp_gateway.config.ToolProperties;
import io.fantasymcp.mcp_gateway.model.Sport;
import io.fantasymcp.mcp_gateway.model.StoredLeague;
import io.fantasymcp.mcp_gateway.model.ToolCallResult;
import io.fantasymcp.mcp_gateway.model.UpstreamCredentials;
import io.fantasymcp.mcp_gateway.service.LeagueStoreClient;
import io.fantasymcp.mcp_gateway.service.LeagueStoreIntegrationException;
import io.fantasymcp.mcp_gateway.service.SeasonCalculator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ToolExecutor {

  static final String AUTH_FAILED_MESSAGE = "Authentication failed. Please re-authorize.";

  private static final Logger logger = LoggerFactory.getLogger(ToolExecutor.class);

  private final ToolCatalog toolCatalog;
  private final LeagueResolver leagueResolver;
  private final LeagueStoreClient leagueStoreClient;
  private final LeagueToolHandlers leagueToolHandlers;
  private final ToolResultWriter toolResultWriter;
  private final SeasonCalculator seasonCalculator;
  private final Sport defaultSport;

  public ToolExecutor(
      ToolCatalog toolCatalog,
      LeagueResolver leagueResolver,
      LeagueStoreClient leagueStoreClient,
      LeagueToolHandlers leagueToolHandlers,
      ToolResultWriter toolResultWriter,
      SeasonCalculator seasonCalculator,
      ToolProperties toolProperties) {
    this.toolCatalog = toolCatalog;
    this.leagueResolver = leagueResolver;
    this.leagueStoreClient = leagueStoreClient;
    this.leagueToolHandlers = leagueToolHandlers;
    this.toolResultWriter = toolResultWriter;
    this.seasonCalculator = seasonCalculator;
    this.defaultSport = toolProperties.defaultSport();
  }

  public ToolCallResult execute(
      @NonNull String toolName, JsonNode arguments, @NonNull ToolInvocation invocation) {
    final JsonNode args =
        arguments == null || arguments.isNull() ? JsonNodeFactory.instance.objectNode() : arguments;
    final Optional<ToolDefinition> definition = toolCatalog.find(toolName);
    if (definition.isEmpty()) {
      return ToolCallResult.error("Unknown tool: " + toolName);
    }
    final ToolDefinition tool = definition.get();

    final Sport sport;
    String unsupportedSport = null;
    if (tool.kind() == ToolKind.SESSION) {
      // セッションツールは失敗させない。未知の sport は既定スポーツで答え、instructions で知らせる
      final String requested = textOrNull(args.get("sport"));
      final Optional<Sport> parsed =
          requested == null ? Optional.empty() : Sport.fromLabel(requested);
      if (requested != null && parsed.isEmpty()) {
        logger.info("session tool received unsupported sport={}", requested);
        unsupportedSport = requested;
      }
      sport = parsed.orElse(defaultSport);
    } else {
      sport = tool.sport();
    }

    List<StoredLeague> leagues;
    String fetchError = null;
    try {
      leagues = leagueStoreClient.fetchLeagues(invocation.storeContext());
    } catch (LeagueStoreIntegrationException ex) {
      if (ex.isAuthFailure()) {
        logger.warn("league store rejected caller token while listing leagues");
        return ToolCallResult.authFailure(AUTH_FAILED_MESSAGE);
      }
      logger.warn("league fetch failed reason={}", ex.reason());
      fetchError = ex.getMessage();
      leagues = List.of();
    }
    final List<StoredLeague> sportLeagues = leagueResolver.leaguesForSport(leagues, sport);
    logger.info(
        "resolved leagues total={} {}={}", leagues.size(), sport.label(), sportLeagues.size());

    if (tool.kind() == ToolKind.SESSION) {
      return session(sport, leagues, sportLeagues, fetchError, unsupportedSport);
    }

    if (sportLeagues.isEmpty()) {
      return ToolCallResult.error(noLeaguesMessage(sport, leagues, fetchError));
    }

    final ResolvedArguments resolved;
    try {
      resolved = leagueResolver.normalize(args, sportLeagues, sport);
    } catch (InvalidToolArgumentException ex) {
      return ToolCallResult.error(ex.getMessage());
    }

    final Optional<UpstreamCredentials> credentials;
    try {
      credentials = leagueStoreClient.fetchCredentials(invocation.storeContext());
    } catch (LeagueStoreIntegrationException ex) {
      if (ex.isAuthFailure()) {
        logger.warn("league store rejected caller token while loading credentials");
        return ToolCallResult.authFailure(AUTH_FAILED_MESSAGE);
      }
      logger.warn("credential fetch failed reason={}", ex.reason());
      return ToolCallResult.error(
          "ESPN_API_ERROR: Unable to load ESPN credentials. " + ex.getMessage());
    }
    if (credentials.isEmpty()) {
      return ToolCallResult.error(
          "ESPN_CREDENTIALS_NOT_FOUND: ESPN credentials required for "
              + toolName
              + ". Add your SWID and espn_s2 cookies in settings.");
    }
    return leagueToolHandlers.handle(tool.kind(), sport, resolved, credentials.get());
  }

  private ToolCallResult session(
      Sport sport,
      List<StoredLeague> leagues,
      List<StoredLeague> sportLeagues,
      String fetchError,
      String unsupportedSport) {
    final int currentSeason = seasonCalculator.currentSeasonYear(sport);
    final Optional<StoredLeague> defaultLeague = leagueResolver.defaultLeague(sportLeagues, sport);
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("currentDate", seasonCalculator.today().toString());
    body.put("currentSeason", Integer.toString(currentSeason));
    body.put("timezone", seasonCalculator.zoneId().getId());
    body.put("sport", sport.label());
    body.put("totalLeaguesFound", leagues.size());
    body.put(sport.label() + "LeaguesFound", sportLeagues.size());
    body.put("defaultLeague", defaultLeague.map(this::leagueSummary).orElse(null));
    body.put("allLeagues", leagues.stream().map(this::leagueSummary).toList());
    final String instructions = sessionInstructions(sport, leagues, sportLeagues);
    body.put(
        "instructions",
        unsupportedSport == null
            ? instructions
            : "Unsupported sport: "
                + unsupportedSport
                + ". Showing "
                + sport.label()
                + " instead. "
                + instructions);
    if (fetchError != null) {
      body.put("fetchError", fetchError);
    }
    return toolResultWriter.success(body);
  }

  private String sessionInstructions(
      Sport sport, List<StoredLeague> leagues, List<StoredLeague> sportLeagues) {
    if (sportLeagues.isEmpty()) {
      if (!leagues.isEmpty()) {
        return "No "
            + sport.label()
            + " leagues found, but found leagues for: "
            + String.join(", ", sportsOf(leagues))
            + ". Please add a "
            + sport.label()
            + " league in settings.";
      }
      return "No leagues configured. Please add your ESPN credentials and leagues in settings.";
    }
    if (sportLeagues.size() > 1) {
      final List<String> seasons =
          sportLeagues.stream()
              .map(StoredLeague::seasonYear)
              .filter(Objects::nonNull)
              .distinct()
              .map(String::valueOf)
              .toList();
      if (seasons.size() > 1) {
        return "User has "
            + sportLeagues.size()
            + " "
            + sport.label()
            + " league entries across seasons "
            + String.join(", ", seasons)
            + ". ASK which league AND season they want. List by leagueName, leagueId, AND"
            + " seasonYear. Use matching teamId and seasonYear together.";
      }
      return "User has "
          + sportLeagues.size()
          + " "
          + sport.label()
          + " leagues configured. ASK which league they want. List by leagueName and leagueId.";
    }
    final StoredLeague league = sportLeagues.get(0);
    if (league.seasonYear() == null) {
      return "Use defaultLeague.leagueId and defaultLeague.teamId for all subsequent tool calls."
          + " Use currentSeason for seasonId parameter.";
    }
    return "Use leagueId="
        + league.leagueId()
        + ", teamId="
        + (league.hasTeam() ? league.teamId() : "none")
        + ", seasonId="
        + league.seasonYear()
        + " for all tool calls.";
  }

  private String noLeaguesMessage(Sport sport, List<StoredLeague> leagues, String fetchError) {
    if (fetchError != null) {
      return "Unable to fetch your leagues: " + fetchError;
    }
    if (!leagues.isEmpty()) {
      return "No "
          + sport.label()
          + " leagues found, but found leagues for: "
          + String.join(", ", sportsOf(leagues))
          + ". Please add a "
          + sport.label()
          + " league in settings.";
    }
    return "No "
        + sport.label()
        + " leagues configured. Please add your ESPN credentials and select a league in settings.";
  }

  private List<String> sportsOf(List<StoredLeague> leagues) {
    final Set<String> sports = new LinkedHashSet<>();
    for (StoredLeague league : leagues) {
      if (league.sport() != null) {
        sports.add(league.sport());
      }
    }
    return new ArrayList<>(sports);
  }

  private Map<String, Object> leagueSummary(StoredLeague league) {
    final Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("platform", league.platform());
    summary.put("leagueId", league.leagueId());
    summary.put("sport", league.sport());
    summary.put("seasonYear", league.seasonYear());
    summary.put("teamId", league.teamId());
    summary.put("leagueName", league.leagueName());
    summary.put("teamName", league.teamName());
    summary.put("isDefault", league.isDefault());
    return summary;
  }

  private String textOrNull(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    final String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }
}
