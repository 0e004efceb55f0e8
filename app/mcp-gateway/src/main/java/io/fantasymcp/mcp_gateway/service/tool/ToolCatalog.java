/*
 * どこで: MCP Gateway ツール層
 * 何を: 有効なスポーツごとのツール定義(名前・説明・入力スキーマ)を組み立てる
 * なぜ: JSON-RPC と REST の両入口が同一のツール一覧を返すため
 */
package io.fantasymcp.mcp_gateway.service.tool;

import io.fantasymcp.mcp_gateway.config.ToolProperties;
import io.fantasymcp.mcp_gateway.model.Sport;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class ToolCatalog {

  public static final String SESSION_TOOL = "get_user_session";

  private final List<ToolDefinition> definitions;
  private final Map<String, ToolDefinition> byName;

  public ToolCatalog(ToolProperties properties) {
    final List<ToolDefinition> built = new ArrayList<>();
    built.add(sessionTool(properties));
    for (Sport sport : properties.sports()) {
      built.add(leagueInfoTool(sport));
      built.add(rosterTool(sport));
      built.add(matchupsTool(sport));
      built.add(standingsTool(sport));
    }
    this.definitions = List.copyOf(built);
    this.byName =
        built.stream()
            .collect(
                Collectors.toMap(
                    ToolDefinition::name,
                    Function.identity(),
                    (first, second) -> first,
                    LinkedHashMap::new));
  }

  public List<ToolDefinition> definitions() {
    return definitions;
  }

  public Optional<ToolDefinition> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byName.get(name));
  }

  static String toolName(Sport sport, ToolKind kind) {
    final String suffix =
        switch (kind) {
          case LEAGUE_INFO -> "league_info";
          case TEAM_ROSTER -> "team_roster";
          case MATCHUPS -> "matchups";
          case STANDINGS -> "standings";
          case SESSION -> throw new IllegalArgumentException("session tool is sport independent");
        };
    return "get_espn_" + sport.label() + "_" + suffix;
  }

  private ToolDefinition sessionTool(ToolProperties properties) {
    return new ToolDefinition(
        SESSION_TOOL,
        "Get the user's configured fantasy leagues, the default league and the current season."
            + " Call this first and reuse leagueId, teamId and seasonYear in other tools.",
        null,
        ToolKind.SESSION,
        objectSchema(
            Map.of(
                "sport",
                stringProperty(
                    "Sport to focus on (baseball, football, basketball, hockey). Defaults to "
                        + properties.defaultSport().label())),
            List.of()));
  }

  private ToolDefinition leagueInfoTool(Sport sport) {
    return new ToolDefinition(
        toolName(sport, ToolKind.LEAGUE_INFO),
        "Get ESPN fantasy "
            + sport.label()
            + " league settings and teams. Use leagueId from get_user_session.",
        sport,
        ToolKind.LEAGUE_INFO,
        objectSchema(leagueProperties(Map.of()), List.of("leagueId")));
  }

  private ToolDefinition rosterTool(Sport sport) {
    return new ToolDefinition(
        toolName(sport, ToolKind.TEAM_ROSTER),
        "Get a team roster from an ESPN fantasy "
            + sport.label()
            + " league. Use leagueId and teamId from get_user_session.",
        sport,
        ToolKind.TEAM_ROSTER,
        objectSchema(
            leagueProperties(
                Map.of(
                    "teamId",
                    stringProperty("Team ID within the league (from get_user_session)"))),
            List.of("leagueId", "teamId")));
  }

  private ToolDefinition matchupsTool(Sport sport) {
    return new ToolDefinition(
        toolName(sport, ToolKind.MATCHUPS),
        "Get matchups for a week of an ESPN fantasy "
            + sport.label()
            + " league. Defaults to the current matchup period.",
        sport,
        ToolKind.MATCHUPS,
        objectSchema(
            leagueProperties(
                Map.of(
                    "week",
                    Map.of(
                        "type",
                        "number",
                        "description",
                        "Matchup period (week) number; defaults to the current one"))),
            List.of("leagueId")));
  }

  private ToolDefinition standingsTool(Sport sport) {
    return new ToolDefinition(
        toolName(sport, ToolKind.STANDINGS),
        "Get standings of an ESPN fantasy " + sport.label() + " league.",
        sport,
        ToolKind.STANDINGS,
        objectSchema(leagueProperties(Map.of()), List.of("leagueId")));
  }

  private Map<String, Object> leagueProperties(Map<String, Object> extra) {
    final Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("leagueId", stringProperty("ESPN league ID (from get_user_session)"));
    properties.putAll(extra);
    properties.put(
        "seasonId", stringProperty("Season year, e.g. 2024. Defaults to the stored season"));
    return properties;
  }

  private Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
    final Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("properties", properties);
    schema.put("required", required);
    return schema;
  }

  private Map<String, Object> stringProperty(String description) {
    return Map.of("type", "string", "description", description);
  }
}
