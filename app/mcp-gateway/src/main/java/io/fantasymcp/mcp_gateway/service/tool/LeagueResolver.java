/*
 * どこで: MCP Gateway ツール層
 * 何を: 保存済みリーグからスポーツ別の絞り込み・デフォルトリーグ選択・引数補完を行う
 * なぜ: AI アシスタントが leagueId や seasonId を省略・誤指定しても、ユーザーの登録内容に沿った呼び出しにするため
 */
package io.fantasymcp.mcp_gateway.service.tool;

import com.fasterxml.jackson.databind.JsonNode;
import io.fantasymcp.mcp_gateway.config.DiscoveryProperties;
import io.fantasymcp.mcp_gateway.model.Sport;
import io.fantasymcp.mcp_gateway.model.StoredLeague;
import io.fantasymcp.mcp_gateway.service.SeasonCalculator;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LeagueResolver {

  private static final Logger logger = LoggerFactory.getLogger(LeagueResolver.class);
  private static final Pattern YEAR = Pattern.compile("\\d{4}");

  private final SeasonCalculator seasonCalculator;
  private final int minSeasonYear;

  public LeagueResolver(
      SeasonCalculator seasonCalculator, DiscoveryProperties discoveryProperties) {
    this.seasonCalculator = seasonCalculator;
    this.minSeasonYear = discoveryProperties.minYear();
  }

  /** 対象スポーツのリーグだけを返す。範囲外のシーズン年を持つ登録は除外する。 */
  public List<StoredLeague> leaguesForSport(List<StoredLeague> leagues, Sport sport) {
    return leagues.stream()
        .filter(league -> league.isSport(sport))
        .filter(this::hasUsableSeason)
        .toList();
  }

  /**
   * デフォルトリーグ。
   *
   * <p>優先順: 現在シーズンかつチーム選択済み、チーム選択済み、先頭。
   */
  public Optional<StoredLeague> defaultLeague(List<StoredLeague> sportLeagues, Sport sport) {
    if (sportLeagues.isEmpty()) {
      return Optional.empty();
    }
    final int currentSeason = seasonCalculator.currentSeasonYear(sport);
    return sportLeagues.stream()
        .filter(league -> league.hasTeam() && Objects.equals(league.seasonYear(), currentSeason))
        .findFirst()
        .or(() -> sportLeagues.stream().filter(StoredLeague::hasTeam).findFirst())
        .or(() -> Optional.of(sportLeagues.get(0)));
  }

  /**
   * leagueId・teamId・seasonId を補完する。
   *
   * <p>leagueId が未指定または登録外ならデフォルトリーグに置き換え、teamId と seasonId も未指定分をそこから埋める。
   * 登録済み leagueId で seasonId が無い場合はそのリーグの最新の保存シーズンを使う。最後に現在シーズンへフォールバックする。
   */
  public ResolvedArguments normalize(
      JsonNode arguments, List<StoredLeague> sportLeagues, Sport sport) {
    final StoredLeague defaultLeague =
        defaultLeague(sportLeagues, sport)
            .orElseThrow(() -> new IllegalStateException("no leagues to resolve against"));
    final String providedLeagueId = text(arguments, "leagueId");
    String teamId = text(arguments, "teamId");
    Integer seasonYear = seasonArgument(arguments);
    final Integer week = weekArgument(arguments);

    final List<StoredLeague> matching =
        providedLeagueId == null
            ? List.of()
            : sportLeagues.stream()
                .filter(league -> providedLeagueId.equals(league.leagueId()))
                .toList();

    final String leagueId;
    if (matching.isEmpty()) {
      logger.info(
          "using default league season={} (provided leagueId {})",
          defaultLeague.seasonYear(),
          providedLeagueId == null ? "absent" : "not registered");
      leagueId = defaultLeague.leagueId();
      if (teamId == null && defaultLeague.hasTeam()) {
        teamId = defaultLeague.teamId();
      }
      if (seasonYear == null) {
        seasonYear = defaultLeague.seasonYear();
      }
    } else {
      leagueId = providedLeagueId;
      if (seasonYear == null) {
        seasonYear =
            matching.stream()
                .map(StoredLeague::seasonYear)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
      }
      if (teamId == null) {
        final Integer season = seasonYear;
        teamId =
            matching.stream()
                .filter(league -> league.hasTeam() && Objects.equals(league.seasonYear(), season))
                .findFirst()
                .or(() -> matching.stream().filter(StoredLeague::hasTeam).findFirst())
                .map(StoredLeague::teamId)
                .orElse(null);
      }
    }

    if (seasonYear == null) {
      seasonYear = seasonCalculator.currentSeasonYear(sport);
    }
    return new ResolvedArguments(leagueId, teamId, seasonYear, week);
  }

  private Integer seasonArgument(JsonNode arguments) {
    final JsonNode node = arguments.get("seasonId");
    if (node == null || node.isNull()) {
      return null;
    }
    final String value = node.asText().trim();
    if (value.isEmpty()) {
      return null;
    }
    if (!YEAR.matcher(value).matches() || Integer.parseInt(value) < minSeasonYear) {
      throw new InvalidToolArgumentException(
          "seasonId must be a four digit year not earlier than " + minSeasonYear);
    }
    return Integer.parseInt(value);
  }

  private Integer weekArgument(JsonNode arguments) {
    final JsonNode node = arguments.get("week");
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.canConvertToInt() && node.isIntegralNumber() && node.asInt() > 0) {
      return node.asInt();
    }
    if (node.isTextual() && node.asText().trim().matches("\\d{1,3}")) {
      final int week = Integer.parseInt(node.asText().trim());
      if (week > 0) {
        return week;
      }
    }
    throw new InvalidToolArgumentException("week must be a positive integer");
  }

  private String text(JsonNode arguments, String field) {
    final JsonNode node = arguments.get(field);
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    final String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private boolean hasUsableSeason(StoredLeague league) {
    if (league.seasonYear() == null || league.seasonYear() >= minSeasonYear) {
      return true;
    }
    logger.warn("ignoring stored league with out-of-range season={}", league.seasonYear());
    return false;
  }
}
