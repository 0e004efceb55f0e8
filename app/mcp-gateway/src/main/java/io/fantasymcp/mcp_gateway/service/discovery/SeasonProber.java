/*
 * どこで: MCP Gateway シーズン探索
 * 何を: 当年から下限年まで upstream を probe し、見つかったシーズンをストアへ登録する
 * なぜ: 過去シーズンを一括登録しつつ、upstream への負荷を連続 miss と待機で抑えるため
 */
package io.fantasymcp.mcp_gateway.service.discovery;

import io.fantasymcp.mcp_gateway.config.DiscoveryProperties;
import io.fantasymcp.mcp_gateway.model.BasicLeagueInfo;
import io.fantasymcp.mcp_gateway.model.DiscoveredSeason;
import io.fantasymcp.mcp_gateway.model.SeasonAddOutcome;
import io.fantasymcp.mcp_gateway.model.SeasonDiscoveryResult;
import io.fantasymcp.mcp_gateway.model.Sport;
import io.fantasymcp.mcp_gateway.model.TeamSummary;
import io.fantasymcp.mcp_gateway.model.UpstreamCredentials;
import io.fantasymcp.mcp_gateway.service.FantasyProviderClient;
import io.fantasymcp.mcp_gateway.service.LeagueStoreClient;
import io.fantasymcp.mcp_gateway.service.LeagueStoreIntegrationException;
import io.fantasymcp.mcp_gateway.service.ProviderResult;
import io.fantasymcp.mcp_gateway.service.SeasonCalculator;
import io.fantasymcp.mcp_gateway.service.StoreCallContext;
import io.fantasymcp.mcp_gateway.service.dto.StoreAddLeagueRequest;
import io.fantasymcp.mcp_gateway.service.dto.StorePatchTeamRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SeasonProber {

  private static final Logger logger = LoggerFactory.getLogger(SeasonProber.class);

  // 1 回だけ再試行する一時的な失敗
  private static final Set<ProviderResult.Status> TRANSIENT =
      EnumSet.of(
          ProviderResult.Status.TIMEOUT,
          ProviderResult.Status.SERVER_ERROR,
          ProviderResult.Status.FAILED,
          ProviderResult.Status.INVALID_RESPONSE);

  private final FantasyProviderClient fantasyProviderClient;
  private final LeagueStoreClient leagueStoreClient;
  private final SeasonCalculator seasonCalculator;
  private final DiscoveryProperties properties;
  private final ProbeDelay probeDelay;

  /**
   * シーズンを探索する。
   *
   * @param existingSeasons ストアに登録済みのシーズン年。probe せず skipped として数える
   * @return 途中停止した場合も、それまでに見つかったシーズンを含む結果
   */
  public SeasonDiscoveryResult discover(
      @NonNull Sport sport,
      @NonNull String leagueId,
      @NonNull String baseTeamId,
      @NonNull Set<Integer> existingSeasons,
      @NonNull UpstreamCredentials credentials,
      @NonNull StoreCallContext context) {
    final int currentYear = seasonCalculator.currentCalendarYear();
    final int minYear = properties.minYear();
    final List<DiscoveredSeason> discovered = new ArrayList<>();
    int consecutiveMisses = 0;
    int skipped = 0;
    boolean rateLimited = false;
    boolean limitExceeded = false;
    boolean probed = false;
    int lowestVisited = currentYear + 1;

    for (int year = currentYear; year >= minYear; year--) {
      if (existingSeasons.contains(year)) {
        skipped++;
        lowestVisited = year;
        continue;
      }
      final boolean mandatory = year > currentYear - properties.mandatoryWindowYears();
      if (!mandatory && consecutiveMisses >= properties.maxConsecutiveMisses()) {
        break;
      }
      lowestVisited = year;

      if (probed && !pause(properties.probeDelay())) {
        break;
      }
      probed = true;

      ProviderResult<BasicLeagueInfo> result = probe(sport, leagueId, year, credentials);
      if (TRANSIENT.contains(result.status())) {
        logger.info(
            "season probe transient failure, retrying season={} status={}",
            year,
            result.status());
        if (!pause(properties.retryDelay())) {
          break;
        }
        result = probe(sport, leagueId, year, credentials);
        if (TRANSIENT.contains(result.status())) {
          logger.warn(
              "season probe failed after retry league_id={} season={} status={}",
              leagueId,
              year,
              result.status());
          return new SeasonDiscoveryResult(
              SeasonDiscoveryResult.Status.UPSTREAM_FAILED,
              result.message(),
              discovered,
              rateLimited,
              limitExceeded,
              false,
              skipped,
              currentYear);
        }
      }

      switch (result.status()) {
        case OK -> {
          final BasicLeagueInfo info = result.value();
          if (info.teams().isEmpty()) {
            consecutiveMisses++;
            continue;
          }
          final DiscoveredSeason season = toSeason(sport, leagueId, baseTeamId, year, info);
          discovered.add(season);
          consecutiveMisses = 0;
          final SeasonAddOutcome outcome =
              save(sport, leagueId, info.leagueName(), season, context);
          if (outcome == SeasonAddOutcome.LIMIT_EXCEEDED) {
            logger.info("league store limit reached league_id={} season={}", leagueId, year);
            limitExceeded = true;
          }
        }
        case NOT_FOUND -> consecutiveMisses++;
        case RATE_LIMITED -> {
          logger.warn("season probe rate limited league_id={} season={}", leagueId, year);
          rateLimited = true;
        }
        case UNAUTHORIZED, NON_JSON -> {
          // 既知シーズンがあれば cookie は有効とみなし、その年はアクセス不可として扱う
          if (discovered.isEmpty() && existingSeasons.isEmpty()) {
            logger.info(
                "season probe rejected credentials league_id={} status={}",
                leagueId,
                result.status());
            return new SeasonDiscoveryResult(
                SeasonDiscoveryResult.Status.CREDENTIALS_REJECTED,
                result.message(),
                discovered,
                false,
                false,
                false,
                skipped,
                currentYear);
          }
          consecutiveMisses++;
        }
        default -> throw new IllegalStateException("unexpected probe status " + result.status());
      }
      if (rateLimited || limitExceeded) {
        break;
      }
    }

    logger.info(
        "season discovery finished league_id={} sport={} discovered={} skipped={}"
            + " rate_limited={} limit_exceeded={}",
        leagueId,
        sport.label(),
        discovered.size(),
        skipped,
        rateLimited,
        limitExceeded);
    return new SeasonDiscoveryResult(
        SeasonDiscoveryResult.Status.COMPLETED,
        null,
        discovered,
        rateLimited,
        limitExceeded,
        lowestVisited == minYear,
        skipped,
        currentYear);
  }

  private ProviderResult<BasicLeagueInfo> probe(
      Sport sport, String leagueId, int year, UpstreamCredentials credentials) {
    return fantasyProviderClient.fetchBasicLeagueInfo(sport, leagueId, year, credentials);
  }

  private static DiscoveredSeason toSeason(
      Sport sport, String leagueId, String baseTeamId, int year, BasicLeagueInfo info) {
    final String teamName = info.findTeam(baseTeamId).map(TeamSummary::teamName).orElse(null);
    final String leagueName =
        isBlank(info.leagueName()) ? sport.label() + " League " + leagueId : info.leagueName();
    return new DiscoveredSeason(year, leagueName, info.teams().size(), baseTeamId, teamName);
  }

  /** 登録済み(409)なら team だけを 1 回更新する。ストア障害は探索を止めない。 */
  private SeasonAddOutcome save(
      Sport sport,
      String leagueId,
      String upstreamLeagueName,
      DiscoveredSeason season,
      StoreCallContext context) {
    final SeasonAddOutcome outcome;
    try {
      outcome =
          leagueStoreClient.addLeague(
              context,
              new StoreAddLeagueRequest(
                  leagueId,
                  sport.label(),
                  season.seasonYear(),
                  upstreamLeagueName,
                  season.teamId(),
                  season.teamName()));
    } catch (LeagueStoreIntegrationException ex) {
      logger.warn(
          "league store add failed season={} reason={}", season.seasonYear(), ex.reason(), ex);
      return SeasonAddOutcome.REJECTED;
    }
    if (outcome == SeasonAddOutcome.ALREADY_EXISTS) {
      try {
        leagueStoreClient.patchTeam(
            context,
            leagueId,
            new StorePatchTeamRequest(
                season.teamId(),
                sport.label(),
                season.teamName(),
                upstreamLeagueName,
                season.seasonYear()));
      } catch (LeagueStoreIntegrationException ex) {
        logger.warn(
            "league store team backfill failed season={} reason={}",
            season.seasonYear(),
            ex.reason());
      }
    }
    return outcome;
  }

  /** 割り込まれた場合は割り込みフラグを戻して false を返す。登録済みのシーズンは巻き戻さない。 */
  private boolean pause(Duration duration) {
    try {
      probeDelay.sleep(duration);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("season discovery interrupted while waiting");
      return false;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
