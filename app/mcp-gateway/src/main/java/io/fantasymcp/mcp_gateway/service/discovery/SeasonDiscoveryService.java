package io.fantasymcp.mcp_gateway.service.discovery;

import io.fantasymcp.mcp_gateway.config.DiscoveryProperties;
import io.fantasymcp.mcp_gateway.model.SeasonDiscoveryResult;
import io.fantasymcp.mcp_gateway.model.Sport;
import io.fantasymcp.mcp_gateway.model.StoredLeague;
import io.fantasymcp.mcp_gateway.model.UpstreamCredentials;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.fantasymcp.mcp_gateway.service.LeagueStoreClient;
import io.fantasymcp.mcp_gateway.service.StoreCallContext;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * オンボーディング時のシーズン探索。
 *
 * <p>ストアから資格情報と登録済みシーズンを読み、基準チームが選ばれているリーグだけを探索する。
 */
@Service
@RequiredArgsConstructor
public class SeasonDiscoveryService {

  private static final Logger logger = LoggerFactory.getLogger(SeasonDiscoveryService.class);

  private final LeagueStoreClient leagueStoreClient;
  private final SeasonProber seasonProber;
  private final DiscoveryProperties properties;
  private final GatewayMetrics gatewayMetrics;

  public SeasonDiscoveryReport discover(
      String leagueId, String sportLabel, StoreCallContext context) {
    if (isBlank(leagueId)) {
      throw new OnboardingException(
          "VALIDATION_ERROR", HttpStatus.BAD_REQUEST, "leagueId is required");
    }
    final String normalizedLeagueId = leagueId.trim();
    final Sport sport = resolveSport(sportLabel);

    final UpstreamCredentials credentials =
        leagueStoreClient
            .fetchCredentials(context)
            .filter(UpstreamCredentials::isComplete)
            .orElseThrow(
                () ->
                    new OnboardingException(
                        "CREDENTIALS_MISSING",
                        HttpStatus.NOT_FOUND,
                        "ESPN credentials not found. Please add your ESPN credentials first."));

    final List<StoredLeague> seasons =
        leagueStoreClient.fetchLeagues(context).stream()
            .filter(league -> normalizedLeagueId.equals(league.leagueId()))
            .filter(league -> league.isSport(sport))
            .toList();
    // 最新シーズンで選ばれているチームを基準にする
    final String baseTeamId =
        seasons.stream()
            .filter(StoredLeague::hasTeam)
            .max(
                Comparator.comparing(
                    StoredLeague::seasonYear, Comparator.nullsFirst(Comparator.naturalOrder())))
            .map(StoredLeague::teamId)
            .orElseThrow(
                () ->
                    new OnboardingException(
                        "TEAM_ID_MISSING",
                        HttpStatus.BAD_REQUEST,
                        "Select your team for this league before discovering seasons."));
    final Set<Integer> existingSeasons =
        seasons.stream()
            .map(StoredLeague::seasonYear)
            .filter(Objects::nonNull)
            .collect(Collectors.toUnmodifiableSet());

    logger.info(
        "season discovery started league_id={} sport={} existing_seasons={}",
        normalizedLeagueId,
        sport.label(),
        existingSeasons.size());
    final SeasonDiscoveryResult result =
        seasonProber.discover(
            sport, normalizedLeagueId, baseTeamId, existingSeasons, credentials, context);
    gatewayMetrics.recordDiscoveryResult(result.status().name().toLowerCase(Locale.ROOT));

    if (result.status() == SeasonDiscoveryResult.Status.CREDENTIALS_REJECTED) {
      throw new OnboardingException(
          "AUTH_FAILED", HttpStatus.UNAUTHORIZED, "ESPN credentials expired or invalid");
    }
    if (result.status() == SeasonDiscoveryResult.Status.UPSTREAM_FAILED) {
      throw new OnboardingException(
          "ESPN_ERROR", HttpStatus.BAD_GATEWAY, "ESPN API error: " + result.message());
    }
    return new SeasonDiscoveryReport(normalizedLeagueId, sport, result);
  }

  private Sport resolveSport(String sportLabel) {
    if (isBlank(sportLabel)) {
      return properties.defaultSport();
    }
    return Sport.fromLabel(sportLabel)
        .orElseThrow(
            () ->
                new OnboardingException(
                    "SPORT_NOT_SUPPORTED",
                    HttpStatus.BAD_REQUEST,
                    "Sport not supported: " + sportLabel));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
