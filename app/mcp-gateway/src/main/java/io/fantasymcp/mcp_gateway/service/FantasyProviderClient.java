package io.fantasymcp.mcp_gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fantasymcp.mcp_gateway.config.ProviderClientProperties;
import io.fantasymcp.mcp_gateway.model.BasicLeagueInfo;
import io.fantasymcp.mcp_gateway.model.Sport;
import io.fantasymcp.mcp_gateway.model.UpstreamCredentials;
import io.fantasymcp.mcp_gateway.service.dto.ProviderLeagueResponse;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** fantasy provider の読み取り専用 API クライアント。書き込み系の呼び出しは持たない。 */
@Service
@RequiredArgsConstructor
public class FantasyProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(FantasyProviderClient.class);

  static final List<String> BASIC_INFO_VIEWS = List.of("mTeam", "mSettings", "mStandings");

  private final RestClient providerRestClient;
  private final ProviderClientProperties properties;
  private final ObjectMapper objectMapper;
  private final GatewayMetrics gatewayMetrics;

  /** リーグ名・チーム・順位。シーズン探索の probe にも使う。 */
  public ProviderResult<BasicLeagueInfo> fetchBasicLeagueInfo(
      @NonNull Sport sport,
      @NonNull String leagueId,
      int seasonYear,
      @NonNull UpstreamCredentials credentials) {
    return fetchLeague(sport, leagueId, seasonYear, credentials, BASIC_INFO_VIEWS, Map.of())
        .map(response -> ProviderResponses.toBasicLeagueInfo(response, leagueId, seasonYear));
  }

  /**
   * 指定 view でリーグ応答を取得する。
   *
   * @param seasonYear 開始年で表したシーズン年。upstream 形式への変換はここで行う
   */
  public ProviderResult<ProviderLeagueResponse> fetchLeague(
      @NonNull Sport sport,
      @NonNull String leagueId,
      int seasonYear,
      @NonNull UpstreamCredentials credentials,
      @NonNull List<String> views,
      @NonNull Map<String, String> queryParams) {
    if (isBlank(leagueId)) {
      throw new IllegalArgumentException("leagueId is required");
    }
    if (!credentials.isComplete()) {
      throw new IllegalArgumentException("credentials are incomplete");
    }
    final int providerSeasonYear = sport.toProviderSeasonYear(seasonYear);
    final ProviderResult<ProviderLeagueResponse> result =
        callLeague(sport, leagueId, providerSeasonYear, credentials, views, queryParams);
    gatewayMetrics.recordProviderCall(result.status().name());
    return result;
  }

  private ProviderResult<ProviderLeagueResponse> callLeague(
      Sport sport,
      String leagueId,
      int providerSeasonYear,
      UpstreamCredentials credentials,
      List<String> views,
      Map<String, String> queryParams) {
    final String body;
    try {
      body =
          providerRestClient
              .get()
              .uri(
                  uriBuilder -> {
                    uriBuilder.path(properties.leaguePath());
                    views.forEach(view -> uriBuilder.queryParam("view", view));
                    queryParams.forEach((name, value) -> uriBuilder.queryParam(name, value));
                    return uriBuilder.build(sport.gameId(), providerSeasonYear, leagueId);
                  })
              .header(HttpHeaders.COOKIE, cookieHeader(credentials))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn(
          "provider league fetch failed with http status={} sport={} season={}",
          status,
          sport.label(),
          providerSeasonYear);
      if (status == 401 || status == 403) {
        return ProviderResult.failure(
            ProviderResult.Status.UNAUTHORIZED, status, "provider rejected credentials");
      }
      if (status == 404) {
        return ProviderResult.failure(
            ProviderResult.Status.NOT_FOUND, status, "league not found");
      }
      if (status == 429) {
        return ProviderResult.failure(
            ProviderResult.Status.RATE_LIMITED, status, "provider rate limit exceeded");
      }
      if (ex.getStatusCode().is5xxServerError()) {
        return ProviderResult.failure(
            ProviderResult.Status.SERVER_ERROR, status, "provider returned " + status);
      }
      return ProviderResult.failure(
          ProviderResult.Status.FAILED, status, "provider returned " + status);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("provider league fetch timed out sport={}", sport.label());
        return ProviderResult.failure(
            ProviderResult.Status.TIMEOUT, 0, "provider request timed out");
      }
      logger.warn("provider league fetch connection failed", ex);
      return ProviderResult.failure(ProviderResult.Status.FAILED, 0, "provider connection failed");
    } catch (RuntimeException ex) {
      logger.warn("provider league fetch failed unexpectedly", ex);
      return ProviderResult.failure(
          ProviderResult.Status.INVALID_RESPONSE, 0, "provider response could not be read");
    }
    return parse(body);
  }

  private ProviderResult<ProviderLeagueResponse> parse(String body) {
    if (isBlank(body)) {
      logger.warn("provider returned empty body");
      return ProviderResult.failure(
          ProviderResult.Status.INVALID_RESPONSE, 200, "provider response is empty");
    }
    try {
      final ProviderLeagueResponse response =
          objectMapper.readValue(body, ProviderLeagueResponse.class);
      if (response == null) {
        return ProviderResult.failure(
            ProviderResult.Status.INVALID_RESPONSE, 200, "provider response is empty");
      }
      return ProviderResult.ok(response);
    } catch (JsonProcessingException ex) {
      // ログイン画面などの HTML はパース失敗時のみ判定する。名前に含まれるタグは対象外
      if (looksLikeMarkup(body)) {
        logger.warn("provider returned markup instead of json");
        return ProviderResult.failure(
            ProviderResult.Status.NON_JSON, 200, "provider returned HTML instead of JSON");
      }
      logger.warn("provider response parse failed: {}", ex.getOriginalMessage());
      return ProviderResult.failure(
          ProviderResult.Status.INVALID_RESPONSE, 200, "provider response is not valid JSON");
    }
  }

  private String cookieHeader(UpstreamCredentials credentials) {
    return "SWID=" + credentials.primarySecret() + "; espn_s2=" + credentials.secondarySecret();
  }

  private boolean looksLikeMarkup(String body) {
    return body.stripLeading().startsWith("<");
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
