package io.fantasymcp.mcp_gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fantasymcp.common.CorrelationIds;
import io.fantasymcp.mcp_gateway.config.LeagueStoreClientProperties;
import io.fantasymcp.mcp_gateway.model.SeasonAddOutcome;
import io.fantasymcp.mcp_gateway.model.StoredLeague;
import io.fantasymcp.mcp_gateway.model.UpstreamCredentials;
import io.fantasymcp.mcp_gateway.service.dto.StoreAddLeagueRequest;
import io.fantasymcp.mcp_gateway.service.dto.StoreCredentialsResponse;
import io.fantasymcp.mcp_gateway.service.dto.StoreErrorResponse;
import io.fantasymcp.mcp_gateway.service.dto.StoreLeagueEntry;
import io.fantasymcp.mcp_gateway.service.dto.StoreLeaguesResponse;
import io.fantasymcp.mcp_gateway.service.dto.StorePatchTeamRequest;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * 外部 league store(資格情報とリーグ登録の永続化先)の REST クライアント。
 *
 * <p>全リクエストに subject ID ヘッダ、元の Authorization ヘッダ、X-Correlation-ID を付与する。
 */
@Service
@RequiredArgsConstructor
public class LeagueStoreClient {

  private static final Logger logger = LoggerFactory.getLogger(LeagueStoreClient.class);
  private static final String LIMIT_EXCEEDED_CODE = "LIMIT_EXCEEDED";

  private final RestClient leagueStoreRestClient;
  private final LeagueStoreClientProperties properties;
  private final ObjectMapper objectMapper;

  /** 登録済みリーグ一覧。404 は未登録として空リストを返す。 */
  public List<StoredLeague> fetchLeagues(@NonNull StoreCallContext context) {
    requireSubject(context);
    final StoreLeaguesResponse response =
        call(
            "fetchLeagues",
            () -> {
              try {
                return leagueStoreRestClient
                    .get()
                    .uri(properties.leaguesPath())
                    .headers(headers -> applyHeaders(headers, context))
                    .retrieve()
                    .body(StoreLeaguesResponse.class);
              } catch (RestClientResponseException ex) {
                if (ex.getStatusCode().value() == 404) {
                  logger.info("league store has no leagues for caller");
                  return new StoreLeaguesResponse(true, List.of());
                }
                throw ex;
              }
            });
    if (response == null || response.leagues() == null) {
      logger.warn("league store fetchLeagues returned empty body");
      throw new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.INVALID_RESPONSE,
          "league store response is empty");
    }
    return response.leagues().stream()
        .filter(Objects::nonNull)
        .filter(entry -> !isBlank(entry.leagueId()))
        .map(this::toStoredLeague)
        .toList();
  }

  /** upstream 資格情報。404 は未設定として empty を返す。 */
  public Optional<UpstreamCredentials> fetchCredentials(@NonNull StoreCallContext context) {
    requireSubject(context);
    final StoreCredentialsResponse response =
        call(
            "fetchCredentials",
            () -> {
              try {
                return leagueStoreRestClient
                    .get()
                    .uri(properties.credentialsPath())
                    .headers(headers -> applyHeaders(headers, context))
                    .retrieve()
                    .body(StoreCredentialsResponse.class);
              } catch (RestClientResponseException ex) {
                if (ex.getStatusCode().value() == 404) {
                  return null;
                }
                throw ex;
              }
            });
    if (response == null) {
      return Optional.empty();
    }
    if (!Boolean.TRUE.equals(response.success()) || response.credentials() == null) {
      logger.warn("league store fetchCredentials response validation failed");
      throw new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.INVALID_RESPONSE,
          "league store credentials response is invalid");
    }
    final UpstreamCredentials credentials =
        new UpstreamCredentials(
            response.credentials().swid(),
            response.credentials().s2(),
            response.credentials().email());
    if (!credentials.isComplete()) {
      logger.warn("league store returned incomplete credentials");
      return Optional.empty();
    }
    return Optional.of(credentials);
  }

  /**
   * シーズン 1 件を追加する。
   *
   * <p>409 は既存、400 + LIMIT_EXCEEDED は登録上限として値で返し、それ以外の拒否は REJECTED とする。
   */
  public SeasonAddOutcome addLeague(
      @NonNull StoreCallContext context, @NonNull StoreAddLeagueRequest request) {
    requireSubject(context);
    try {
      leagueStoreRestClient
          .post()
          .uri(properties.addLeaguePath())
          .headers(headers -> applyHeaders(headers, context))
          .body(request)
          .retrieve()
          .toBodilessEntity();
      return SeasonAddOutcome.ADDED;
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      if (status == 409) {
        return SeasonAddOutcome.ALREADY_EXISTS;
      }
      if (status == 400 && LIMIT_EXCEEDED_CODE.equals(errorCode(ex))) {
        return SeasonAddOutcome.LIMIT_EXCEEDED;
      }
      if (status == 401 || status == 403 || ex.getStatusCode().is5xxServerError()) {
        throw toIntegrationException("addLeague", ex);
      }
      logger.warn(
          "league store addLeague rejected season={} status={}", request.seasonYear(), status);
      return SeasonAddOutcome.REJECTED;
    } catch (ResourceAccessException ex) {
      throw toIntegrationException("addLeague", ex);
    }
  }

  /** 既存シーズンのチーム選択を更新する。 */
  public void patchTeam(
      @NonNull StoreCallContext context,
      @NonNull String leagueId,
      @NonNull StorePatchTeamRequest request) {
    requireSubject(context);
    if (isBlank(request.teamId())) {
      throw new IllegalArgumentException("teamId is required");
    }
    call(
        "patchTeam",
        () ->
            leagueStoreRestClient
                .patch()
                .uri(properties.patchTeamPath(), leagueId)
                .headers(headers -> applyHeaders(headers, context))
                .body(request)
                .retrieve()
                .toBodilessEntity());
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw toIntegrationException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw toIntegrationException(operation, ex);
    } catch (LeagueStoreIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("league store {} response parse failed", operation, ex);
      throw new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.INVALID_RESPONSE,
          "league store response parse failed",
          ex);
    }
  }

  private LeagueStoreIntegrationException toIntegrationException(
      String operation, RestClientResponseException ex) {
    logger.warn(
        "league store {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401) {
      return new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.UNAUTHORIZED,
          "league store rejected caller token",
          ex);
    }
    if (status == 403) {
      return new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.FORBIDDEN, "league store denied access", ex);
    }
    if (status == 404) {
      return new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.NOT_FOUND, "league store resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.BAD_GATEWAY, "league store server error", ex);
    }
    return new LeagueStoreIntegrationException(
        LeagueStoreIntegrationException.Reason.BAD_GATEWAY, "league store request failed", ex);
  }

  private LeagueStoreIntegrationException toIntegrationException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("league store {} timed out", operation);
      return new LeagueStoreIntegrationException(
          LeagueStoreIntegrationException.Reason.TIMEOUT, "league store request timeout", ex);
    }
    logger.warn("league store {} connection failed", operation, ex);
    return new LeagueStoreIntegrationException(
        LeagueStoreIntegrationException.Reason.BAD_GATEWAY, "league store connection failed", ex);
  }

  private void applyHeaders(HttpHeaders headers, StoreCallContext context) {
    headers.set(properties.userIdHeaderName(), context.subjectId());
    if (!isBlank(context.authorizationHeader())) {
      headers.set(HttpHeaders.AUTHORIZATION, context.authorizationHeader());
    }
    headers.set(CorrelationIds.HEADER_NAME, CorrelationIds.resolve(context.correlationId()));
  }

  private String errorCode(RestClientResponseException ex) {
    final String body = ex.getResponseBodyAsString();
    if (isBlank(body)) {
      return null;
    }
    try {
      return objectMapper.readValue(body, StoreErrorResponse.class).code();
    } catch (Exception parseError) {
      logger.debug("league store error body is not json");
      return null;
    }
  }

  private StoredLeague toStoredLeague(StoreLeagueEntry entry) {
    return new StoredLeague(
        isBlank(entry.platform()) ? "espn" : entry.platform(),
        entry.leagueId(),
        entry.sport(),
        entry.seasonYear(),
        isBlank(entry.teamId()) ? null : entry.teamId(),
        entry.leagueName(),
        entry.teamName(),
        Boolean.TRUE.equals(entry.isDefault()));
  }

  private void requireSubject(StoreCallContext context) {
    if (isBlank(context.subjectId())) {
      throw new IllegalArgumentException("subjectId is required");
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
