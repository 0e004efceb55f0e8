package io.fantasymcp.mcp_gateway.service.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.fantasymcp.mcp_gateway.config.DiscoveryProperties;
import io.fantasymcp.mcp_gateway.config.ToolProperties;
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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SeasonProberTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-10-01T16:00:00Z"), ZoneOffset.UTC);
  private static final UpstreamCredentials CREDENTIALS =
      new UpstreamCredentials("{SWID}", "s2", null);
  private static final StoreCallContext CONTEXT =
      new StoreCallContext("user-1", "Bearer token-1", "corr-1");

  @Test
  void stopsAfterTwoConsecutiveMissesOutsideMandatoryWindow() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2022, 2023, 2024);
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
    assertThat(result.discovered())
        .extracting(DiscoveredSeason::seasonYear)
        .containsExactly(2024, 2023, 2022);
    assertThat(result.startYear()).isEqualTo(2025);
    assertThat(result.minYearReached()).isFalse();
    assertThat(result.rateLimited()).isFalse();
    assertThat(result.limitExceeded()).isFalse();
    verify(fixture.fantasyProviderClient, times(6))
        .fetchBasicLeagueInfo(eq(Sport.FOOTBALL), eq("123"), anyInt(), eq(CREDENTIALS));
    verify(fixture.fantasyProviderClient, never())
        .fetchBasicLeagueInfo(any(), any(), eq(2019), any());
    verify(fixture.leagueStoreClient, times(3)).addLeague(eq(CONTEXT), any());
    verify(fixture.leagueStoreClient, never()).patchTeam(any(), any(), any());
    // 初回以外の probe の前にだけ待つ
    assertThat(fixture.sleeps).hasSize(5).containsOnly(Duration.ofMillis(200));
  }

  @Test
  void discoveredSeasonCarriesBaseTeamAndLeagueName() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2024);
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    final DiscoveredSeason season = result.discovered().get(0);
    assertThat(season.seasonYear()).isEqualTo(2024);
    assertThat(season.leagueName()).isEqualTo("Sunday League");
    assertThat(season.teamCount()).isEqualTo(2);
    assertThat(season.teamId()).isEqualTo("7");
    assertThat(season.teamName()).isEqualTo("River Ducks");

    final ArgumentCaptor<StoreAddLeagueRequest> request =
        ArgumentCaptor.forClass(StoreAddLeagueRequest.class);
    verify(fixture.leagueStoreClient).addLeague(eq(CONTEXT), request.capture());
    assertThat(request.getValue())
        .isEqualTo(
            new StoreAddLeagueRequest(
                "123", "football", 2024, "Sunday League", "7", "River Ducks"));
  }

  @Test
  void existingSeasonsAreSkippedWithoutProbing() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2023);
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of(2025, 2024));

    assertThat(result.skipped()).isEqualTo(2);
    assertThat(result.discovered()).extracting(DiscoveredSeason::seasonYear).containsExactly(2023);
    verify(fixture.fantasyProviderClient, never())
        .fetchBasicLeagueInfo(any(), any(), eq(2025), any());
    verify(fixture.fantasyProviderClient, never())
        .fetchBasicLeagueInfo(any(), any(), eq(2024), any());
  }

  @Test
  void duplicateSeasonBackfillsTeamOnce() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2024);
    when(fixture.leagueStoreClient.addLeague(any(), any()))
        .thenReturn(SeasonAddOutcome.ALREADY_EXISTS);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
    final ArgumentCaptor<StorePatchTeamRequest> patch =
        ArgumentCaptor.forClass(StorePatchTeamRequest.class);
    verify(fixture.leagueStoreClient, times(1)).patchTeam(eq(CONTEXT), eq("123"), patch.capture());
    assertThat(patch.getValue().teamId()).isEqualTo("7");
    assertThat(patch.getValue().seasonYear()).isEqualTo(2024);
  }

  @Test
  void storeFailureDoesNotStopDiscovery() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2024, 2023);
    when(fixture.leagueStoreClient.addLeague(any(), any()))
        .thenThrow(
            new LeagueStoreIntegrationException(
                LeagueStoreIntegrationException.Reason.BAD_GATEWAY, "store unavailable"))
        .thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.discovered())
        .extracting(DiscoveredSeason::seasonYear)
        .containsExactly(2024, 2023);
  }

  @Test
  void limitExceededStopsWithPartialResult() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2025, 2024, 2023);
    when(fixture.leagueStoreClient.addLeague(any(), any()))
        .thenReturn(SeasonAddOutcome.ADDED, SeasonAddOutcome.LIMIT_EXCEEDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
    assertThat(result.limitExceeded()).isTrue();
    assertThat(result.discovered())
        .extracting(DiscoveredSeason::seasonYear)
        .containsExactly(2025, 2024);
    verify(fixture.fantasyProviderClient, never())
        .fetchBasicLeagueInfo(any(), any(), eq(2023), any());
  }

  @Test
  void rateLimitStopsWithPartialResult() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2025);
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), eq(2024), any()))
        .thenReturn(
            ProviderResult.failure(ProviderResult.Status.RATE_LIMITED, 429, "rate limited"));
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
    assertThat(result.rateLimited()).isTrue();
    assertThat(result.discovered()).extracting(DiscoveredSeason::seasonYear).containsExactly(2025);
    verify(fixture.fantasyProviderClient, times(2))
        .fetchBasicLeagueInfo(any(), any(), anyInt(), any());
  }

  @Test
  void credentialRejectionOnFirstProbeFailsDiscovery() {
    final Fixture fixture = newFixture();
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), anyInt(), any()))
        .thenReturn(ProviderResult.failure(ProviderResult.Status.UNAUTHORIZED, 401, "rejected"));

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.CREDENTIALS_REJECTED);
    verify(fixture.fantasyProviderClient, times(1))
        .fetchBasicLeagueInfo(any(), any(), anyInt(), any());
    verify(fixture.leagueStoreClient, never()).addLeague(any(), any());
  }

  @Test
  void credentialRejectionAfterKnownSeasonCountsAsMiss() {
    final Fixture fixture = newFixture();
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), anyInt(), any()))
        .thenReturn(ProviderResult.failure(ProviderResult.Status.NON_JSON, 200, "login page"));

    final SeasonDiscoveryResult result = discover(fixture, Set.of(2025));

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
    assertThat(result.discovered()).isEmpty();
    assertThat(result.skipped()).isEqualTo(1);
    // 2024 は必須範囲、2023 で連続 miss が 2 に達する
    verify(fixture.fantasyProviderClient, times(2))
        .fetchBasicLeagueInfo(any(), any(), anyInt(), any());
  }

  @Test
  void transientFailureIsRetriedOnce() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture);
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), eq(2025), any()))
        .thenReturn(ProviderResult.failure(ProviderResult.Status.TIMEOUT, 0, "timeout"))
        .thenReturn(ProviderResult.ok(info()));
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
    assertThat(result.discovered()).extracting(DiscoveredSeason::seasonYear).contains(2025);
    assertThat(fixture.sleeps).first().isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  void repeatedTransientFailureReturnsUpstreamFailedWithPartialResult() {
    final Fixture fixture = newFixture();
    stubSeasons(fixture, 2025);
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), eq(2024), any()))
        .thenReturn(
            ProviderResult.failure(ProviderResult.Status.SERVER_ERROR, 503, "HTTP 503"));
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.UPSTREAM_FAILED);
    assertThat(result.message()).isEqualTo("HTTP 503");
    assertThat(result.discovered()).extracting(DiscoveredSeason::seasonYear).containsExactly(2025);
    verify(fixture.fantasyProviderClient, times(2))
        .fetchBasicLeagueInfo(any(), any(), eq(2024), any());
  }

  @Test
  void reachesMinimumYearWhenSeasonsKeepAppearing() {
    final Fixture fixture = newFixture(2020);
    stubSeasons(fixture, 2025, 2024, 2023, 2022, 2021, 2020);
    when(fixture.leagueStoreClient.addLeague(any(), any())).thenReturn(SeasonAddOutcome.ADDED);

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.discovered()).hasSize(6);
    assertThat(result.minYearReached()).isTrue();
  }

  @Test
  void emptyTeamListCountsAsMiss() {
    final Fixture fixture = newFixture();
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), anyInt(), any()))
        .thenReturn(ProviderResult.ok(new BasicLeagueInfo("Empty", 2025, List.of(), List.of())));

    final SeasonDiscoveryResult result = discover(fixture, Set.of());

    assertThat(result.discovered()).isEmpty();
    verify(fixture.fantasyProviderClient, times(2))
        .fetchBasicLeagueInfo(any(), any(), anyInt(), any());
  }

  @Test
  void interruptionStopsDiscovery() {
    final LeagueStoreClient leagueStoreClient = mock(LeagueStoreClient.class);
    final FantasyProviderClient fantasyProviderClient = mock(FantasyProviderClient.class);
    when(fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), anyInt(), any()))
        .thenReturn(ProviderResult.failure(ProviderResult.Status.NOT_FOUND, 404, "missing"));
    final SeasonProber prober =
        new SeasonProber(
            fantasyProviderClient,
            leagueStoreClient,
            new SeasonCalculator(CLOCK, new ToolProperties(null, null, null)),
            new DiscoveryProperties(null, null, null, null, null, null),
            duration -> {
              throw new InterruptedException("stop");
            });

    try {
      final SeasonDiscoveryResult result =
          prober.discover(Sport.FOOTBALL, "123", "7", Set.of(), CREDENTIALS, CONTEXT);

      assertThat(result.status()).isEqualTo(SeasonDiscoveryResult.Status.COMPLETED);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
      verify(fantasyProviderClient, times(1)).fetchBasicLeagueInfo(any(), any(), anyInt(), any());
    } finally {
      // 割り込みフラグを後続テストへ持ち越さない
      Thread.interrupted();
    }
  }

  private SeasonDiscoveryResult discover(Fixture fixture, Set<Integer> existingSeasons) {
    return fixture.prober.discover(
        Sport.FOOTBALL, "123", "7", existingSeasons, CREDENTIALS, CONTEXT);
  }

  /** 指定年だけリーグが存在し、それ以外は 404 を返す upstream を作る。 */
  private static void stubSeasons(Fixture fixture, int... years) {
    when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), anyInt(), any()))
        .thenReturn(ProviderResult.failure(ProviderResult.Status.NOT_FOUND, 404, "missing"));
    for (int year : years) {
      when(fixture.fantasyProviderClient.fetchBasicLeagueInfo(any(), any(), eq(year), any()))
          .thenReturn(ProviderResult.ok(info()));
    }
  }

  private static BasicLeagueInfo info() {
    return new BasicLeagueInfo(
        "Sunday League",
        2025,
        List.of(
            new TeamSummary("7", "River Ducks", "alice"),
            new TeamSummary("8", "Hill Goats", "bob")),
        List.of());
  }

  private static Fixture newFixture() {
    return newFixture(2000);
  }

  private static Fixture newFixture(int minYear) {
    final LeagueStoreClient leagueStoreClient = mock(LeagueStoreClient.class);
    final FantasyProviderClient fantasyProviderClient = mock(FantasyProviderClient.class);
    final List<Duration> sleeps = new ArrayList<>();
    final SeasonProber prober =
        new SeasonProber(
            fantasyProviderClient,
            leagueStoreClient,
            new SeasonCalculator(CLOCK, new ToolProperties(null, null, null)),
            new DiscoveryProperties(minYear, null, null, null, null, null),
            sleeps::add);
    return new Fixture(prober, leagueStoreClient, fantasyProviderClient, sleeps);
  }

  private record Fixture(
      SeasonProber prober,
      LeagueStoreClient leagueStoreClient,
      FantasyProviderClient fantasyProviderClient,
      List<Duration> sleeps) {}
}
