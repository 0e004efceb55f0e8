/*
 * どこで: MCP Gateway サービス層
 * 何を: ツール呼び出し結果・認証チャレンジ・外部連携エラー・シーズン探索結果のメトリクスを記録する
 * なぜ: ツール失敗率とトークン検証失敗の増加を Prometheus から直接観測できるようにするため
 */
package io.fantasymcp.mcp_gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GatewayMetrics {

  private static final String METRIC_TOOL_CALL_TOTAL = "gateway.tool.call.total";
  private static final String METRIC_TOOL_CALL_DURATION = "gateway.tool.call.duration";
  private static final String METRIC_AUTH_CHALLENGE_TOTAL = "gateway.auth.challenge.total";
  private static final String METRIC_TOKEN_FAILURE_TOTAL = "gateway.auth.token.failure.total";
  private static final String METRIC_STORE_INTEGRATION_ERROR_TOTAL =
      "gateway.store.integration.error.total";
  private static final String METRIC_PROVIDER_CALL_TOTAL = "gateway.provider.call.total";
  private static final String METRIC_DISCOVERY_TOTAL = "gateway.discovery.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> toolCallCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> toolCallTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> authChallengeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> tokenFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> storeErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> providerCallCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> discoveryCounters = new ConcurrentHashMap<>();

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordToolCall(String tool, String result, Duration duration) {
    final String key = tool + "|" + result;
    toolCallCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_TOOL_CALL_TOTAL)
                    .description("MCP tool call outcomes")
                    .tags(Tags.of("tool", tool, "result", result))
                    .register(meterRegistry))
        .increment();
    toolCallTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_TOOL_CALL_DURATION)
                    .description("MCP tool call duration")
                    .tags(Tags.of("tool", tool, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordAuthChallenge(String challenge) {
    authChallengeCounters
        .computeIfAbsent(
            challenge,
            ignored ->
                Counter.builder(METRIC_AUTH_CHALLENGE_TOTAL)
                    .description("401 challenges returned by challenge type")
                    .tags(Tags.of("challenge", challenge))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTokenFailure(String reason) {
    tokenFailureCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_TOKEN_FAILURE_TOTAL)
                    .description("Bearer token verification failures by reason")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStoreIntegrationError(String code) {
    storeErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_STORE_INTEGRATION_ERROR_TOTAL)
                    .description("League store integration errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  public void recordProviderCall(String status) {
    providerCallCounters
        .computeIfAbsent(
            status,
            ignored ->
                Counter.builder(METRIC_PROVIDER_CALL_TOTAL)
                    .description("Upstream provider call outcomes")
                    .tags(Tags.of("status", status))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDiscoveryResult(String status) {
    discoveryCounters
        .computeIfAbsent(
            status,
            ignored ->
                Counter.builder(METRIC_DISCOVERY_TOTAL)
                    .description("Season discovery run outcomes")
                    .tags(Tags.of("status", status))
                    .register(meterRegistry))
        .increment();
  }
}
