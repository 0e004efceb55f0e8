/*
 * どこで: mcp-gateway のログ設定テスト
 * 何を: JSON ログ設定と trace/span・相関 ID フィールド定義の存在を検証する
 * なぜ: 設定変更で構造化ログやトレース連携が欠落する回帰を防ぐため
 */
package io.fantasymcp.mcp_gateway;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonTraceAndCallerFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"");
    assertThat(configText).contains("\"span_id\":\"%X{span_id:-%X{spanId:-}}\"");
    assertThat(configText).contains("\"correlation_id\":\"%X{correlation_id:-}\"");
    assertThat(configText).contains("\"user_id\":\"%X{user_id:-}\"");
  }

  @Test
  void logbackConfigurationNamesServiceAndKeepsStackTraces() throws IOException {
    final String configText =
        new String(
            new ClassPathResource("logback-spring.xml").getInputStream().readAllBytes(),
            StandardCharsets.UTF_8);

    assertThat(configText).contains("defaultValue=\"mcp-gateway\"");
    assertThat(configText).contains("<fieldName>stack_trace</fieldName>");
    assertThat(configText).contains("<logger name=\"io.fantasymcp\" level=\"INFO\"/>");
  }
}
