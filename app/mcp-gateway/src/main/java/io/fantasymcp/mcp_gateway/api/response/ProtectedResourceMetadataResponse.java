/*
 * どこで: MCP Gateway API DTO
 * 何を: OAuth protected resource metadata の応答を定義する
 * なぜ: MCP クライアントが 401 のチャレンジから認可サーバーを発見できるようにするため
 */
package io.fantasymcp.mcp_gateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "設定値から組み立てる不変 List をそのまま返す JSON DTO のため")
public record ProtectedResourceMetadataResponse(
    String resource,
    List<String> authorizationServers,
    List<String> bearerMethodsSupported,
    List<String> scopesSupported) {}
