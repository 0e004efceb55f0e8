/*
 * どこで: MCP Gateway API
 * 何を: /mcp の JSON-RPC エンドポイントとサーバー記述子を公開する
 * なぜ: HTTP の入出力だけをここで扱い、プロトコル処理は McpDispatcher に集約するため
 */
package io.fantasymcp.mcp_gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.fantasymcp.mcp_gateway.api.response.ServerDescriptorResponse;
import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import io.fantasymcp.mcp_gateway.config.McpServerProperties;
import io.fantasymcp.mcp_gateway.config.RequestMdcInterceptor;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthenticator;
import io.fantasymcp.mcp_gateway.service.mcp.McpDispatcher;
import io.fantasymcp.mcp_gateway.service.mcp.McpRequest;
import io.fantasymcp.mcp_gateway.service.mcp.McpResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class McpController {

  private final McpDispatcher mcpDispatcher;
  private final CallerAuthenticator callerAuthenticator;
  private final McpServerProperties serverProperties;
  private final GatewayAuthProperties authProperties;

  @GetMapping({"/mcp", "/mcp/"})
  public ResponseEntity<ServerDescriptorResponse> describe() {
    return ResponseEntity.ok(
        new ServerDescriptorResponse(
            serverProperties.name(),
            serverProperties.version(),
            serverProperties.description(),
            serverProperties.protocolVersion(),
            Map.of("tools", Map.of()),
            authProperties.resourceMetadataUrl()));
  }

  @PostMapping({"/mcp", "/mcp/"})
  public ResponseEntity<JsonNode> handle(
      @RequestBody(required = false) String body,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      HttpServletRequest request) {
    final McpResponse response =
        mcpDispatcher.dispatch(
            new McpRequest(
                body,
                authorization,
                request.getHeader(callerAuthenticator.developmentUserHeader()),
                RequestMdcInterceptor.correlationId(request)));
    final ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.status());
    if (response.wwwAuthenticate() != null) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, response.wwwAuthenticate());
    }
    if (response.body() == null) {
      return builder.build();
    }
    return builder.contentType(MediaType.APPLICATION_JSON).body(response.body());
  }
}
