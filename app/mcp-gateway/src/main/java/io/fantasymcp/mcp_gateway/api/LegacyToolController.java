/*
 * どこで: MCP Gateway API
 * 何を: JSON-RPC を話さない旧クライアント向けに tools/list と tools/call を REST で公開する
 * なぜ: 実行経路は JSON-RPC と共通にし、入出力の形だけを変換するため
 */
package io.fantasymcp.mcp_gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fantasymcp.mcp_gateway.api.response.AuthErrorResponse;
import io.fantasymcp.mcp_gateway.api.response.ToolCallResponse;
import io.fantasymcp.mcp_gateway.config.RequestMdcInterceptor;
import io.fantasymcp.mcp_gateway.model.ToolCallResult;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthentication;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthenticator;
import io.fantasymcp.mcp_gateway.service.mcp.AuthChallenge;
import io.fantasymcp.mcp_gateway.service.mcp.AuthChallenges;
import io.fantasymcp.mcp_gateway.service.mcp.McpDispatcher;
import io.fantasymcp.mcp_gateway.service.tool.ToolInvocation;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mcp/tools")
@RequiredArgsConstructor
public class LegacyToolController {

  private static final Logger logger = LoggerFactory.getLogger(LegacyToolController.class);

  private final McpDispatcher mcpDispatcher;
  private final CallerAuthenticator callerAuthenticator;
  private final AuthChallenges authChallenges;
  private final GatewayMetrics gatewayMetrics;
  private final ObjectMapper objectMapper;

  @GetMapping("/list")
  public ResponseEntity<ObjectNode> listTools() {
    final ObjectNode body = objectMapper.createObjectNode();
    body.set("tools", mcpDispatcher.toolDescriptors());
    return ResponseEntity.ok(body);
  }

  @PostMapping("/call")
  public ResponseEntity<?> callTool(
      @RequestBody(required = false) String body,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      HttpServletRequest request) {
    final CallerAuthentication authentication =
        callerAuthenticator.authenticate(
            authorization, request.getHeader(callerAuthenticator.developmentUserHeader()));
    if (authentication.outcome() == CallerAuthentication.Outcome.MISSING_CREDENTIALS) {
      return challenge(AuthChallenge.UNAUTHORIZED);
    }
    if (authentication.outcome() == CallerAuthentication.Outcome.INVALID_TOKEN) {
      return challenge(AuthChallenge.INVALID_TOKEN);
    }

    final JsonNode payload = readPayload(body);
    final JsonNode tool = payload == null ? null : payload.get("tool");
    if (tool == null || !tool.isTextual() || tool.asText().isBlank()) {
      return ResponseEntity.badRequest()
          .body(ToolCallResponse.text("Invalid request: tool is required", true));
    }
    JsonNode arguments = payload.get("arguments");
    if (arguments == null || arguments.isNull()) {
      arguments = objectMapper.createObjectNode();
    } else if (!arguments.isObject()) {
      return ResponseEntity.badRequest()
          .body(ToolCallResponse.text("Invalid request: arguments must be an object", true));
    }

    final ToolCallResult result =
        mcpDispatcher.execute(
            tool.asText(),
            arguments,
            new ToolInvocation(
                authentication.identity(),
                authorization,
                RequestMdcInterceptor.correlationId(request)));
    if (result.authError()) {
      return challenge(AuthChallenge.INVALID_TOKEN);
    }
    return ResponseEntity.ok(ToolCallResponse.text(result.content(), result.isError()));
  }

  private JsonNode readPayload(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      final JsonNode node = objectMapper.readTree(body);
      return node != null && node.isObject() ? node : null;
    } catch (JsonProcessingException ex) {
      logger.debug("legacy tools/call body is not valid json: {}", ex.getOriginalMessage());
      return null;
    }
  }

  private ResponseEntity<AuthErrorResponse> challenge(AuthChallenge challenge) {
    gatewayMetrics.recordAuthChallenge(challenge.error());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, authChallenges.header(challenge))
        .body(new AuthErrorResponse(challenge.error(), challenge.message()));
  }
}
