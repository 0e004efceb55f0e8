/*
 * どこで: MCP Gateway プロトコル層
 * 何を: JSON-RPC 2.0 エンベロープを解析し、initialize / tools/list / ping / tools/call を振り分ける
 * なぜ: プロトコルエラー・認証チャレンジ・ツール失敗をそれぞれ規定の応答形へ確実に変換するため
 */
package io.fantasymcp.mcp_gateway.service.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fantasymcp.mcp_gateway.config.McpServerProperties;
import io.fantasymcp.mcp_gateway.config.RequestMdcInterceptor;
import io.fantasymcp.mcp_gateway.model.ToolCallResult;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthentication;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthenticator;
import io.fantasymcp.mcp_gateway.service.tool.ToolCatalog;
import io.fantasymcp.mcp_gateway.service.tool.ToolDefinition;
import io.fantasymcp.mcp_gateway.service.tool.ToolExecutor;
import io.fantasymcp.mcp_gateway.service.tool.ToolInvocation;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class McpDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(McpDispatcher.class);
  private static final String JSONRPC_VERSION = "2.0";
  private static final Pattern ERROR_CODE_PREFIX = Pattern.compile("^([A-Z][A-Z_]+):");

  private final ObjectMapper objectMapper;
  private final McpServerProperties serverProperties;
  private final CallerAuthenticator callerAuthenticator;
  private final AuthChallenges authChallenges;
  private final ToolCatalog toolCatalog;
  private final ToolExecutor toolExecutor;
  private final GatewayMetrics gatewayMetrics;

  public McpResponse dispatch(McpRequest request) {
    if (request.body() == null || request.body().isBlank()) {
      return error(NullNode.getInstance(), JsonRpcErrors.PARSE_ERROR, "Parse error");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(request.body());
    } catch (JsonProcessingException ex) {
      logger.debug("json-rpc body is not valid json");
      return error(NullNode.getInstance(), JsonRpcErrors.PARSE_ERROR, "Parse error");
    }
    if (root == null || !root.isObject()) {
      return error(NullNode.getInstance(), JsonRpcErrors.INVALID_REQUEST, "Invalid Request");
    }
    final JsonNode id = root.has("id") ? root.get("id") : NullNode.getInstance();
    if (id.isContainerNode()) {
      return error(NullNode.getInstance(), JsonRpcErrors.INVALID_REQUEST, "Invalid Request");
    }
    final JsonNode method = root.get("method");
    if (method == null || !method.isTextual()) {
      return error(id, JsonRpcErrors.INVALID_REQUEST, "Invalid Request: method is required");
    }
    final JsonNode version = root.get("jsonrpc");
    if (version == null || !version.isTextual() || !JSONRPC_VERSION.equals(version.asText())) {
      return error(id, JsonRpcErrors.INVALID_REQUEST, "Invalid Request: jsonrpc must be \"2.0\"");
    }

    final String methodName = method.asText();
    if (methodName.startsWith("notifications/")) {
      return new McpResponse(202, null, null);
    }
    return switch (methodName) {
      case "initialize" -> result(id, initializeResult());
      case "ping" -> result(id, objectMapper.createObjectNode());
      case "tools/list" -> result(id, toolsListResult());
      case "tools/call" -> toolsCall(id, root.get("params"), request);
      default -> error(id, JsonRpcErrors.METHOD_NOT_FOUND, "Method not found: " + methodName);
    };
  }

  /** tools/list と REST 側 GET /mcp/tools/list が共有するツール一覧。 */
  public ArrayNode toolDescriptors() {
    final ArrayNode tools = objectMapper.createArrayNode();
    for (ToolDefinition definition : toolCatalog.definitions()) {
      final ObjectNode tool = tools.addObject();
      tool.put("name", definition.name());
      tool.put("description", definition.description());
      tool.set("inputSchema", objectMapper.valueToTree(definition.inputSchema()));
      final ObjectNode scheme = tool.putArray("securitySchemes").addObject();
      scheme.put("type", "oauth2");
      scheme.putArray("scopes").add("mcp:read");
    }
    return tools;
  }

  private McpResponse toolsCall(JsonNode id, JsonNode params, McpRequest request) {
    // 引数検証より先に認証する。未認証の呼び出しはツール名に関係なく同じチャレンジを返す
    final CallerAuthentication authentication =
        callerAuthenticator.authenticate(
            request.authorizationHeader(), request.developmentUserId());
    if (authentication.outcome() == CallerAuthentication.Outcome.MISSING_CREDENTIALS) {
      return challenge(id, AuthChallenge.UNAUTHORIZED);
    }
    if (authentication.outcome() == CallerAuthentication.Outcome.INVALID_TOKEN) {
      logger.info("tools/call rejected token reason={}", authentication.failure().code());
      return challenge(id, AuthChallenge.INVALID_TOKEN);
    }

    if (params == null || !params.isObject()) {
      return error(id, JsonRpcErrors.INVALID_PARAMS, "Invalid params: params must be an object");
    }
    final JsonNode name = params.get("name");
    if (name == null || !name.isTextual() || name.asText().isBlank()) {
      return error(id, JsonRpcErrors.INVALID_PARAMS, "Invalid params: name is required");
    }
    JsonNode arguments = params.get("arguments");
    if (arguments == null || arguments.isNull()) {
      arguments = objectMapper.createObjectNode();
    } else if (!arguments.isObject()) {
      return error(id, JsonRpcErrors.INVALID_PARAMS, "Invalid params: arguments must be an object");
    }

    final String toolName = name.asText();
    final ToolInvocation invocation =
        new ToolInvocation(
            authentication.identity(), request.authorizationHeader(), request.correlationId());
    final ToolCallResult result = execute(toolName, arguments, invocation);
    if (result.authError()) {
      return challenge(id, AuthChallenge.INVALID_TOKEN);
    }
    final ObjectNode body = objectMapper.createObjectNode();
    final ObjectNode content = body.putArray("content").addObject();
    content.put("type", "text");
    content.put("text", result.content());
    body.put("isError", result.isError());
    return result(id, body);
  }

  /**
   * ツールを実行し、開始・結果をログとメトリクスに記録する。想定外の例外も isError の結果に変換する。
   */
  public ToolCallResult execute(String toolName, JsonNode arguments, ToolInvocation invocation) {
    MDC.put(RequestMdcInterceptor.USER_ID_KEY, maskUserId(invocation.identity().subjectId()));
    final String metricTool = toolCatalog.find(toolName).isPresent() ? toolName : "unknown";
    logger.info("tool call started tool={}", toolName);
    final long startedAt = System.nanoTime();
    ToolCallResult result;
    try {
      result = toolExecutor.execute(toolName, arguments, invocation);
    } catch (RuntimeException ex) {
      logger.error("tool call failed unexpectedly tool={}", toolName, ex);
      result = ToolCallResult.error("Tool execution failed: " + ex.getMessage());
    }
    final Duration duration = Duration.ofNanos(System.nanoTime() - startedAt);
    final String outcome = outcome(result);
    gatewayMetrics.recordToolCall(metricTool, outcome, duration);
    if (result.isError()) {
      logger.warn(
          "tool call finished tool={} outcome={} error_code={} duration_ms={}",
          toolName,
          outcome,
          errorCode(result.content()),
          duration.toMillis());
    } else {
      logger.info(
          "tool call finished tool={} outcome={} duration_ms={}",
          toolName,
          outcome,
          duration.toMillis());
    }
    return result;
  }

  private ObjectNode initializeResult() {
    final ObjectNode body = objectMapper.createObjectNode();
    body.put("protocolVersion", serverProperties.protocolVersion());
    body.putObject("capabilities").putObject("tools");
    final ObjectNode serverInfo = body.putObject("serverInfo");
    serverInfo.put("name", serverProperties.name());
    serverInfo.put("version", serverProperties.version());
    return body;
  }

  private ObjectNode toolsListResult() {
    final ObjectNode body = objectMapper.createObjectNode();
    body.set("tools", toolDescriptors());
    return body;
  }

  private McpResponse challenge(JsonNode id, AuthChallenge challenge) {
    gatewayMetrics.recordAuthChallenge(challenge.error());
    final ObjectNode envelope = envelope(id);
    final ObjectNode error = envelope.putObject("error");
    error.put("code", JsonRpcErrors.AUTHENTICATION_REQUIRED);
    error.put("message", challenge.message());
    error
        .putObject("_meta")
        .putArray("mcp/www_authenticate")
        .add(authChallenges.descriptor(challenge));
    return new McpResponse(401, authChallenges.header(challenge), envelope);
  }

  private McpResponse result(JsonNode id, JsonNode result) {
    final ObjectNode envelope = envelope(id);
    envelope.set("result", result);
    return new McpResponse(200, null, envelope);
  }

  private McpResponse error(JsonNode id, int code, String message) {
    final ObjectNode envelope = envelope(id);
    final ObjectNode error = envelope.putObject("error");
    error.put("code", code);
    error.put("message", message);
    return new McpResponse(200, null, envelope);
  }

  private ObjectNode envelope(JsonNode id) {
    final ObjectNode envelope = objectMapper.createObjectNode();
    envelope.put("jsonrpc", JSONRPC_VERSION);
    envelope.set("id", id);
    return envelope;
  }

  private static String outcome(ToolCallResult result) {
    if (result.authError()) {
      return "auth_error";
    }
    return result.isError() ? "error" : "success";
  }

  static String errorCode(String content) {
    if (content == null) {
      return null;
    }
    final Matcher matcher = ERROR_CODE_PREFIX.matcher(content);
    return matcher.find() ? matcher.group(1) : null;
  }

  static String maskUserId(String subjectId) {
    if (subjectId == null) {
      return null;
    }
    return subjectId.length() <= 8 ? subjectId : subjectId.substring(0, 8) + "...";
  }
}
