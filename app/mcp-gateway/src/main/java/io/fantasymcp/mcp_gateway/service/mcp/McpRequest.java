package io.fantasymcp.mcp_gateway.service.mcp;

/** HTTP 層から受け取る生の JSON-RPC リクエストと認証関連ヘッダ。 */
public record McpRequest(
    String body, String authorizationHeader, String developmentUserId, String correlationId) {}
