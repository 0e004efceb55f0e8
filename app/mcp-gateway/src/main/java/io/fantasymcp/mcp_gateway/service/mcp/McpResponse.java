package io.fantasymcp.mcp_gateway.service.mcp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ディスパッチ結果。
 *
 * @param wwwAuthenticate 401 のときだけ設定される
 * @param body 通知(202)のときは null
 */
public record McpResponse(int status, String wwwAuthenticate, JsonNode body) {}
