package io.fantasymcp.mcp_gateway.service;

/** league store 呼び出しに付与する呼び出し元情報。 */
public record StoreCallContext(
    String subjectId, String authorizationHeader, String correlationId) {}
