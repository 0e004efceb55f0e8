package io.fantasymcp.mcp_gateway.api.response;

public record AuthErrorResponse(String error, String message) {}
