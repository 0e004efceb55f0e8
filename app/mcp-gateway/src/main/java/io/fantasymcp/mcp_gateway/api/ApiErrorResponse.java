package io.fantasymcp.mcp_gateway.api;

public record ApiErrorResponse(String code, String message) {}
