package io.fantasymcp.mcp_gateway.model;

public record TeamSummary(String teamId, String teamName, String ownerName) {}
