package io.fantasymcp.mcp_gateway.model;

public record DiscoveredSeason(
    int seasonYear, String leagueName, int teamCount, String teamId, String teamName) {}
