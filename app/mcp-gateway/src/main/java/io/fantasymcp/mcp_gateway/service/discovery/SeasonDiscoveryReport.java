package io.fantasymcp.mcp_gateway.service.discovery;

import io.fantasymcp.mcp_gateway.model.SeasonDiscoveryResult;
import io.fantasymcp.mcp_gateway.model.Sport;

public record SeasonDiscoveryReport(String leagueId, Sport sport, SeasonDiscoveryResult result) {}
