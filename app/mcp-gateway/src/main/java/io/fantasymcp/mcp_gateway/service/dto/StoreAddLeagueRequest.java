package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreAddLeagueRequest(
    String leagueId,
    String sport,
    Integer seasonYear,
    String leagueName,
    String teamId,
    String teamName) {}
