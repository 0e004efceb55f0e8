package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreLeagueEntry(
    String platform,
    String leagueId,
    String sport,
    Integer seasonYear,
    String teamId,
    String leagueName,
    String teamName,
    @JsonProperty("isDefault") Boolean isDefault) {}
