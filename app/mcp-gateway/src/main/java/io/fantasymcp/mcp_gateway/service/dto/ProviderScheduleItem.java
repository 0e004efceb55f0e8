package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderScheduleItem(
    Integer id, Integer matchupPeriodId, Side home, Side away, String winner) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Side(Integer teamId, Double totalPoints) {}
}
