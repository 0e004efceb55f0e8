package io.fantasymcp.mcp_gateway.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fantasymcp.mcp_gateway.model.DiscoveredSeason;
import java.util.List;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "探索結果の不変 List をそのまま返す JSON DTO のため")
public record DiscoverSeasonsResponse(
    boolean success,
    String leagueId,
    String sport,
    int startYear,
    boolean minYearReached,
    boolean rateLimited,
    boolean limitExceeded,
    List<DiscoveredSeason> discovered,
    int skipped,
    @JsonInclude(JsonInclude.Include.NON_NULL) String error) {}
