package io.fantasymcp.mcp_gateway.api.request;

/** sport を省略した場合は discovery.default-sport を使う。 */
public record DiscoverSeasonsRequest(String leagueId, String sport) {}
