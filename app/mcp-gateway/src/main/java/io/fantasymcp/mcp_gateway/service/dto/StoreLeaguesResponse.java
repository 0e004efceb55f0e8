/*
 * どこで: MCP Gateway 下流 DTO
 * 何を: league store の GET /leagues 応答を表現する
 * なぜ: 下流スキーマ差分をツール実行層へ伝播させないため
 */
package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreLeaguesResponse(Boolean success, List<StoreLeagueEntry> leagues) {}
