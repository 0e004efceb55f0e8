package io.fantasymcp.mcp_gateway.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import io.fantasymcp.mcp_gateway.model.TokenFailureReason;
import io.fantasymcp.mcp_gateway.model.ToolCallResult;
import io.fantasymcp.mcp_gateway.model.VerifiedIdentity;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthentication;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthenticator;
import io.fantasymcp.mcp_gateway.service.mcp.AuthChallenges;
import io.fantasymcp.mcp_gateway.service.mcp.McpDispatcher;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(LegacyToolController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({GatewayApiExceptionHandler.class, AuthChallenges.class})
@EnableConfigurationProperties(GatewayAuthProperties.class)
class LegacyToolControllerTest {

  private static final String UNAUTHORIZED_CHALLENGE =
      "Bearer resource_metadata=\"https://api.fantasymcp.io/.well-known/oauth-protected-resource\"";
  private static final VerifiedIdentity IDENTITY =
      new VerifiedIdentity(
          "user-1", "https://auth.fantasymcp.test", Instant.parse("2030-01-01T00:00:00Z"));

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private McpDispatcher mcpDispatcher;
  @MockitoBean private CallerAuthenticator callerAuthenticator;
  @MockitoBean private GatewayMetrics gatewayMetrics;

  @BeforeEach
  void setUp() {
    when(callerAuthenticator.developmentUserHeader()).thenReturn("X-User-Id");
  }

  @Test
  void listReturnsToolDescriptors() throws Exception {
    final ArrayNode tools = objectMapper.createArrayNode();
    tools.addObject().put("name", "get_user_session");
    when(mcpDispatcher.toolDescriptors()).thenReturn(tools);

    mockMvc
        .perform(get("/mcp/tools/list"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tools[0].name").value("get_user_session"));
  }

  @Test
  void callWithoutTokenReturnsChallenge() throws Exception {
    when(callerAuthenticator.authenticate(any(), any()))
        .thenReturn(CallerAuthentication.missingCredentials());

    mockMvc
        .perform(
            post("/mcp/tools/call")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tool\":\"get_user_session\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, UNAUTHORIZED_CHALLENGE))
        .andExpect(jsonPath("$.error").value("unauthorized"))
        .andExpect(
            jsonPath("$.message")
                .value("Authentication required. Please provide a valid Bearer token."));
    verify(gatewayMetrics).recordAuthChallenge("unauthorized");
    verify(mcpDispatcher, never()).execute(any(), any(), any());
  }

  @Test
  void callWithRejectedTokenReturnsInvalidTokenChallenge() throws Exception {
    when(callerAuthenticator.authenticate(eq("Bearer bad"), any()))
        .thenReturn(CallerAuthentication.invalidToken(TokenFailureReason.BAD_SIGNATURE));

    mockMvc
        .perform(
            post("/mcp/tools/call")
                .header(HttpHeaders.AUTHORIZATION, "Bearer bad")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tool\":\"get_user_session\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_token"));
  }

  @Test
  void callRunsToolAndWrapsResult() throws Exception {
    authenticated();
    when(mcpDispatcher.execute(eq("get_espn_football_standings"), any(), any()))
        .thenReturn(ToolCallResult.error("ESPN_TIMEOUT: ESPN did not respond in time."));

    mockMvc
        .perform(
            post("/mcp/tools/call")
                .header(HttpHeaders.AUTHORIZATION, "Bearer ok")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tool":"get_espn_football_standings","arguments":{"leagueId":"123"}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isError").value(true))
        .andExpect(jsonPath("$.content[0].type").value("text"))
        .andExpect(
            jsonPath("$.content[0].text").value("ESPN_TIMEOUT: ESPN did not respond in time."));
  }

  @Test
  void callWithoutToolNameIsBadRequest() throws Exception {
    authenticated();

    mockMvc
        .perform(
            post("/mcp/tools/call")
                .header(HttpHeaders.AUTHORIZATION, "Bearer ok")
                .contentType(MediaType.APPLICATION_JSON)
                .content("not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.isError").value(true));
  }

  @Test
  void storeRejectionDuringToolReturnsChallenge() throws Exception {
    authenticated();
    when(mcpDispatcher.execute(any(), any(), any()))
        .thenReturn(ToolCallResult.authFailure("Authentication failed. Please re-authorize."));

    mockMvc
        .perform(
            post("/mcp/tools/call")
                .header(HttpHeaders.AUTHORIZATION, "Bearer ok")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tool\":\"get_user_session\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_token"));
  }

  private void authenticated() {
    when(callerAuthenticator.authenticate(eq("Bearer ok"), any()))
        .thenReturn(CallerAuthentication.authenticated(IDENTITY));
  }
}
