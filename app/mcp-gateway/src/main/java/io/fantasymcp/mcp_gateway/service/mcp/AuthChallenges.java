package io.fantasymcp.mcp_gateway.service.mcp;

import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import org.springframework.stereotype.Component;

/** WWW-Authenticate ヘッダと、JSON-RPC エラーの _meta に載せるチャレンジ記述子を組み立てる。 */
@Component
public class AuthChallenges {

  private final String resourceMetadataUrl;

  public AuthChallenges(GatewayAuthProperties properties) {
    this.resourceMetadataUrl = properties.resourceMetadataUrl();
  }

  public String header(AuthChallenge challenge) {
    final String base = "Bearer resource_metadata=\"" + resourceMetadataUrl + "\"";
    if (challenge == AuthChallenge.UNAUTHORIZED) {
      return base;
    }
    return base + ", error=\"" + challenge.error() + "\"";
  }

  public String descriptor(AuthChallenge challenge) {
    return "Bearer resource_metadata=\""
        + resourceMetadataUrl
        + "\", error=\""
        + challenge.error()
        + "\", error_description=\""
        + challenge.description()
        + "\"";
  }
}
