package io.fantasymcp.mcp_gateway.api;

import io.fantasymcp.mcp_gateway.api.response.ProtectedResourceMetadataResponse;
import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ProtectedResourceMetadataController {

  private final GatewayAuthProperties properties;

  @GetMapping("/.well-known/oauth-protected-resource")
  public ResponseEntity<ProtectedResourceMetadataResponse> metadata() {
    return ResponseEntity.ok()
        .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePublic())
        .body(
            new ProtectedResourceMetadataResponse(
                properties.resource(),
                properties.authorizationServers(),
                List.of("header"),
                properties.scopesSupported()));
  }
}
