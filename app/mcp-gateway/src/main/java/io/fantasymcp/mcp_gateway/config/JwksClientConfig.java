package io.fantasymcp.mcp_gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({GatewayAuthProperties.class, McpServerProperties.class})
public class JwksClientConfig {

  @Bean
  RestClient jwksRestClient(RestClient.Builder builder, GatewayAuthProperties properties) {
    // issuer ごとに URL が変わるため baseUrl は持たない
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.jwksConnectTimeout());
    requestFactory.setReadTimeout(properties.jwksReadTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
