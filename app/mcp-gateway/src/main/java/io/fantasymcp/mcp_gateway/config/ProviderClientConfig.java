package io.fantasymcp.mcp_gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ProviderClientProperties.class)
public class ProviderClientConfig {

  @Bean
  RestClient providerRestClient(RestClient.Builder builder, ProviderClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader("User-Agent", properties.userAgent())
        .defaultHeader("X-Fantasy-Source", properties.fantasySource())
        .defaultHeader("X-Fantasy-Platform", properties.fantasyPlatform())
        .build();
  }
}
