package io.fantasymcp.mcp_gateway.config;

import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(LeagueStoreClientProperties.class)
public class LeagueStoreClientConfig {

  @Bean
  RestClient leagueStoreRestClient(
      RestClient.Builder builder, LeagueStoreClientProperties properties) {
    // PATCH を送るため HttpURLConnection ではなく JDK HttpClient を使う
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
