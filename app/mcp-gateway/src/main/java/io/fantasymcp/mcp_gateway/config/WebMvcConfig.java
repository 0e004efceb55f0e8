/*
 * どこで: MCP Gateway Web 設定
 * 何を: RequestMdcInterceptor を actuator 以外の全リクエストへ適用する
 * なぜ: ツール呼び出しログへ request_id と correlation_id を安定して埋め込むため
 */
package io.fantasymcp.mcp_gateway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).excludePathPatterns("/actuator/**");
  }
}
