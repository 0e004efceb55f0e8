package io.fantasymcp.mcp_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@RestController
public class McpGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(McpGatewayApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "mcp-gateway: ok";
  }
}
