package com.ospicorp.opscopilot.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Ops Copilot API")
            .version("v1")
            .description("Upload sales, inventory and expense exports and ask questions about them")
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
