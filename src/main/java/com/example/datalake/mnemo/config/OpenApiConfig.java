package com.example.datalake.mnemo.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Mnemo API",
        version = "v1",
        description = "Knowledge items, file index control and memory context preview.",
        contact = @Contact(name = "Mnemo Team", email = "support@mnemo.local")
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("Mnemo API")
            .version("v1")
            .description("Swagger UI for the long-term memory engine.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi memoryApi() {
    return GroupedOpenApi.builder()
        .group("memory")
        .packagesToScan("com.example.datalake.mnemo.controller")
        .pathsToMatch("/api/v1/**", "/health")
        .build();
  }
}
