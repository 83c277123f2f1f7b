package com.example.vparam.config;

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
        title = "Vparam API",
        version = "v1",
        description = "Try out parameter specs against sample input and list the registered types and filters.",
        contact = @Contact(name = "Vparam Team", email = "support@vparam.local")
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
            .title("Vparam API")
            .version("v1")
            .description("Swagger UI for the parameter validation playground.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi vparamApi() {
    return GroupedOpenApi.builder()
        .group("vparam")
        .packagesToScan("com.example.vparam.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
