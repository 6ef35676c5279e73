package com.transitlog.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

        @Bean
        public OpenAPI transitlogOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Transitlog API documentation")
                                                .description(
                                                                "### Transitlog ingestion API\n\n" +
                                                                                "Records TransLink (Metro Vancouver) bus data for later analysis. "
                                                                                +
                                                                                "Each request fetches a dataset, returns the normalized records and saves them to the configured storage targets in the background.\n\n"
                                                                                +
                                                                                "#### Datasets:\n" +
                                                                                "- **Realtime**: `positions` and `alerts` from the GTFS-realtime feeds.\n"
                                                                                +
                                                                                "- **Schedule**: `trips`, `stops`, `routes` and `paths` from the static GTFS archive of a service date.\n")
                                                .version("v2.0.0")
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development (HTTP)")));
        }
}
