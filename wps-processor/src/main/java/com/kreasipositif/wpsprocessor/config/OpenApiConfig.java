package com.kreasipositif.wpsprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI wpsProcessorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("WPS Processor API")
                        .description("""
                                Builds, validates and submits UAE Wage Protection System salary files.
                                
                                **Exposed resources:**
                                - `/api/v1/wps/batches` — batches, lines, validation and SIF files
                                - `/api/v1/wps/submissions` — bank submissions, retries and status
                                - `/api/v1/wps/connections` — bank submission channels
                                - `/api/v1/wps/validation-rules` — the active rule set
                                - `/api/v1/wps/compliance` — monthly compliance records
                                - `/api/v1/wps/jobs` — asynchronous SIF generation jobs
                                
                                Mutating calls take the acting user from the `X-Actor` header.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kreasi Positif")
                                .url("https://github.com/kreasipositif"))
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
