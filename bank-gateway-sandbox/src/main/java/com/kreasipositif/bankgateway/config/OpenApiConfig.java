package com.kreasipositif.bankgateway.config;

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

    @Value("${server.port:8082}")
    private String serverPort;

    @Bean
    public OpenAPI bankGatewayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bank Gateway Sandbox API")
                        .description("""
                                Simulated bank host-to-host WPS channel for the wps-processor REST connector.

                                **Exposed resources:**
                                - `POST /api/v1/wps/files` — upload a SIF file (base64) with its SHA-256
                                - `GET /api/v1/wps/files/{reference}/status` — settlement status
                                - `GET /api/v1/wps/health` — connection test

                                Every call needs a configured API key in `X-API-Key`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kreasi Positif")
                                .url("https://github.com/kreasipositif/demo-spring-batch"))
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
