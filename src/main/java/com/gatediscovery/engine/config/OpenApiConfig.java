package com.gatediscovery.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI gateDiscoveryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Gate Discovery API")
                        .description("Discovers venue gates from wristband check-ins and learns which ticket " +
                                "categories each gate serves.\n\n" +
                                "## Flow\n\n" +
                                "1. Scanners post check-ins via REST or STOMP\n" +
                                "2. Discovery clusters accurate scans into gates\n" +
                                "3. Enforcement learns category bindings and flags violations\n" +
                                "4. Duplicate detection proposes merges of gates that are the same place\n" +
                                "5. Validation answers ALLOW / WARN / DENY from cached gate snapshots\n\n" +
                                "## WebSocket\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/checkin-stream`\n\n" +
                                "- `/app/checkin` - stream a check-in\n" +
                                "- `/app/validate` - validate without storing\n" +
                                "- `/app/ping` - liveness\n" +
                                "- `/topic/alerts` - flagged and denied scans\n" +
                                "- `/user/queue/decisions` - per-scanner replies")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
