package com.xksgroup.signagesync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8080}") int serverPort) {

        // Serveurs
        Server localDevice = new Server()
                .url("http://localhost:" + serverPort)
                .description("Agent local de l'écran");

        return new OpenAPI()
                .info(new Info()
                        .title("API Signage Sync")
                        .version("v1")
                        .description("Synchronisation du contenu publicitaire et planification des playlists de l'écran"))
                .servers(List.of(localDevice));
    }
}
