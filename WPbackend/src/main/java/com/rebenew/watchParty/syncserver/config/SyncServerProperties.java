package com.rebenew.watchParty.syncserver.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuración del servidor de sincronización (prefijo {@code watchparty} en application.yml).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "watchparty")
public class SyncServerProperties {

    private String endpoint = "/ws";
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private int maxNameLength = 40;
    private String defaultName = "guest";
    private int roomIdLength = 8;

    // Salas creadas por REST que nadie llegó a usar
    private Duration emptyRoomTtl = Duration.ofMinutes(10);
    private Duration sweepInterval = Duration.ofSeconds(30);

    private int maxTextMessageSize = 8192;
    private Duration sessionIdleTimeout = Duration.ofMinutes(5);
}
