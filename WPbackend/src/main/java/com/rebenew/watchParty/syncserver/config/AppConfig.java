package com.rebenew.watchParty.syncserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@EnableConfigurationProperties(SyncServerProperties.class)
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // Un solo hilo basta: solo se usa para recolectar salas vacías
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduledExecutorService() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "room-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(SyncServerProperties properties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageSize());
        container.setMaxBinaryMessageBufferSize(properties.getMaxTextMessageSize());
        container.setMaxSessionIdleTimeout(properties.getSessionIdleTimeout().toMillis());
        return container;
    }
}
