package com.rebenew.watchParty.syncserver.config;

import com.rebenew.watchParty.syncserver.websocket.SyncWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SyncWebSocketHandler syncWebSocketHandler;
    private final SyncServerProperties properties;

    public WebSocketConfig(SyncWebSocketHandler syncWebSocketHandler, SyncServerProperties properties) {
        this.syncWebSocketHandler = syncWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(syncWebSocketHandler, properties.getEndpoint())
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
