package com.example.contextsync.transport;

import com.example.contextsync.config.ContextServiceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping contextWebSocketMapping(ContextWebSocketHandler handler, ContextServiceProperties properties) {
        return new SimpleUrlHandlerMapping(Map.of(properties.getWebsocketPath(), handler), -1);
    }
}
