package com.liveclass.server.config;

import com.liveclass.server.ws.ClassroomSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the classroom socket endpoint.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ClassroomSocketHandler handler;

    @Value("${classroom.ws.path:/classroom}")
    private String path;

    @Value("${classroom.allowed-origins:http://localhost:5173}")
    private String[] allowedOrigins;

    @Value("${classroom.ws.max-message-bytes:1048576}")
    private int maxMessageBytes;

    public WebSocketConfig(ClassroomSocketHandler handler) {
        this.handler = handler;
    }

    /**
     * SDP offers can be large.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxMessageBytes);
        container.setMaxBinaryMessageBufferSize(maxMessageBytes);
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path)
                .setAllowedOrigins(allowedOrigins);
    }
}
