package com.example.chathub.ws;

import com.example.chathub.config.ChathubProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final ChathubProperties properties;

    public WebSocketConfig(ChatWebSocketHandler chatWebSocketHandler, ChathubProperties properties) {
        this.chatWebSocketHandler = chatWebSocketHandler;
        this.properties = properties;
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getWebsocket().getMaxTextMessageBufferSize());
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        ChathubProperties.WebSocket ws = properties.getWebsocket();
        registry.addHandler(chatWebSocketHandler, ws.getPath())
                .addInterceptors(new GroupHandshakeInterceptor(ws.getPath()))
                .setAllowedOriginPatterns(ws.getAllowedOrigins());
    }
}
