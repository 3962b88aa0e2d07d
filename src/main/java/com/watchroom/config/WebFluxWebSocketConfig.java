package com.watchroom.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.watchroom.handler.WatchRoomWebSocketHandler;

import reactor.netty.http.server.WebsocketServerSpec;

/**
 * WebFlux WebSocket configuration.
 * Mounts the watch room handler on Reactor Netty.
 */
@Configuration
public class WebFluxWebSocketConfig {

    // Control frames only: room settings, playback state, chat and signaling blobs
    private static final int MAX_FRAME_PAYLOAD = 256 * 1024;

    private final WatchRoomWebSocketHandler watchRoomHandler;
    private final WatchRoomProperties properties;

    public WebFluxWebSocketConfig(WatchRoomWebSocketHandler watchRoomHandler, WatchRoomProperties properties) {
        this.watchRoomHandler = watchRoomHandler;
        this.properties = properties;
    }

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        Map<String, WebSocketHandler> map = new HashMap<>();
        map.put(properties.getEndpoint(), watchRoomHandler);

        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        handlerMapping.setUrlMap(map);
        return handlerMapping;
    }

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() {
        return new WebSocketHandlerAdapter(webSocketService());
    }

    @Bean
    public WebSocketService webSocketService() {
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
            () -> WebsocketServerSpec.builder().maxFramePayloadLength(MAX_FRAME_PAYLOAD)
        );
        return new HandshakeWebSocketService(strategy);
    }
}
