package com.example.chathub.ws;

import com.example.chathub.config.ChathubProperties;
import com.example.chathub.identity.IdentityClient;
import com.example.chathub.room.RoomRegistry;
import com.example.chathub.service.HistoryService;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.time.Clock;

@Component
public class ConnectionSessionFactory {

    private final IdentityClient identityClient;
    private final RoomRegistry registry;
    private final Broadcaster broadcaster;
    private final HistoryService history;
    private final FrameDecoder decoder;
    private final ChathubProperties properties;
    private final Clock clock;

    public ConnectionSessionFactory(IdentityClient identityClient,
                                    RoomRegistry registry,
                                    Broadcaster broadcaster,
                                    HistoryService history,
                                    FrameDecoder decoder,
                                    ChathubProperties properties,
                                    Clock clock) {
        this.identityClient = identityClient;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.history = history;
        this.decoder = decoder;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Wraps the raw socket so broadcasts from other threads are serialised per connection.
     */
    public ConnectionSession create(WebSocketSession raw, long groupId, String credential) {
        ChathubProperties.WebSocket ws = properties.getWebsocket();
        WebSocketSession socket = new ConcurrentWebSocketSessionDecorator(
                raw, (int) ws.getSendTimeLimit().toMillis(), ws.getSendBufferSizeLimit());
        return new ConnectionSession(socket, groupId, credential,
                identityClient, registry, broadcaster, history, decoder, properties.getChat(), clock);
    }
}
