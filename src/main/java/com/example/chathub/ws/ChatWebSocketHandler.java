package com.example.chathub.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Socket endpoint for {@code /ws/group/{groupId}}. Each accepted socket gets its own
 * {@link ConnectionSession}; the container delivers one connection's frames sequentially.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ConnectionSessionFactory sessionFactory;

    // Keep per-socket state
    private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(ConnectionSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Object groupAttr = session.getAttributes().get(GroupHandshakeInterceptor.ATTR_GROUP_ID);
        if (!(groupAttr instanceof Long)) {
            // handshake interceptor guarantees this; guard against misconfigured mappings
            log.warn("connection without group id. sessionId={} uri={}", session.getId(), session.getUri());
            closeQuietly(session, CloseStatus.BAD_DATA);
            return;
        }
        String credential = (String) session.getAttributes().get(GroupHandshakeInterceptor.ATTR_CREDENTIAL);

        ConnectionSession cs = sessionFactory.create(session, (Long) groupAttr, credential);
        sessions.put(session.getId(), cs);
        cs.open();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        ConnectionSession cs = sessions.get(session.getId());
        if (cs == null) return;
        cs.handle(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("transport error. sessionId={} error={}", session.getId(), exception.toString());
        if (session.isOpen()) {
            closeQuietly(session, CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionSession cs = sessions.remove(session.getId());
        if (cs != null) cs.onClosed(status);
    }

    public int sessionCount() {
        return sessions.size();
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (Exception e) {
            log.debug("close failed. sessionId={} error={}", session.getId(), e.toString());
        }
    }
}
