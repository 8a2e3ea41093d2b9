package com.liveclass.server.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by connection handle. Sessions are wrapped so concurrent senders are
 * serialized per connection and a slow client cannot block the sender indefinitely.
 */
@Component
public class ConnectionRegistry {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public ConnectionRegistry(@Value("${classroom.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
                              @Value("${classroom.ws.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
    }

    public void unregister(String socketId) {
        sessions.remove(socketId);
    }

    public WebSocketSession get(String socketId) {
        return sessions.get(socketId);
    }

    public boolean isConnected(String socketId) {
        WebSocketSession s = sessions.get(socketId);
        return s != null && s.isOpen();
    }

    public int size() {
        return sessions.size();
    }
}
