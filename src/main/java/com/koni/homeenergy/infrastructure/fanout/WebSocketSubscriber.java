package com.koni.homeenergy.infrastructure.fanout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Subscriber backed by a WebSocket session.
 * The broadcaster sends from one delivery thread at a time per subscriber.
 */
@Slf4j
public class WebSocketSubscriber implements Subscriber {

    private final WebSocketSession session;

    public WebSocketSubscriber(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String message) throws IOException {
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Closing subscriber {} failed: {}", getId(), e.getMessage());
        }
    }
}
