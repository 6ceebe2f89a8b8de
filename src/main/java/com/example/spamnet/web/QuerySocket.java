package com.example.spamnet.web;

import com.example.spamnet.service.SpammerService;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.sql.SQLException;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.StatusCode;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketConnect;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket check endpoint. Every text frame names one identifier and is
 * answered with the same JSON as {@code GET /check}.
 */
@WebSocket
public class QuerySocket {

    private static final Logger LOG = LoggerFactory.getLogger(QuerySocket.class);

    private final SpammerService spammers;
    private final Gson gson = new Gson();

    public QuerySocket(SpammerService spammers) {
        this.spammers = spammers;
    }

    @OnWebSocketConnect
    public void onConnect(Session session) {
        if (!LocalOnlyFilter.isLocal(session.getRemoteAddress())) {
            LOG.warn("Rejecting WebSocket client {}", session.getRemoteAddress());
            session.close(StatusCode.POLICY_VIOLATION, "Localhost only");
            return;
        }
        LOG.debug("WebSocket client connected: {}", session.getRemoteAddress());
    }

    @OnWebSocketMessage
    public void onMessage(Session session, String text) {
        reply(session, answer(text));
    }

    @OnWebSocketClose
    public void onClose(Session session, int statusCode, String reason) {
        LOG.debug("WebSocket client {} closed: {} {}", session.getRemoteAddress(), statusCode, reason);
    }

    @OnWebSocketError
    public void onError(Session session, Throwable error) {
        LOG.warn("WebSocket error from {}: {}", session == null ? "?" : session.getRemoteAddress(), error.toString());
    }

    String answer(String text) {
        Dto.QueryFrame frame;
        try {
            frame = gson.fromJson(text, Dto.QueryFrame.class);
        } catch (JsonParseException e) {
            return gson.toJson(Dto.fail("Invalid JSON"));
        }
        if (frame == null || frame.id() == null || frame.id().isBlank()) {
            return gson.toJson(Dto.fail("Missing user_id"));
        }
        try {
            return gson.toJson(Dto.check(spammers.check(frame.id())));
        } catch (SQLException e) {
            LOG.error("Check of {} failed", frame.id(), e);
            return gson.toJson(Dto.fail("Store error"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return gson.toJson(Dto.fail("Interrupted"));
        }
    }

    private void reply(Session session, String json) {
        if (!session.isOpen()) return;
        try {
            session.getRemote().sendString(json);
        } catch (IOException e) {
            LOG.info("Could not answer WebSocket client {}: {}", session.getRemoteAddress(), e.getMessage());
        }
    }
}
