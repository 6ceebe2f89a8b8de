package com.example.spamnet.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Service;

/** Serves {@link QuerySocket} at path {@code /} on its own port. */
public class QuerySocketServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(QuerySocketServer.class);

    private final int port;
    private final QuerySocket socket;
    private volatile Service ws;

    public QuerySocketServer(int port, QuerySocket socket) {
        this.port = port;
        this.socket = socket;
    }

    public void start() {
        if (ws != null) return;
        Service service = Service.ignite().port(port);
        service.initExceptionHandler(e -> LOG.error("WebSocket gateway failed to start on port {}", port, e));
        service.webSocket("/", socket);
        service.init();
        service.awaitInitialization();
        ws = service;
        LOG.info("WebSocket gateway on port {}", service.port());
    }

    public int port() {
        Service service = ws;
        return service == null ? -1 : service.port();
    }

    @Override
    public void close() {
        Service service = ws;
        if (service == null) return;
        ws = null;
        service.stop();
        service.awaitStop();
    }
}
