package com.example.spamnet.web;

import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Service;

/** HTTP gateway for local clients. */
public class WebServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WebServer.class);

    private final int port;
    private final ApiRoutes apiRoutes;
    private final Gson gson = new Gson();
    private volatile Service http;

    public WebServer(int port, ApiRoutes apiRoutes) {
        this.port = port;
        this.apiRoutes = apiRoutes;
    }

    public void start() {
        if (http != null) return;
        Service service = Service.ignite().port(port);
        service.initExceptionHandler(e -> LOG.error("HTTP gateway failed to start on port {}", port, e));

        service.before((req, res) -> LocalOnlyFilter.enforce(req, res));

        service.exception(LocalOnlyFilter.LocalOnlyRejectedException.class, (e, req, res) -> {
            res.status(403);
            res.type("application/json");
            res.body(gson.toJson(Dto.fail("Localhost only")));
        });

        service.exception(IllegalArgumentException.class, (e, req, res) -> {
            res.status(400);
            res.type("application/json");
            res.body(gson.toJson(Dto.fail(e.getMessage())));
        });

        service.exception(Exception.class, (e, req, res) -> {
            LOG.error("{} {} failed", req.requestMethod(), req.pathInfo(), e);
            res.status(500);
            res.type("application/json");
            res.body(gson.toJson(Dto.fail("Internal error: " + e.getMessage())));
        });

        service.notFound((req, res) -> {
            res.status(404);
            res.type("application/json");
            return gson.toJson(Dto.fail("Not found"));
        });

        apiRoutes.register(service);
        service.init();
        service.awaitInitialization();
        http = service;
        LOG.info("HTTP gateway on port {}", service.port());
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        Service service = http;
        return service == null ? -1 : service.port();
    }

    @Override
    public void close() {
        Service service = http;
        if (service == null) return;
        http = null;
        service.stop();
        service.awaitStop();
    }
}
