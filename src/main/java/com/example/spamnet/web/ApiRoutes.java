package com.example.spamnet.web;

import com.example.spamnet.core.NodeConfig;
import com.example.spamnet.service.NodeManager;
import com.example.spamnet.service.SpammerService;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import com.example.spamnet.store.StoreWriteException;
import com.example.spamnet.transport.PeerInfo;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;
import spark.Service;

public class ApiRoutes {

    private static final Logger LOG = LoggerFactory.getLogger(ApiRoutes.class);

    private final Gson gson;
    private final SpammerService spammers;
    private final NodeManager node;
    private final NodeConfig config;

    public ApiRoutes(SpammerService spammers, NodeManager node, NodeConfig config) {
        this.gson = new Gson();
        this.spammers = spammers;
        this.node = node;
        this.config = config;
    }

    public void register(Service http) {
        http.get("/check", this::getCheck);
        http.post("/report_id", this::postReport);
        http.post("/remove_id", this::postRemove);

        http.get("/records", this::getRecords);
        http.get("/peers", this::getPeers);
        http.get("/me", this::getMe);
    }

    private Object getCheck(Request req, Response res) throws SQLException, InterruptedException {
        res.type("application/json");
        String id = req.queryParams("user_id");
        if (id == null || id.isBlank()) {
            res.status(400);
            return gson.toJson(Dto.fail("Missing user_id"));
        }
        return gson.toJson(Dto.check(spammers.check(id)));
    }

    private Object postReport(Request req, Response res) throws StoreWriteException {
        res.type("application/json");
        Dto.ReportRequest body = parse(req.body(), Dto.ReportRequest.class);
        if (body == null || body.id() == null || body.id().isBlank()) {
            res.status(400);
            return gson.toJson(Dto.fail("Missing identifier"));
        }
        if (body.timestamp != null && body.timestamp <= 0) {
            res.status(400);
            return gson.toJson(Dto.fail("Invalid timestamp"));
        }
        Dto.ReportResult out = new Dto.ReportResult();
        out.identifier = body.id().trim();
        out.changed = spammers.report(body.id(), body.note, body.timestamp);
        return gson.toJson(Dto.ok(out));
    }

    private Object postRemove(Request req, Response res) throws StoreWriteException {
        res.type("application/json");
        String id = req.queryParams("user_id");
        if (id == null || id.isBlank()) {
            res.status(400);
            return gson.toJson(Dto.fail("Missing user_id"));
        }
        Dto.RemoveResult out = new Dto.RemoveResult();
        out.identifier = id.trim();
        out.removed = spammers.purge(id);
        return gson.toJson(Dto.ok(out));
    }

    private Object getRecords(Request req, Response res) throws SQLException {
        res.type("application/json");
        List<Dto.RecordDto> out = new ArrayList<>();
        for (SpammerRecord r : spammers.all()) {
            out.add(Dto.record(r));
        }
        return gson.toJson(Dto.ok(out));
    }

    private Object getPeers(Request req, Response res) {
        res.type("application/json");
        List<Dto.PeerDto> out = new ArrayList<>();
        for (PeerInfo p : node.livePeers()) {
            out.add(Dto.peer(p));
        }
        return gson.toJson(Dto.ok(out));
    }

    private Object getMe(Request req, Response res) throws SQLException {
        res.type("application/json");
        Dto.MeDto me = new Dto.MeDto();
        me.nodeId = node.identity().nodeId();
        me.startedAt = node.identity().startedAtMs();
        me.p2pPort = node.localPort();
        me.httpPort = config.httpPort;
        me.wsPort = config.wsPort;
        me.livePeers = node.liveCount();
        me.records = spammers.count();
        return gson.toJson(Dto.ok(me));
    }

    private <T> T parse(String body, Class<T> type) {
        if (body == null || body.isBlank()) return null;
        try {
            return gson.fromJson(body, type);
        } catch (JsonParseException e) {
            LOG.debug("Bad request body: {}", e.getMessage());
            return null;
        }
    }
}
