package com.example.spamnet;

import com.example.spamnet.core.NodeConfig;
import com.example.spamnet.core.NodeIdentity;
import com.example.spamnet.service.NodeManager;
import com.example.spamnet.service.SpammerService;
import com.example.spamnet.store.Db;
import com.example.spamnet.store.SpammerDao;
import com.example.spamnet.web.ApiRoutes;
import com.example.spamnet.web.QuerySocket;
import com.example.spamnet.web.QuerySocketServer;
import com.example.spamnet.web.WebServer;
import java.io.IOException;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Launcher {

    private static final Logger LOG = LoggerFactory.getLogger(Launcher.class);

    public static void main(String[] args) {
        NodeConfig config;
        try {
            config = NodeConfig.load(args);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        Db db;
        try {
            db = Db.open(config.dbPath);
        } catch (SQLException e) {
            LOG.error("Failed to open database {}", config.dbPath, e);
            System.exit(1);
            return;
        }

        NodeIdentity identity = NodeIdentity.generate();
        SpammerDao store = new SpammerDao(db);
        NodeManager node = new NodeManager(identity, config, store);
        try {
            node.start();
        } catch (IOException e) {
            LOG.error("Failed to bind P2P port {}", config.p2pPort, e);
            db.close();
            System.exit(1);
            return;
        }

        SpammerService spammers = new SpammerService(identity, store, node, config);
        WebServer webServer = new WebServer(config.httpPort, new ApiRoutes(spammers, node, config));
        QuerySocketServer socketServer = new QuerySocketServer(config.wsPort, new QuerySocket(spammers));
        webServer.start();
        socketServer.start();

        LOG.info("Node {} up: p2p={} http={} ws={} db={}",
                identity, node.localPort(), webServer.port(), socketServer.port(), config.dbPath);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            socketServer.close();
            webServer.close();
            node.stop();
            db.close();
        }, "shutdown"));
    }
}
