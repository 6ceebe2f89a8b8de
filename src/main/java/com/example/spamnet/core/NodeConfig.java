package com.example.spamnet.core;

import com.example.spamnet.transport.PeerAddress;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Startup configuration of a node.
 *
 * <p>Sources, later ones winning: the classpath resource {@code spamnet.properties},
 * the file named by the {@code spamnet.config} system property, {@code spamnet.*}
 * system properties, then positional arguments {@code [p2pPort] [host:port ...]}.
 */
public class NodeConfig {

    public static final String RESOURCE = "spamnet.properties";
    public static final String CONFIG_FILE_PROPERTY = "spamnet.config";
    private static final String SYSTEM_PREFIX = "spamnet.";

    public int p2pPort = Settings.DEFAULT_P2P_PORT;
    public int wsPort = Settings.DEFAULT_WS_PORT;
    public int httpPort = Settings.DEFAULT_HTTP_PORT;
    public String dbPath = Settings.DB_NAME;
    public List<PeerAddress> bootstrap = new ArrayList<>();

    public int ledgerMaxSize = Settings.SEEN_MSG_MAX_SIZE;
    public long ledgerTtlMs = Settings.SEEN_MSG_TTL_MS;
    public long queryTimeoutMs = Settings.QUERY_TIMEOUT_MS;
    public boolean networkQuery = true;
    public long reconnectInitialDelayMs = Settings.RECONNECT_INITIAL_DELAY_MS;
    public long reconnectMaxDelayMs = Settings.RECONNECT_MAX_DELAY_MS;
    public int maxPeers = Settings.MAX_PEERS;

    public static NodeConfig load(String[] args) throws IOException {
        Properties props = new Properties();
        try (InputStream in = NodeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        String external = System.getProperty(CONFIG_FILE_PROPERTY);
        if (external != null && !external.isBlank()) {
            try (Reader r = Files.newBufferedReader(Path.of(external), StandardCharsets.UTF_8)) {
                props.load(r);
            }
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX) && !name.equals(CONFIG_FILE_PROPERTY)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        NodeConfig config = fromProperties(props);
        config.applyArgs(args);
        return config;
    }

    public static NodeConfig fromProperties(Properties props) {
        NodeConfig c = new NodeConfig();
        c.p2pPort = intProp(props, "p2p.port", c.p2pPort);
        c.wsPort = intProp(props, "ws.port", c.wsPort);
        c.httpPort = intProp(props, "http.port", c.httpPort);
        c.dbPath = props.getProperty("db.path", c.dbPath).trim();
        c.bootstrap = parseAddressList(props.getProperty("bootstrap", ""));
        c.ledgerMaxSize = intProp(props, "ledger.maxSize", c.ledgerMaxSize);
        c.ledgerTtlMs = longProp(props, "ledger.ttlMs", c.ledgerTtlMs);
        c.queryTimeoutMs = longProp(props, "query.timeoutMs", c.queryTimeoutMs);
        c.networkQuery = Boolean.parseBoolean(props.getProperty("query.network", String.valueOf(c.networkQuery)).trim());
        c.reconnectInitialDelayMs = longProp(props, "reconnect.initialDelayMs", c.reconnectInitialDelayMs);
        c.reconnectMaxDelayMs = longProp(props, "reconnect.maxDelayMs", c.reconnectMaxDelayMs);
        c.maxPeers = intProp(props, "peers.max", c.maxPeers);
        c.validate();
        return c;
    }

    void applyArgs(String[] args) {
        if (args == null || args.length == 0) return;
        p2pPort = Integer.parseInt(args[0].trim());
        for (int i = 1; i < args.length; i++) {
            PeerAddress addr = PeerAddress.parse(args[i]);
            if (!bootstrap.contains(addr)) {
                bootstrap.add(addr);
            }
        }
        validate();
    }

    public static List<PeerAddress> parseAddressList(String csv) {
        List<PeerAddress> out = new ArrayList<>();
        if (csv == null) return out;
        for (String part : csv.split(",")) {
            if (part.isBlank()) continue;
            PeerAddress addr = PeerAddress.parse(part);
            if (!out.contains(addr)) {
                out.add(addr);
            }
        }
        return out;
    }

    private void validate() {
        checkPort("p2p.port", p2pPort);
        checkPort("ws.port", wsPort);
        checkPort("http.port", httpPort);
        if (dbPath == null || dbPath.isEmpty()) throw new IllegalArgumentException("db.path is empty");
        if (ledgerMaxSize <= 0) throw new IllegalArgumentException("ledger.maxSize must be > 0");
        if (ledgerTtlMs <= 0) throw new IllegalArgumentException("ledger.ttlMs must be > 0");
        if (queryTimeoutMs <= 0) throw new IllegalArgumentException("query.timeoutMs must be > 0");
        if (reconnectInitialDelayMs <= 0 || reconnectMaxDelayMs < reconnectInitialDelayMs) {
            throw new IllegalArgumentException("reconnect delays must satisfy 0 < initial <= max");
        }
        if (maxPeers <= 0) throw new IllegalArgumentException("peers.max must be > 0");
    }

    private static void checkPort(String key, int port) {
        // 0 binds an ephemeral port
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(key + " out of range: " + port);
        }
    }

    private static int intProp(Properties props, String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + v, e);
        }
    }

    private static long longProp(Properties props, String key, long def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + v, e);
        }
    }
}
