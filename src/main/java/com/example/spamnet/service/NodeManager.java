package com.example.spamnet.service;

import com.example.spamnet.core.NodeConfig;
import com.example.spamnet.core.NodeIdentity;
import com.example.spamnet.core.Settings;
import com.example.spamnet.protocol.Errors;
import com.example.spamnet.protocol.MessageCodec;
import com.example.spamnet.protocol.MessageEnvelope;
import com.example.spamnet.protocol.MessageKind;
import com.example.spamnet.protocol.Payloads;
import com.example.spamnet.store.SpammerDao;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import com.example.spamnet.store.StoreWriteException;
import com.example.spamnet.transport.Connection;
import com.example.spamnet.transport.ConnectionManager;
import com.example.spamnet.transport.InboundMessage;
import com.example.spamnet.transport.PeerAddress;
import com.example.spamnet.transport.PeerInfo;
import com.example.spamnet.transport.PeerUnreachableException;
import com.example.spamnet.transport.TcpServer;
import com.example.spamnet.util.LruTtlSet;
import com.example.spamnet.util.NamedThreadFactory;
import com.example.spamnet.util.Net;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns this node's place in the mesh: the listener, every peer connection, the
 * dedup ledger and the known-peer tiers.
 *
 * <p>Bootstrap addresses come from configuration and are redialed with capped
 * exponential backoff whenever they are down. Addresses learned from
 * announcements are dialed once, while fewer than {@code peers.max} links are
 * up, and never retried.
 *
 * <p>The connection table and the ledger are guarded by a single lock. Network
 * I/O, store access and dispatch happen outside it.
 */
public class NodeManager implements Connection.Listener, TcpServer.Acceptor, Dispatcher.PeerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(NodeManager.class);

    private final NodeIdentity identity;
    private final NodeConfig config;
    private final SpammerDao store;
    private final PendingQueries pendingQueries = new PendingQueries();
    private final Dispatcher dispatcher;

    private final Object lock = new Object();
    private final ConnectionManager connections = new ConnectionManager();
    private final LruTtlSet ledger;
    private final Set<PeerAddress> bootstrap;
    private final Map<String, PeerAddress> learned = new LinkedHashMap<>();
    private final Map<PeerAddress, Integer> failedAttempts = new HashMap<>();
    private final Set<PeerAddress> selfAddresses = new HashSet<>();

    private final ExecutorService ioPool;
    private final ScheduledExecutorService scheduler;
    private final TcpServer tcpServer;

    private volatile boolean running;

    public NodeManager(NodeIdentity identity, NodeConfig config, SpammerDao store) {
        this.identity = identity;
        this.config = config;
        this.store = store;
        this.ledger = new LruTtlSet(config.ledgerMaxSize, config.ledgerTtlMs);
        this.bootstrap = Collections.unmodifiableSet(new LinkedHashSet<>(config.bootstrap));
        this.dispatcher = new Dispatcher(identity, store, pendingQueries, this);
        this.ioPool = Executors.newCachedThreadPool(new NamedThreadFactory("p2p-io"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("p2p-reconnect"));
        this.tcpServer = new TcpServer(config.p2pPort, ioPool, this);
    }

    /**
     * Binds the listener, then starts dialing bootstrap peers in the background.
     * Succeeds even when no bootstrap peer is reachable.
     *
     * @throws IOException if the listen port cannot be bound
     */
    public void start() throws IOException {
        if (running) return;
        running = true;
        try {
            tcpServer.start();
        } catch (IOException e) {
            running = false;
            throw e;
        }
        LOG.info("Node {} listening on {}, {} bootstrap peer(s)", identity, localPort(), bootstrap.size());
        for (PeerAddress addr : bootstrap) {
            scheduleBootstrapDial(addr, 0);
        }
    }

    public void stop() {
        if (!running) return;
        running = false;
        tcpServer.stop();
        scheduler.shutdownNow();
        List<Connection> all;
        synchronized (lock) {
            all = connections.drainAll();
        }
        for (Connection c : all) {
            c.close();
        }
        pendingQueries.cancelAll();
        ioPool.shutdownNow();
        try {
            if (!ioPool.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warn("I/O threads did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Node {} stopped", identity);
    }

    public NodeIdentity identity() {
        return identity;
    }

    public boolean isRunning() {
        return running && tcpServer.isRunning();
    }

    public int localPort() {
        return tcpServer.localPort();
    }

    public List<PeerInfo> livePeers() {
        List<PeerInfo> out = new ArrayList<>();
        synchronized (lock) {
            for (Connection c : connections.live()) {
                PeerInfo rp = c.remotePeer();
                if (rp != null) out.add(rp);
            }
        }
        return out;
    }

    public int liveCount() {
        synchronized (lock) {
            return connections.liveCount();
        }
    }

    // ---- outbound dialing ----

    /**
     * Opens a connection to {@code addr} and waits for the handshake.
     *
     * @return the live connection to the node at {@code addr}, or null if the
     *         address turned out to be this node or a dial is already in flight
     */
    public Connection dial(PeerAddress addr) throws PeerUnreachableException {
        synchronized (lock) {
            if (selfAddresses.contains(addr)) return null;
            Connection existing = connections.getByAddr(addr);
            if (existing != null) return existing;
            if (!connections.markDialing(addr)) return null;
        }
        Socket socket = new Socket();
        Connection conn = null;
        try {
            socket.connect(new InetSocketAddress(addr.host(), addr.port()), Settings.CONNECT_TIMEOUT_MS);
            conn = new Connection(socket, identity.nodeId(), localPort(), addr, this);
            synchronized (lock) {
                if (!running) {
                    throw new PeerUnreachableException(addr, "node stopping", null);
                }
                connections.track(conn);
            }
            conn.start(ioPool);
            if (conn.awaitHandshake(Settings.HELLO_TIMEOUT_MS + Settings.CONNECT_TIMEOUT_MS)) {
                return conn;
            }
            if (Errors.SELF_CONNECTION.equals(conn.closeCode())) {
                synchronized (lock) {
                    selfAddresses.add(addr);
                }
                return null;
            }
            PeerInfo rp = conn.remotePeer();
            if (rp != null) {
                // Lost a duplicate-link tie-break; the peer is reachable via the kept link.
                synchronized (lock) {
                    Connection kept = connections.getByPeerNodeId(rp.nodeId);
                    if (kept != null) return kept;
                }
            }
            conn.close();
            throw new PeerUnreachableException(addr, "handshake failed", null);
        } catch (IOException | RejectedExecutionException e) {
            closeDial(conn, socket);
            throw new PeerUnreachableException(addr, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeDial(conn, socket);
            throw new PeerUnreachableException(addr, "interrupted", e);
        } catch (PeerUnreachableException e) {
            closeDial(conn, socket);
            throw e;
        } finally {
            synchronized (lock) {
                connections.finishDialing(addr);
            }
        }
    }

    private static void closeDial(Connection conn, Socket socket) {
        if (conn != null) {
            conn.close();
        } else {
            Net.safeClose(socket);
        }
    }

    private void scheduleBootstrapDial(PeerAddress addr, long delayMs) {
        if (!running) return;
        try {
            scheduler.schedule(() -> submitIo(() -> dialBootstrap(addr)), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Not scheduling dial to {}: scheduler stopped", addr);
        }
    }

    private void dialBootstrap(PeerAddress addr) {
        if (!running) return;
        boolean self;
        try {
            Connection conn = dial(addr);
            synchronized (lock) {
                self = selfAddresses.contains(addr);
                if (conn != null) failedAttempts.remove(addr);
            }
            if (conn != null || self) return;
            // Another dial to the same address is in flight; check back later.
            scheduleBootstrapDial(addr, config.reconnectInitialDelayMs);
        } catch (PeerUnreachableException e) {
            int attempt;
            synchronized (lock) {
                attempt = failedAttempts.merge(addr, 1, Integer::sum);
            }
            long delay = backoffDelay(attempt, config.reconnectInitialDelayMs, config.reconnectMaxDelayMs);
            LOG.warn("{} (attempt {}), retrying in {} ms", e.getMessage(), attempt, delay);
            scheduleBootstrapDial(addr, delay);
        }
    }

    private void dialLearned(PeerAddress addr) {
        if (!running) return;
        try {
            dial(addr);
        } catch (PeerUnreachableException e) {
            LOG.info("{}; not retrying learned address", e.getMessage());
        }
    }

    /** Delay before retry number {@code attempt} (1-based): doubles from {@code initialMs} up to {@code maxMs}. */
    static long backoffDelay(int attempt, long initialMs, long maxMs) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = initialMs * (1L << shift);
        if (delay <= 0 || delay > maxMs) return maxMs;
        return delay;
    }

    private void submitIo(Runnable task) {
        if (!running) return;
        try {
            ioPool.submit(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("I/O pool stopped, dropping task");
        }
    }

    // ---- Dispatcher.PeerRegistry ----

    @Override
    public boolean learnPeer(String nodeId, PeerAddress address) {
        boolean dialNow;
        synchronized (lock) {
            if (identity.isSelf(nodeId) || selfAddresses.contains(address)) return false;
            if (connections.getByPeerNodeId(nodeId) != null) return false;
            if (connections.isConnectedOrDialing(address)) return false;
            if (address.equals(learned.get(nodeId))) return false;
            learned.put(nodeId, address);
            dialNow = connections.liveCount() < config.maxPeers;
        }
        if (dialNow) {
            submitIo(() -> dialLearned(address));
        } else {
            LOG.debug("Not dialing learned peer {} at {}", nodeId, address);
        }
        return true;
    }

    // ---- TcpServer.Acceptor ----

    @Override
    public void onAccepted(Socket socket) {
        if (!running) {
            Net.safeClose(socket);
            return;
        }
        Connection conn;
        try {
            conn = new Connection(socket, identity.nodeId(), localPort(), null, this);
        } catch (IOException e) {
            LOG.warn("Could not set up inbound connection from {}: {}", Net.formatRemote(socket), e.getMessage());
            Net.safeClose(socket);
            return;
        }
        synchronized (lock) {
            connections.track(conn);
        }
        conn.start(ioPool);
    }

    // ---- Connection.Listener ----

    @Override
    public void onHandshake(Connection conn, PeerInfo remote) {
        Connection drop;
        List<Connection> others = new ArrayList<>();
        synchronized (lock) {
            if (!running) {
                drop = conn;
            } else {
                drop = connections.admit(conn, remote);
                for (Connection c : connections.live()) {
                    if (c != conn) others.add(c);
                }
            }
        }
        if (drop != null) {
            LOG.info("Closing duplicate link to {}", remote.nodeId);
            drop.sendErrorAndClose(Errors.DUPLICATE_PEER, "Already connected");
            if (drop == conn) return;
        }
        LOG.info("Peer {} connected ({})", remote, conn.isOutbound() ? "outbound" : "inbound");

        // Tell the new peer who else we know, and everyone else about the new peer.
        for (Connection other : others) {
            PeerInfo op = other.remotePeer();
            if (op != null && !op.nodeId.equals(remote.nodeId)) {
                conn.send(markSeen(announce(op)));
            }
        }
        MessageEnvelope introduce = markSeen(announce(remote));
        for (Connection other : others) {
            if (!remote.nodeId.equals(other.remoteNodeId())) {
                other.send(introduce);
            }
        }

        sendStateTo(conn);
    }

    private void sendStateTo(Connection conn) {
        List<SpammerRecord> records;
        try {
            records = store.all();
        } catch (SQLException e) {
            LOG.error("Could not read store for state transfer to {}", conn.describe(), e);
            return;
        }
        for (SpammerRecord r : records) {
            conn.send(reportEnvelope(r));
        }
        if (!records.isEmpty()) {
            LOG.info("Sent {} record(s) to {}", records.size(), conn.describe());
        }
    }

    @Override
    public void onMessage(Connection conn, InboundMessage message) {
        MessageEnvelope env = message.envelope();
        String key = MessageCodec.dedupKey(env);
        synchronized (lock) {
            if (!ledger.addIfAbsent(key, message.receivedAtMs())) {
                LOG.debug("Duplicate {} from {} dropped", env.kind(), conn.describe());
                return;
            }
        }
        boolean forward;
        try {
            forward = dispatcher.dispatch(env, conn);
        } catch (StoreWriteException e) {
            LOG.error("Could not store {} from {}; it will be accepted if resent", env.kind(), env.originId(), e);
            forget(key);
            return;
        }
        if (forward) {
            int n = broadcast(env, conn);
            LOG.debug("Forwarded {} from {} to {} peer(s)", env.kind(), env.originId(), n);
        }
    }

    @Override
    public void onClosed(Connection conn) {
        boolean wasLive;
        PeerAddress redial = null;
        synchronized (lock) {
            wasLive = connections.remove(conn);
            if (running && wasLive) {
                redial = bootstrapAddressOf(conn);
            }
        }
        if (wasLive) {
            LOG.info("Peer {} disconnected", conn.describe());
        }
        if (redial != null) {
            LOG.info("Bootstrap peer {} lost, reconnecting", redial);
            scheduleBootstrapDial(redial, config.reconnectInitialDelayMs);
        }
    }

    private PeerAddress bootstrapAddressOf(Connection conn) {
        PeerAddress dialed = conn.dialedAddress();
        if (dialed != null && bootstrap.contains(dialed)) return dialed;
        PeerInfo rp = conn.remotePeer();
        if (rp != null && bootstrap.contains(rp.listenAddress)) return rp.listenAddress;
        return null;
    }

    // ---- gossip ----

    /**
     * Sends {@code env} to every live peer except {@code exclude} and the
     * message's origin.
     *
     * @return number of peers the message was queued for
     */
    public int broadcast(MessageEnvelope env, Connection exclude) {
        List<Connection> targets;
        synchronized (lock) {
            targets = connections.live();
        }
        int sent = 0;
        for (Connection c : targets) {
            if (c == exclude) continue;
            if (env.originId().equals(c.remoteNodeId())) continue;
            if (c.send(env)) sent++;
        }
        return sent;
    }

    /** Records {@code env} in the ledger so echoes of it are dropped. */
    public MessageEnvelope markSeen(MessageEnvelope env) {
        String key = MessageCodec.dedupKey(env);
        synchronized (lock) {
            ledger.addIfAbsent(key, System.currentTimeMillis());
        }
        return env;
    }

    public void forget(MessageEnvelope env) {
        forget(MessageCodec.dedupKey(env));
    }

    private void forget(String key) {
        synchronized (lock) {
            ledger.remove(key);
        }
    }

    /**
     * Asks every live peer for {@code identifier}. The returned future completes
     * with the first record any peer reports, or empty once all have answered
     * "not found" or {@code timeoutMs} has elapsed.
     */
    public CompletableFuture<Optional<SpammerRecord>> queryPeers(String identifier, long timeoutMs) {
        List<Connection> targets;
        synchronized (lock) {
            targets = connections.live();
        }
        PendingQueries.Query query = pendingQueries.register(targets.size(), timeoutMs);
        if (targets.isEmpty()) return query.future;

        Payloads.QuerySpammer q = new Payloads.QuerySpammer();
        q.correlationId = query.correlationId;
        q.identifier = identifier;
        MessageEnvelope env = MessageEnvelope.create(MessageKind.QUERY_SPAMMER, identity.nodeId(), MessageCodec.toTree(q));
        for (Connection c : targets) {
            if (!c.send(env)) {
                pendingQueries.noResponse(query.correlationId);
            }
        }
        return query.future;
    }

    MessageEnvelope announce(PeerInfo peer) {
        Payloads.AnnouncePeer p = new Payloads.AnnouncePeer();
        p.nodeId = peer.nodeId;
        p.host = peer.listenAddress.host();
        p.port = peer.listenAddress.port();
        return MessageEnvelope.create(MessageKind.ANNOUNCE_PEER, identity.nodeId(), MessageCodec.toTree(p));
    }

    /** A report for {@code r} carrying the record's own origin, as sent during state transfer. */
    static MessageEnvelope reportEnvelope(SpammerRecord r) {
        Payloads.ReportSpammer p = new Payloads.ReportSpammer();
        p.identifier = r.identifier;
        p.note = Payloads.noteTree(r.note);
        p.timestamp = r.timestamp;
        return MessageEnvelope.create(MessageKind.REPORT_SPAMMER, r.originId, MessageCodec.toTree(p));
    }
}
