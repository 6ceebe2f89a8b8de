package com.example.spamnet.transport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table of open connections: every socket still open (handshaken or not), the
 * live peer per remote node id, and addresses with a dial in flight.
 *
 * <p>Not thread-safe; the owning node serialises access.
 */
public class ConnectionManager {

    private final Set<Connection> open = new LinkedHashSet<>();
    private final Map<String, Connection> byPeerNodeId = new LinkedHashMap<>();
    private final Set<PeerAddress> dialing = new HashSet<>();

    public void track(Connection conn) {
        open.add(conn);
    }

    /**
     * Registers {@code conn} as the live link to {@code remote.nodeId}.
     *
     * <p>When another live connection to the same node exists, the one opened by
     * the node with the smaller id is kept. Both ends apply the same rule, so a
     * simultaneous dial in both directions settles on the same socket.
     *
     * @return the connection the caller must close, or null
     */
    public Connection admit(Connection conn, PeerInfo remote) {
        Connection existing = byPeerNodeId.get(remote.nodeId);
        if (existing == null || existing == conn || existing.isClosed()) {
            byPeerNodeId.put(remote.nodeId, conn);
            return null;
        }
        Connection keep = preferred(existing, conn);
        Connection drop = keep == conn ? existing : conn;
        byPeerNodeId.put(remote.nodeId, keep);
        return drop;
    }

    private static Connection preferred(Connection existing, Connection incoming) {
        String a = existing.initiatorNodeId();
        String b = incoming.initiatorNodeId();
        if (a == null || b == null || a.equals(b)) {
            return existing;
        }
        return a.compareTo(b) < 0 ? existing : incoming;
    }

    /** Forgets {@code conn}; true if it was the live link for its node. */
    public boolean remove(Connection conn) {
        open.remove(conn);
        String nodeId = conn.remoteNodeId();
        if (nodeId == null) return false;
        return byPeerNodeId.remove(nodeId, conn);
    }

    public Connection getByPeerNodeId(String peerNodeId) {
        Connection c = byPeerNodeId.get(peerNodeId);
        return c == null || c.isClosed() ? null : c;
    }

    /** Live connection whose advertised listen address or dialed address is {@code addr}. */
    public Connection getByAddr(PeerAddress addr) {
        for (Connection c : byPeerNodeId.values()) {
            if (c.isClosed()) continue;
            PeerInfo rp = c.remotePeer();
            if (rp != null && addr.equals(rp.listenAddress)) return c;
            if (addr.equals(c.dialedAddress())) return c;
        }
        return null;
    }

    public boolean isConnectedOrDialing(PeerAddress addr) {
        return dialing.contains(addr) || getByAddr(addr) != null;
    }

    /** False if a dial to {@code addr} is already in flight. */
    public boolean markDialing(PeerAddress addr) {
        return dialing.add(addr);
    }

    public void finishDialing(PeerAddress addr) {
        dialing.remove(addr);
    }

    public List<Connection> live() {
        List<Connection> out = new ArrayList<>();
        for (Connection c : byPeerNodeId.values()) {
            if (!c.isClosed()) out.add(c);
        }
        return out;
    }

    public int liveCount() {
        return live().size();
    }

    /** Empties the table and returns every connection that was open. */
    public List<Connection> drainAll() {
        List<Connection> out = new ArrayList<>(open);
        for (Connection c : byPeerNodeId.values()) {
            if (!out.contains(c)) out.add(c);
        }
        open.clear();
        byPeerNodeId.clear();
        dialing.clear();
        return out;
    }
}
