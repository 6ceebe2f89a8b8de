package com.example.spamnet.core;

import java.util.UUID;

/**
 * Identity of this node for the lifetime of the process. Peers use it to
 * recognise self-connections and to skip echoing gossip back to its origin.
 */
public final class NodeIdentity {

    private final String nodeId;
    private final long startedAtMs;

    public NodeIdentity(String nodeId, long startedAtMs) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId");
        }
        this.nodeId = nodeId;
        this.startedAtMs = startedAtMs;
    }

    public static NodeIdentity generate() {
        return new NodeIdentity(UUID.randomUUID().toString(), System.currentTimeMillis());
    }

    public String nodeId() {
        return nodeId;
    }

    public long startedAtMs() {
        return startedAtMs;
    }

    public boolean isSelf(String otherNodeId) {
        return nodeId.equals(otherNodeId);
    }

    @Override
    public String toString() {
        return nodeId;
    }
}
