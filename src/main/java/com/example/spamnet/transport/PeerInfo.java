package com.example.spamnet.transport;

/**
 * A remote node as learned from its hello: identity plus the address its
 * listener can be reached on.
 */
public class PeerInfo {
    public final String nodeId;
    public final PeerAddress listenAddress;

    public PeerInfo(String nodeId, PeerAddress listenAddress) {
        this.nodeId = nodeId;
        this.listenAddress = listenAddress;
    }

    @Override
    public String toString() {
        return nodeId + " @ " + listenAddress;
    }
}
