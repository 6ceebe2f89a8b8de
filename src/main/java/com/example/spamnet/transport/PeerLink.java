package com.example.spamnet.transport;

import com.example.spamnet.protocol.MessageEnvelope;

/**
 * The side of a peer connection the message handlers see: who is on the other
 * end, and a way to answer them directly.
 */
public interface PeerLink {

    /** Remote node id, or null before the handshake completes. */
    String remoteNodeId();

    /** Queues {@code env} for this peer only; false if it was not queued. */
    boolean send(MessageEnvelope env);
}
