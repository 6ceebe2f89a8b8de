package com.example.spamnet.transport;

import com.example.spamnet.protocol.MessageEnvelope;

/** A decoded message stamped with its local receipt time. */
public final class InboundMessage {

    private final MessageEnvelope envelope;
    private final long receivedAtMs;

    public InboundMessage(MessageEnvelope envelope, long receivedAtMs) {
        this.envelope = envelope;
        this.receivedAtMs = receivedAtMs;
    }

    public MessageEnvelope envelope() {
        return envelope;
    }

    public long receivedAtMs() {
        return receivedAtMs;
    }
}
