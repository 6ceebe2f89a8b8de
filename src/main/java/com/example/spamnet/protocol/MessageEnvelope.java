package com.example.spamnet.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.annotations.SerializedName;

/**
 * One wire message. Instances are never mutated after creation; forwarding
 * re-encodes the same envelope.
 */
public final class MessageEnvelope {

    private String kind;
    @SerializedName("origin_id")
    private String originId;
    private long ts;
    private JsonElement payload;

    private MessageEnvelope() {
    }

    public static MessageEnvelope create(String kind, String originId, JsonElement payload) {
        return create(kind, originId, System.currentTimeMillis(), payload);
    }

    public static MessageEnvelope create(String kind, String originId, long ts, JsonElement payload) {
        MessageEnvelope env = new MessageEnvelope();
        env.kind = kind;
        env.originId = originId;
        env.ts = ts;
        env.payload = payload == null ? JsonNull.INSTANCE : payload.deepCopy();
        return env;
    }

    public String kind() {
        return kind;
    }

    public String originId() {
        return originId;
    }

    /** Creation time at the origin, informational only. */
    public long ts() {
        return ts;
    }

    /** A copy of the payload; the envelope keeps its own tree. */
    public JsonElement payload() {
        return payload == null ? JsonNull.INSTANCE : payload.deepCopy();
    }

    JsonElement payloadTree() {
        return payload == null ? JsonNull.INSTANCE : payload;
    }

    @Override
    public String toString() {
        return kind + " from " + originId;
    }
}
