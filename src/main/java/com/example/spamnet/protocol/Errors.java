package com.example.spamnet.protocol;

import com.google.gson.JsonObject;

public final class Errors {

    public static final String BAD_MESSAGE = "BAD_MESSAGE";
    public static final String TOO_LARGE = "TOO_LARGE";
    public static final String SELF_CONNECTION = "SELF_CONNECTION";
    public static final String DUPLICATE_PEER = "DUPLICATE_PEER";

    private Errors() {
    }

    public static MessageEnvelope buildError(String originId, String code, String message) {
        JsonObject payload = new JsonObject();
        payload.addProperty("code", code);
        payload.addProperty("message", message);
        return MessageEnvelope.create(MessageKind.ERROR, originId, payload);
    }
}
