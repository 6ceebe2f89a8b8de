package com.example.spamnet.protocol;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Turns framed message text into envelopes and back.
 *
 * <p>Producers on the network sometimes embed a sub-message as a JSON string
 * instead of an inline object, occasionally encoded more than once. Decoding
 * walks the parsed tree and replaces every string whose content is itself an
 * encoded JSON object, array or string with the parsed value, peeling as many
 * layers as there are, so consumers always see the nested structure. Strings
 * that are not encoded JSON (including ones that would parse as numbers or
 * booleans) are kept as they are.
 */
public final class MessageCodec {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = GSON.getAdapter(JsonElement.class);

    private MessageCodec() {
    }

    public static Gson gson() {
        return GSON;
    }

    public static MessageEnvelope decode(String text) throws DecodeException {
        JsonElement root = parseStrict(text);
        JsonElement tree = unwrapNested(root);
        if (!tree.isJsonObject()) {
            throw new DecodeException("Top-level message is not an object");
        }
        JsonObject obj = tree.getAsJsonObject();
        MessageEnvelope env;
        try {
            env = GSON.fromJson(obj, MessageEnvelope.class);
        } catch (JsonParseException e) {
            throw new DecodeException("Malformed envelope: " + e.getMessage(), e);
        }
        if (env == null || env.kind() == null || env.kind().isBlank()) {
            throw new DecodeException("Missing kind");
        }
        if (env.originId() == null || env.originId().isBlank()) {
            throw new DecodeException("Missing origin_id");
        }
        return env;
    }

    public static String encode(MessageEnvelope env) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", env.kind());
        obj.addProperty("origin_id", env.originId());
        obj.addProperty("ts", env.ts());
        obj.add("payload", env.payloadTree());
        return GSON.toJson(obj);
    }

    /**
     * Parses one complete JSON value. Unlike {@code JsonParser.parseString} this
     * rejects lenient syntax and trailing content.
     */
    public static JsonElement parseStrict(String text) throws DecodeException {
        if (text == null) {
            throw new DecodeException("Empty message");
        }
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        try {
            JsonElement element = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new DecodeException("Trailing content after JSON value");
            }
            return element == null ? JsonNull.INSTANCE : element;
        } catch (IOException | IllegalStateException | JsonParseException | NumberFormatException e) {
            throw new DecodeException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    /** Returns a new tree with string-encoded objects and arrays expanded at any depth. */
    public static JsonElement unwrapNested(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return JsonNull.INSTANCE;
        }
        if (element.isJsonObject()) {
            JsonObject out = new JsonObject();
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                out.add(e.getKey(), unwrapNested(e.getValue()));
            }
            return out;
        }
        if (element.isJsonArray()) {
            JsonArray out = new JsonArray();
            for (JsonElement item : element.getAsJsonArray()) {
                out.add(unwrapNested(item));
            }
            return out;
        }
        JsonPrimitive p = element.getAsJsonPrimitive();
        if (p.isString() && looksEncoded(p.getAsString())) {
            try {
                return unwrapNested(parseStrict(p.getAsString()));
            } catch (DecodeException notJson) {
                return p;
            }
        }
        return p;
    }

    // Objects, arrays and string literals; bare scalars stay strings.
    private static boolean looksEncoded(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) continue;
            return c == '{' || c == '[' || c == '"';
        }
        return false;
    }

    /** JSON text of {@code element} with object keys sorted at every level. */
    public static String canonical(JsonElement element) {
        return GSON.toJson(sortKeys(element == null ? JsonNull.INSTANCE : element));
    }

    private static JsonElement sortKeys(JsonElement element) {
        if (element.isJsonObject()) {
            JsonObject src = element.getAsJsonObject();
            List<String> keys = new ArrayList<>(src.keySet());
            Collections.sort(keys);
            JsonObject out = new JsonObject();
            for (String k : keys) {
                out.add(k, sortKeys(src.get(k)));
            }
            return out;
        }
        if (element.isJsonArray()) {
            JsonArray out = new JsonArray();
            for (JsonElement item : element.getAsJsonArray()) {
                out.add(sortKeys(item));
            }
            return out;
        }
        return element;
    }

    /**
     * Key identifying a message across the network: its origin plus a digest of
     * the canonical payload. Computed on the unwrapped tree, so a payload that
     * arrives string-encoded on one path and inline on another maps to one key,
     * and a locally built envelope keys the same as its decoded echo.
     */
    public static String dedupKey(MessageEnvelope env) {
        return env.originId() + ":" + sha256Hex(canonical(unwrapNested(env.payloadTree())));
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static <T> T payloadAs(MessageEnvelope env, Class<T> type) throws DecodeException {
        JsonElement payload = env.payloadTree();
        if (!payload.isJsonObject()) {
            throw new DecodeException(env.kind() + " payload is not an object");
        }
        try {
            T value = GSON.fromJson(payload, type);
            if (value == null) {
                throw new DecodeException(env.kind() + " payload is empty");
            }
            return value;
        } catch (JsonParseException | NumberFormatException e) {
            throw new DecodeException("Malformed " + env.kind() + " payload: " + e.getMessage(), e);
        }
    }

    public static JsonElement toTree(Object payload) {
        return GSON.toJsonTree(payload);
    }

    public static class DecodeException extends Exception {
        public DecodeException(String message) {
            super(message);
        }

        public DecodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
