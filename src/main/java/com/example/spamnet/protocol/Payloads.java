package com.example.spamnet.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;

/**
 * Kind-specific payload shapes, mapped with Gson.
 */
public final class Payloads {

    private Payloads() {
    }

    public static final class Hello {
        public int port;
    }

    public static final class AnnouncePeer {
        @SerializedName("node_id")
        public String nodeId;
        public String host;
        public int port;
    }

    public static final class ReportSpammer {
        public String identifier;
        public JsonElement note;
        public long timestamp;
    }

    public static final class QuerySpammer {
        @SerializedName("correlation_id")
        public String correlationId;
        public String identifier;
    }

    public static final class QueryResponse {
        @SerializedName("correlation_id")
        public String correlationId;
        public String identifier;
        public boolean found;
        public Record record;
    }

    public static final class Record {
        public String identifier;
        public JsonElement note;
        public long timestamp;
        @SerializedName("origin_id")
        public String originId;
    }

    /** Wire form of a note. */
    public static JsonElement noteTree(String note) {
        return new JsonPrimitive(note == null ? "" : note);
    }

    /**
     * Text of a note as received. Notes are free text, so one whose content was
     * JSON arrives expanded by the codec and is turned back into JSON text here.
     */
    public static String noteText(JsonElement note) {
        if (note == null || note instanceof JsonNull) return "";
        if (note.isJsonPrimitive()) return note.getAsString();
        return note.toString();
    }
}
