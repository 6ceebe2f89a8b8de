package com.example.spamnet.protocol;

public final class MessageKind {
    // Gossiped between peers
    public static final String ANNOUNCE_PEER = "announce-peer";
    public static final String REPORT_SPAMMER = "report-spammer";

    // Point-to-point
    public static final String QUERY_SPAMMER = "query-spammer";
    public static final String QUERY_RESPONSE = "query-response";

    // Connection control, never dispatched
    public static final String HELLO = "hello";
    public static final String ERROR = "error";

    private MessageKind() {
    }
}
