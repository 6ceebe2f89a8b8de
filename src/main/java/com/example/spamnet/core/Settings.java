package com.example.spamnet.core;

public class Settings {
    // Default listener ports
    public static final int DEFAULT_P2P_PORT = 9828;
    public static final int DEFAULT_WS_PORT = 9000;
    public static final int DEFAULT_HTTP_PORT = 8081;

    // Database
    public static final String DB_NAME = "spammers.db";

    // Framing: largest single message (and largest unterminated buffer) accepted from a peer
    public static final int MAX_MESSAGE_BYTES = 1024 * 1024;
    public static final int READ_BUFFER_BYTES = 4096;

    // Connection setup
    public static final int CONNECT_TIMEOUT_MS = 3000;
    public static final int HELLO_TIMEOUT_MS = 5000;
    public static final long ERROR_WRITE_WAIT_MS = 200;

    // Outbound queue per peer; send() drops instead of blocking once full
    public static final int SEND_QUEUE_CAPACITY = 1024;

    // Dedup ledger: a key is forgotten after whichever limit is hit first
    public static final int SEEN_MSG_MAX_SIZE = 10_000;
    public static final long SEEN_MSG_TTL_MS = 5 * 60 * 1000L; // 5 minutes

    // Bootstrap reconnection: 1s, 2s, 4s ... capped at 60s
    public static final long RECONNECT_INITIAL_DELAY_MS = 1000;
    public static final long RECONNECT_MAX_DELAY_MS = 60_000;

    // Network query window for local lookups that miss the store
    public static final long QUERY_TIMEOUT_MS = 1000;

    // No new dials once this many peers are live
    public static final int MAX_PEERS = 32;

    private Settings() {
    }
}
