package com.example.spamnet.transport;

public class PeerUnreachableException extends Exception {

    private final PeerAddress address;

    public PeerUnreachableException(PeerAddress address, String message, Throwable cause) {
        super("Peer " + address + " unreachable: " + message, cause);
        this.address = address;
    }

    public PeerAddress address() {
        return address;
    }
}
