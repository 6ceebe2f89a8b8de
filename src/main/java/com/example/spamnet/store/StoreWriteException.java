package com.example.spamnet.store;

/** A write to the spammer store did not become durable. */
public class StoreWriteException extends Exception {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
