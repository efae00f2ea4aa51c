package com.example.messenger.service;

public class QueueContentionException extends RuntimeException {

    public QueueContentionException(long inboxId, int attempts) {
        super("Round-robin queue of inbox %d still contended after %d attempts".formatted(inboxId, attempts), null, false, false);
    }
}
