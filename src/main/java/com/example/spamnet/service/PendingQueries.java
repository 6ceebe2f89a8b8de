package com.example.spamnet.service;

import com.example.spamnet.protocol.Payloads;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Local queries waiting for {@code query-response} messages.
 *
 * <p>The first response that carries a record completes the query; once every
 * queried peer has answered "not found", or the window elapses, the query
 * completes empty. Late responses are ignored.
 */
public class PendingQueries {

    public static final class Query {
        public final String correlationId;
        public final CompletableFuture<Optional<SpammerRecord>> future;

        Query(String correlationId, CompletableFuture<Optional<SpammerRecord>> future) {
            this.correlationId = correlationId;
            this.future = future;
        }
    }

    private static final class Pending {
        final CompletableFuture<Optional<SpammerRecord>> future;
        final AtomicInteger remaining;

        Pending(CompletableFuture<Optional<SpammerRecord>> future, int expected) {
            this.future = future;
            this.remaining = new AtomicInteger(expected);
        }
    }

    private final ConcurrentHashMap<String, Pending> byCorrelationId = new ConcurrentHashMap<>();

    public Query register(int expectedResponses, long timeoutMs) {
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<Optional<SpammerRecord>> future = new CompletableFuture<>();
        if (expectedResponses <= 0) {
            future.complete(Optional.empty());
            return new Query(correlationId, future);
        }
        byCorrelationId.put(correlationId, new Pending(future, expectedResponses));
        future.whenComplete((r, e) -> byCorrelationId.remove(correlationId));
        future.completeOnTimeout(Optional.empty(), timeoutMs, TimeUnit.MILLISECONDS);
        return new Query(correlationId, future);
    }

    /** @return false when no query with that correlation id is waiting */
    public boolean complete(Payloads.QueryResponse response) {
        if (response == null || response.correlationId == null) return false;
        Pending p = byCorrelationId.get(response.correlationId);
        if (p == null) return false;
        if (response.found && response.record != null && response.record.identifier != null) {
            Payloads.Record r = response.record;
            p.future.complete(Optional.of(SpammerRecord.of(r.identifier, Payloads.noteText(r.note), r.timestamp, r.originId)));
        } else {
            answered(p);
        }
        return true;
    }

    /** Counts a peer that will never answer, e.g. because the request could not be queued. */
    public void noResponse(String correlationId) {
        Pending p = byCorrelationId.get(correlationId);
        if (p != null) answered(p);
    }

    private void answered(Pending p) {
        if (p.remaining.decrementAndGet() <= 0) {
            p.future.complete(Optional.empty());
        }
    }

    public int size() {
        return byCorrelationId.size();
    }

    public void cancelAll() {
        for (Pending p : byCorrelationId.values()) {
            p.future.complete(Optional.empty());
        }
        byCorrelationId.clear();
    }
}
