package com.example.spamnet.service;

import com.example.spamnet.core.NodeConfig;
import com.example.spamnet.core.NodeIdentity;
import com.example.spamnet.protocol.MessageEnvelope;
import com.example.spamnet.store.SpammerDao;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import com.example.spamnet.store.StoreWriteException;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What the local gateways can do: report an identifier, check one, list and
 * purge records.
 */
public class SpammerService {

    private static final Logger LOG = LoggerFactory.getLogger(SpammerService.class);

    public static final String SOURCE_LOCAL = "local";
    public static final String SOURCE_NETWORK = "network";
    public static final String SOURCE_NONE = "none";

    public static final class CheckResult {
        public final String identifier;
        public final SpammerRecord record;
        public final String source;

        CheckResult(String identifier, SpammerRecord record, String source) {
            this.identifier = identifier;
            this.record = record;
            this.source = source;
        }

        public boolean isSpammer() {
            return record != null;
        }
    }

    private final NodeIdentity identity;
    private final SpammerDao store;
    private final NodeManager node;
    private final NodeConfig config;

    public SpammerService(NodeIdentity identity, SpammerDao store, NodeManager node, NodeConfig config) {
        this.identity = identity;
        this.store = store;
        this.node = node;
        this.config = config;
    }

    /**
     * Records a report originating at this node and gossips it when the store
     * changed.
     *
     * @param timestamp report time in epoch millis, or null for now
     * @return true if the store changed
     */
    public boolean report(String identifier, String note, Long timestamp) throws StoreWriteException {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("user_id required");
        }
        long ts = timestamp == null ? System.currentTimeMillis() : timestamp;
        if (ts <= 0) {
            throw new IllegalArgumentException("timestamp must be positive");
        }
        SpammerRecord record = SpammerRecord.of(identifier.trim(), note, ts, identity.nodeId());
        MessageEnvelope env = node.markSeen(NodeManager.reportEnvelope(record));
        boolean changed;
        try {
            changed = store.upsert(record);
        } catch (StoreWriteException e) {
            node.forget(env);
            throw e;
        }
        if (changed) {
            int n = node.broadcast(env, null);
            LOG.info("Reported {} locally, gossiped to {} peer(s)", record.identifier, n);
        } else {
            LOG.info("Local report for {} superseded by stored record", record.identifier);
        }
        return changed;
    }

    public SpammerRecord lookupLocal(String identifier) throws SQLException {
        return store.get(identifier);
    }

    /**
     * Local store first; on a miss, asks connected peers and waits up to the
     * configured query timeout. A record found on the network is returned but
     * not stored.
     */
    public CheckResult check(String identifier) throws SQLException, InterruptedException {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("user_id required");
        }
        String id = identifier.trim();
        SpammerRecord local = store.get(id);
        if (local != null) {
            return new CheckResult(id, local, SOURCE_LOCAL);
        }
        if (!config.networkQuery || node.liveCount() == 0) {
            return new CheckResult(id, null, SOURCE_NONE);
        }
        try {
            Optional<SpammerRecord> remote = node.queryPeers(id, config.queryTimeoutMs)
                    .get(config.queryTimeoutMs + 1000, TimeUnit.MILLISECONDS);
            if (remote.isPresent()) {
                return new CheckResult(id, remote.get(), SOURCE_NETWORK);
            }
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Network query for {} failed: {}", id, e.toString());
        }
        return new CheckResult(id, null, SOURCE_NONE);
    }

    public List<SpammerRecord> all() throws SQLException {
        return store.all();
    }

    /** Deletes the local record only; peers keep theirs. */
    public boolean purge(String identifier) throws StoreWriteException {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("user_id required");
        }
        boolean deleted = store.delete(identifier.trim());
        if (deleted) {
            LOG.info("Purged {} from local store", identifier.trim());
        }
        return deleted;
    }

    public int count() throws SQLException {
        return store.count();
    }
}
