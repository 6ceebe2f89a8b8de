package com.example.spamnet.service;

import com.example.spamnet.core.NodeIdentity;
import com.example.spamnet.protocol.MessageCodec;
import com.example.spamnet.protocol.MessageEnvelope;
import com.example.spamnet.protocol.MessageKind;
import com.example.spamnet.protocol.Payloads;
import com.example.spamnet.store.SpammerDao;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import com.example.spamnet.store.StoreWriteException;
import com.example.spamnet.transport.PeerAddress;
import com.example.spamnet.transport.PeerLink;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes an inbound message to the handler for its kind.
 *
 * <p>Dedup happens before this point. The return value of {@link #dispatch}
 * tells the caller whether the message should be gossiped on: only a newly
 * learned peer or a report that changed the store travels further. Queries and
 * their responses are answered point-to-point and never forwarded.
 */
public class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    /** Receives peer addresses learned from announcements. */
    public interface PeerRegistry {
        /** @return true if the peer was not known before */
        boolean learnPeer(String nodeId, PeerAddress address);
    }

    private final NodeIdentity identity;
    private final SpammerDao store;
    private final PendingQueries pendingQueries;
    private final PeerRegistry peers;

    public Dispatcher(NodeIdentity identity, SpammerDao store, PendingQueries pendingQueries, PeerRegistry peers) {
        this.identity = identity;
        this.store = store;
        this.pendingQueries = pendingQueries;
        this.peers = peers;
    }

    /**
     * @param from the connection the message arrived on
     * @return true if the message should be forwarded to the other peers
     * @throws StoreWriteException if a report could not be persisted
     */
    public boolean dispatch(MessageEnvelope env, PeerLink from) throws StoreWriteException {
        String kind = env.kind();
        try {
            switch (kind) {
                case MessageKind.ANNOUNCE_PEER:
                    return onAnnouncePeer(MessageCodec.payloadAs(env, Payloads.AnnouncePeer.class));
                case MessageKind.REPORT_SPAMMER:
                    return onReportSpammer(env, MessageCodec.payloadAs(env, Payloads.ReportSpammer.class));
                case MessageKind.QUERY_SPAMMER:
                    onQuerySpammer(MessageCodec.payloadAs(env, Payloads.QuerySpammer.class), from);
                    return false;
                case MessageKind.QUERY_RESPONSE:
                    onQueryResponse(MessageCodec.payloadAs(env, Payloads.QueryResponse.class));
                    return false;
                default:
                    LOG.warn("Ignoring message of unknown kind '{}' from {}", kind, env.originId());
                    return false;
            }
        } catch (MessageCodec.DecodeException e) {
            LOG.warn("Dropping {} from {}: {}", kind, env.originId(), e.getMessage());
            return false;
        }
    }

    private boolean onAnnouncePeer(Payloads.AnnouncePeer p) {
        if (isBlank(p.nodeId) || isBlank(p.host) || p.port <= 0 || p.port > 65535) {
            LOG.warn("Dropping announce-peer with incomplete address: {} {}:{}", p.nodeId, p.host, p.port);
            return false;
        }
        if (identity.isSelf(p.nodeId)) {
            return false;
        }
        boolean learned = peers.learnPeer(p.nodeId, new PeerAddress(p.host, p.port));
        if (learned) {
            LOG.info("Learned peer {} at {}:{}", p.nodeId, p.host, p.port);
        }
        return learned;
    }

    private boolean onReportSpammer(MessageEnvelope env, Payloads.ReportSpammer p) throws StoreWriteException {
        if (isBlank(p.identifier) || p.timestamp <= 0) {
            LOG.warn("Dropping report-spammer from {} without identifier or timestamp", env.originId());
            return false;
        }
        SpammerRecord record = SpammerRecord.of(p.identifier, Payloads.noteText(p.note), p.timestamp, env.originId());
        boolean changed = store.upsert(record);
        if (changed) {
            LOG.info("Stored report {}", record);
        } else {
            LOG.debug("Report for {} from {} superseded by stored record", p.identifier, env.originId());
        }
        return changed;
    }

    private void onQuerySpammer(Payloads.QuerySpammer q, PeerLink from) {
        if (isBlank(q.correlationId) || isBlank(q.identifier)) {
            LOG.warn("Dropping query-spammer without correlation id or identifier");
            return;
        }
        Payloads.QueryResponse resp = new Payloads.QueryResponse();
        resp.correlationId = q.correlationId;
        resp.identifier = q.identifier;
        try {
            SpammerRecord r = store.get(q.identifier);
            if (r != null) {
                resp.found = true;
                resp.record = toPayload(r);
            }
        } catch (SQLException e) {
            LOG.error("Lookup of {} failed, answering not found", q.identifier, e);
        }
        from.send(MessageEnvelope.create(MessageKind.QUERY_RESPONSE, identity.nodeId(), MessageCodec.toTree(resp)));
    }

    private void onQueryResponse(Payloads.QueryResponse resp) {
        if (!pendingQueries.complete(resp)) {
            LOG.debug("Late or unknown query-response {}", resp.correlationId);
        }
    }

    static Payloads.Record toPayload(SpammerRecord r) {
        Payloads.Record out = new Payloads.Record();
        out.identifier = r.identifier;
        out.note = Payloads.noteTree(r.note);
        out.timestamp = r.timestamp;
        out.originId = r.originId;
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
