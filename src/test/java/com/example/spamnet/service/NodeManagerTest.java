package com.example.spamnet.service;

import com.example.spamnet.core.NodeConfig;
import com.example.spamnet.core.NodeIdentity;
import com.example.spamnet.protocol.MessageCodec;
import com.example.spamnet.protocol.MessageEnvelope;
import com.example.spamnet.protocol.MessageKind;
import com.example.spamnet.protocol.Payloads;
import com.example.spamnet.store.Db;
import com.example.spamnet.store.SpammerDao;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import com.example.spamnet.store.StoreWriteException;
import com.example.spamnet.transport.JsonFramer;
import com.example.spamnet.transport.PeerAddress;
import com.example.spamnet.transport.PeerInfo;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NodeManagerTest {

    private static final long DEADLINE_MS = 10_000;

    private final List<TestNode> nodes = new ArrayList<>();
    private final List<RawPeer> rawPeers = new ArrayList<>();

    @After
    public void tearDown() {
        for (RawPeer p : rawPeers) {
            p.close();
        }
        for (TestNode n : nodes) {
            n.close();
        }
    }

    // ---- helpers ----

    private static final class TestNode {
        final Db db;
        final SpammerDao store;
        final NodeManager node;
        final SpammerService spammers;

        TestNode(NodeConfig config) throws Exception {
            this(config, false);
        }

        TestNode(NodeConfig config, boolean flakyStore) throws Exception {
            db = Db.open(Files.createTempFile("spamnet-node-", ".db").toString());
            store = flakyStore ? new FlakyDao(db) : new SpammerDao(db);
            NodeIdentity identity = NodeIdentity.generate();
            node = new NodeManager(identity, config, store);
            spammers = new SpammerService(identity, store, node, config);
            node.start();
        }

        String id() {
            return node.identity().nodeId();
        }

        PeerAddress address() {
            return new PeerAddress("127.0.0.1", node.localPort());
        }

        boolean has(String identifier) {
            try {
                return store.get(identifier) != null;
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        }

        boolean connectedTo(TestNode other) {
            for (PeerInfo p : node.livePeers()) {
                if (p.nodeId.equals(other.id())) return true;
            }
            return false;
        }

        void close() {
            node.stop();
            db.close();
        }
    }

    /** A store that fails a set number of writes before behaving normally. */
    private static final class FlakyDao extends SpammerDao {
        final AtomicInteger failuresLeft = new AtomicInteger();

        FlakyDao(Db db) {
            super(db);
        }

        @Override
        public boolean upsert(SpammerRecord record) throws StoreWriteException {
            if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
                throw new StoreWriteException("disk full", new SQLException("SQLITE_FULL"));
            }
            return super.upsert(record);
        }
    }

    /** A hand-driven peer speaking the wire protocol over a plain socket. */
    private static final class RawPeer {
        final String nodeId;
        final Socket socket;
        final OutputStream out;
        final BlockingQueue<MessageEnvelope> inbox = new LinkedBlockingQueue<>();

        RawPeer(String nodeId, int port) throws IOException {
            this.nodeId = nodeId;
            this.socket = new Socket("127.0.0.1", port);
            this.out = socket.getOutputStream();
            Thread reader = new Thread(this::readLoop, "raw-peer-" + nodeId);
            reader.setDaemon(true);
            reader.start();
        }

        private void readLoop() {
            JsonFramer framer = new JsonFramer(1 << 20);
            byte[] chunk = new byte[4096];
            try (InputStream in = socket.getInputStream()) {
                int n;
                while ((n = in.read(chunk)) > 0) {
                    for (String text : framer.feed(chunk, 0, n)) {
                        inbox.add(MessageCodec.decode(text));
                    }
                }
            } catch (IOException | JsonFramer.FramingException | MessageCodec.DecodeException e) {
                // socket closed by the test or the node
            }
        }

        void send(MessageEnvelope env) throws IOException {
            synchronized (out) {
                out.write(MessageCodec.encode(env).getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        }

        void hello() throws IOException {
            Payloads.Hello h = new Payloads.Hello();
            h.port = 1;
            send(MessageEnvelope.create(MessageKind.HELLO, nodeId, MessageCodec.toTree(h)));
        }

        List<MessageEnvelope> received(String kind) {
            List<MessageEnvelope> out = new ArrayList<>();
            for (MessageEnvelope env : inbox) {
                if (kind.equals(env.kind())) out.add(env);
            }
            return out;
        }

        void close() {
            try {
                socket.close();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    private static NodeConfig config(PeerAddress... bootstrap) {
        NodeConfig c = NodeConfig.fromProperties(new Properties());
        c.p2pPort = 0;
        c.httpPort = 0;
        c.wsPort = 0;
        c.bootstrap = new ArrayList<>(Arrays.asList(bootstrap));
        c.reconnectInitialDelayMs = 50;
        c.reconnectMaxDelayMs = 200;
        c.queryTimeoutMs = 2000;
        return c;
    }

    private TestNode startNode(PeerAddress... bootstrap) throws Exception {
        return startNode(config(bootstrap));
    }

    private TestNode startNode(NodeConfig config) throws Exception {
        TestNode n = new TestNode(config);
        nodes.add(n);
        return n;
    }

    private RawPeer rawPeer(String nodeId, TestNode target) throws IOException {
        RawPeer p = new RawPeer(nodeId, target.node.localPort());
        rawPeers.add(p);
        return p;
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private static void await(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + DEADLINE_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(20);
        }
    }

    private static MessageEnvelope report(String origin, String id, String note, long ts) {
        Payloads.ReportSpammer p = new Payloads.ReportSpammer();
        p.identifier = id;
        p.note = Payloads.noteTree(note);
        p.timestamp = ts;
        return MessageEnvelope.create(MessageKind.REPORT_SPAMMER, origin, MessageCodec.toTree(p));
    }

    // ---- tests ----

    @Test
    public void backoffDoublesUpToCap() {
        assertEquals(1000, NodeManager.backoffDelay(1, 1000, 60_000));
        assertEquals(2000, NodeManager.backoffDelay(2, 1000, 60_000));
        assertEquals(32_000, NodeManager.backoffDelay(6, 1000, 60_000));
        assertEquals(60_000, NodeManager.backoffDelay(7, 1000, 60_000));
        assertEquals(60_000, NodeManager.backoffDelay(500, 1000, 60_000));
    }

    @Test
    public void listensWithoutReachableBootstrap() throws Exception {
        TestNode a = startNode(new PeerAddress("127.0.0.1", freePort()));
        assertTrue(a.node.isRunning());

        TestNode b = startNode(a.address());
        await("b connected to a", () -> a.connectedTo(b) && b.connectedTo(a));
    }

    @Test
    public void reportReachesEveryNodeAndMeshForms() throws Exception {
        TestNode a = startNode();
        TestNode b = startNode(a.address());
        await("a-b link", () -> a.connectedTo(b));
        TestNode c = startNode(b.address());

        // c learns a through b's announcement and dials it
        await("full mesh", () -> a.connectedTo(c) && c.connectedTo(a) && a.node.liveCount() == 2);

        assertTrue(a.spammers.report("5551234", "crypto scam", 1000L));
        await("report on b and c", () -> b.has("5551234") && c.has("5551234"));
        assertEquals(a.id(), c.store.get("5551234").originId);
    }

    @Test
    public void newPeerReceivesExistingRecords() throws Exception {
        TestNode a = startNode();
        a.spammers.report("111", "old news", 500L);
        a.spammers.report("222", "", 600L);

        TestNode b = startNode(a.address());
        await("state transfer", () -> b.has("111") && b.has("222"));
        assertEquals(a.id(), b.store.get("111").originId);
        assertEquals("old news", b.store.get("111").note);
    }

    @Test
    public void newerReportWinsOverOlderAcrossNodes() throws Exception {
        TestNode a = startNode();
        TestNode b = startNode(a.address());
        await("a-b link", () -> a.connectedTo(b));

        a.spammers.report("42", "newer", 2000L);
        await("b has newer", () -> b.has("42"));
        assertFalse(b.spammers.report("42", "older", 1000L));
        Thread.sleep(200);
        assertEquals("newer", a.store.get("42").note);
        assertEquals("newer", b.store.get("42").note);
    }

    @Test
    public void closedPeerLeavesLiveSet() throws Exception {
        TestNode a = startNode();
        TestNode b = startNode(a.address());
        await("a-b link", () -> a.connectedTo(b));

        b.close();
        nodes.remove(b);
        await("a drops b", () -> a.node.liveCount() == 0);
        assertTrue(a.node.livePeers().isEmpty());
    }

    @Test
    public void bootstrapPeerIsRedialedAfterRestart() throws Exception {
        int port = freePort();
        NodeConfig bConfig = config();
        bConfig.p2pPort = port;
        TestNode b = startNode(bConfig);
        TestNode a = startNode(new PeerAddress("127.0.0.1", port));
        await("a-b link", () -> a.connectedTo(b));

        b.close();
        nodes.remove(b);
        await("a drops b", () -> a.node.liveCount() == 0);

        NodeConfig b2Config = config();
        b2Config.p2pPort = port;
        TestNode b2 = startNode(b2Config);
        await("a redials restarted b", () -> a.connectedTo(b2));
    }

    @Test
    public void bootstrapToOwnAddressIsDropped() throws Exception {
        int port = freePort();
        NodeConfig c = config(new PeerAddress("127.0.0.1", port));
        c.p2pPort = port;
        TestNode a = startNode(c);
        Thread.sleep(500);
        assertTrue(a.node.isRunning());
        assertEquals(0, a.node.liveCount());
    }

    @Test
    public void duplicateMessageIsForwardedOnce() throws Exception {
        TestNode a = startNode();
        RawPeer p1 = rawPeer("raw-1", a);
        RawPeer p2 = rawPeer("raw-2", a);
        p1.hello();
        p2.hello();
        await("raw peers admitted", () -> a.node.liveCount() == 2);

        MessageEnvelope msg = report("raw-1", "9000", "dup", 77L);
        p1.send(msg);
        p1.send(msg);
        p1.send(MessageEnvelope.create(msg.kind(), msg.originId(), msg.ts() + 1, msg.payload()));

        await("a stored report", () -> a.has("9000"));
        Thread.sleep(300);
        assertEquals(1, p2.received(MessageKind.REPORT_SPAMMER).size());
        assertTrue(p1.received(MessageKind.REPORT_SPAMMER).isEmpty());
    }

    @Test
    public void reportIsAcceptedAgainAfterFailedStoreWrite() throws Exception {
        TestNode a = new TestNode(config(), true);
        nodes.add(a);
        FlakyDao flaky = (FlakyDao) a.store;
        RawPeer p = rawPeer("raw-w", a);
        p.hello();
        await("admitted", () -> a.node.liveCount() == 1);

        flaky.failuresLeft.set(1);
        MessageEnvelope msg = report("raw-w", "6060", "retry me", 50L);
        p.send(msg);
        await("write attempted", () -> flaky.failuresLeft.get() == 0);
        Thread.sleep(200);
        assertFalse(a.has("6060"));

        p.send(msg);
        await("resent report stored", () -> a.has("6060"));
        assertEquals("retry me", a.store.get("6060").note);
    }

    @Test
    public void jsonNoteIsStoredOnEveryNode() throws Exception {
        TestNode a = startNode();
        TestNode b = startNode(a.address());
        await("a-b link", () -> a.connectedTo(b) && b.connectedTo(a));

        String note = "{\"reason\":\"crypto scam\",\"score\":0.9}";
        assertTrue(a.spammers.report("777", note, 10L));
        await("b has json-noted report", () -> b.has("777"));
        assertEquals(note, b.store.get("777").note);
        assertEquals(a.id(), b.store.get("777").originId);

        SpammerService.CheckResult r = b.spammers.check("777");
        assertEquals(note, r.record.note);
    }

    @Test
    public void messageBeforeHelloClosesConnection() throws Exception {
        TestNode a = startNode();
        RawPeer p = rawPeer("rude", a);
        p.send(report("rude", "1", "", 1L));
        await("error reply", () -> !p.received(MessageKind.ERROR).isEmpty());
        assertEquals(0, a.node.liveCount());
        assertFalse(a.has("1"));
    }

    @Test
    public void garbageDoesNotKillConnection() throws Exception {
        TestNode a = startNode();
        RawPeer p = rawPeer("noisy", a);
        p.hello();
        await("admitted", () -> a.node.liveCount() == 1);

        synchronized (p.out) {
            p.out.write("{\"not\":\"an envelope\"}[1,2]{\"kind\":".getBytes(StandardCharsets.UTF_8));
            p.out.write("\"report-spammer\"}".getBytes(StandardCharsets.UTF_8));
            p.out.flush();
        }
        p.send(report("noisy", "321", "after garbage", 5L));
        await("valid report after garbage", () -> a.has("321"));
        assertEquals(1, a.node.liveCount());
    }

    @Test
    public void networkQueryFindsRecordHeldElsewhere() throws Exception {
        TestNode a = startNode();
        TestNode b = startNode(a.address());
        await("a-b link", () -> a.connectedTo(b) && b.connectedTo(a));

        // written behind the gossip layer, so only a knows it
        a.store.upsert(SpammerRecord.of("8080", "held by a", 10, a.id()));

        SpammerService.CheckResult r = b.spammers.check("8080");
        assertEquals(SpammerService.SOURCE_NETWORK, r.source);
        assertEquals("held by a", r.record.note);
        assertNull(b.store.get("8080"));

        SpammerService.CheckResult miss = b.spammers.check("unknown");
        assertFalse(miss.isSpammer());
        assertEquals(SpammerService.SOURCE_NONE, miss.source);

        assertEquals(SpammerService.SOURCE_LOCAL, a.spammers.check("8080").source);
    }

    @Test
    public void queryStaysLocalWhenNetworkQueryDisabled() throws Exception {
        TestNode a = startNode();
        NodeConfig c = config(a.address());
        c.networkQuery = false;
        TestNode b = startNode(c);
        await("a-b link", () -> a.connectedTo(b));
        a.store.upsert(SpammerRecord.of("1", "", 10, a.id()));
        assertEquals(SpammerService.SOURCE_NONE, b.spammers.check("1").source);
    }

    @Test
    public void purgeIsLocalOnly() throws Exception {
        TestNode a = startNode();
        TestNode b = startNode(a.address());
        await("a-b link", () -> a.connectedTo(b));
        a.spammers.report("77", "", 10L);
        await("b has record", () -> b.has("77"));

        assertTrue(b.spammers.purge("77"));
        assertFalse(b.has("77"));
        Thread.sleep(200);
        assertTrue(a.has("77"));
    }
}
