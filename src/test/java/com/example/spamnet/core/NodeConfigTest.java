package com.example.spamnet.core;

import com.example.spamnet.transport.PeerAddress;
import java.util.Arrays;
import java.util.Properties;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class NodeConfigTest {

    @Test
    public void defaultsWhenPropertiesEmpty() {
        NodeConfig c = NodeConfig.fromProperties(new Properties());
        assertEquals(Settings.DEFAULT_P2P_PORT, c.p2pPort);
        assertEquals(Settings.DEFAULT_HTTP_PORT, c.httpPort);
        assertEquals(Settings.DEFAULT_WS_PORT, c.wsPort);
        assertTrue(c.bootstrap.isEmpty());
        assertTrue(c.networkQuery);
    }

    @Test
    public void readsKeys() {
        Properties p = new Properties();
        p.setProperty("p2p.port", "0");
        p.setProperty("bootstrap", "10.0.0.1:9828, peer.example:9829,,10.0.0.1:9828");
        p.setProperty("query.network", "false");
        p.setProperty("query.timeoutMs", "250");
        p.setProperty("peers.max", "4");
        NodeConfig c = NodeConfig.fromProperties(p);
        assertEquals(0, c.p2pPort);
        assertEquals(Arrays.asList(new PeerAddress("10.0.0.1", 9828), new PeerAddress("peer.example", 9829)), c.bootstrap);
        assertFalse(c.networkQuery);
        assertEquals(250L, c.queryTimeoutMs);
        assertEquals(4, c.maxPeers);
    }

    @Test
    public void positionalArgsOverridePortAndAppendBootstrap() {
        Properties p = new Properties();
        p.setProperty("bootstrap", "a:1");
        NodeConfig c = NodeConfig.fromProperties(p);
        c.applyArgs(new String[]{"9900", "b:2", "a:1"});
        assertEquals(9900, c.p2pPort);
        assertEquals(Arrays.asList(PeerAddress.parse("a:1"), PeerAddress.parse("b:2")), c.bootstrap);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBadAddress() {
        Properties p = new Properties();
        p.setProperty("bootstrap", "no-port-here");
        NodeConfig.fromProperties(p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBadNumber() {
        Properties p = new Properties();
        p.setProperty("ledger.maxSize", "lots");
        NodeConfig.fromProperties(p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsInvertedBackoff() {
        Properties p = new Properties();
        p.setProperty("reconnect.initialDelayMs", "5000");
        p.setProperty("reconnect.maxDelayMs", "1000");
        NodeConfig.fromProperties(p);
    }

    @Test
    public void addressParsing() {
        PeerAddress a = PeerAddress.parse(" LocalHost:9828 ");
        assertEquals("LocalHost", a.host());
        assertEquals(9828, a.port());
        assertEquals(new PeerAddress("localhost", 9828), a);
    }
}
