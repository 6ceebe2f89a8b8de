package com.example.spamnet.transport;

import com.example.spamnet.core.Settings;
import com.example.spamnet.protocol.Errors;
import com.example.spamnet.protocol.MessageCodec;
import com.example.spamnet.protocol.MessageEnvelope;
import com.example.spamnet.protocol.MessageKind;
import com.example.spamnet.protocol.Payloads;
import com.example.spamnet.util.Net;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One TCP stream to one remote node.
 *
 * <p>A reader task feeds socket bytes through a {@link JsonFramer} and the
 * {@link MessageCodec}; a writer task drains a bounded outbound queue. The first
 * inbound message must be a hello. The connection never reconnects itself: on
 * any failure it closes and reports to its {@link Listener}.
 */
public class Connection implements PeerLink, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);
    private static final byte[] POISON = new byte[0];

    public interface Listener {
        void onHandshake(Connection conn, PeerInfo remote);

        void onMessage(Connection conn, InboundMessage message);

        void onClosed(Connection conn);
    }

    private final Socket socket;
    private final String localNodeId;
    private final int localListenPort;
    private final boolean outbound;
    private final PeerAddress dialedAddress;
    private final Listener listener;
    private final JsonFramer framer = new JsonFramer(Settings.MAX_MESSAGE_BYTES);
    private final BlockingQueue<byte[]> sendQueue = new LinkedBlockingQueue<>(Settings.SEND_QUEUE_CAPACITY);
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch handshakeDone = new CountDownLatch(1);
    private final OutputStream out;

    private volatile PeerInfo remotePeer;
    private volatile String closeCode;

    /**
     * @param dialedAddress the address this side dialed, or null for accepted connections
     */
    public Connection(
            Socket socket,
            String localNodeId,
            int localListenPort,
            PeerAddress dialedAddress,
            Listener listener
    ) throws IOException {
        this.socket = socket;
        this.localNodeId = localNodeId;
        this.localListenPort = localListenPort;
        this.outbound = dialedAddress != null;
        this.dialedAddress = dialedAddress;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    public void start(ExecutorService ioPool) {
        ioPool.submit(this::runWriteLoop);
        ioPool.submit(this::runReadLoop);
    }

    @Override
    public String remoteNodeId() {
        PeerInfo rp = remotePeer;
        return rp == null ? null : rp.nodeId;
    }

    public PeerInfo remotePeer() {
        return remotePeer;
    }

    public boolean isOutbound() {
        return outbound;
    }

    public PeerAddress dialedAddress() {
        return dialedAddress;
    }

    /** Node id of whichever side opened the TCP connection, once known. */
    public String initiatorNodeId() {
        return outbound ? localNodeId : remoteNodeId();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String describe() {
        PeerInfo rp = remotePeer;
        return rp != null ? rp.toString() : Net.formatRemote(socket);
    }

    /** Error code the connection was closed with, or null. */
    public String closeCode() {
        return closeCode;
    }

    public boolean awaitHandshake(long timeoutMs) throws InterruptedException {
        return handshakeDone.await(timeoutMs, TimeUnit.MILLISECONDS) && remotePeer != null && !isClosed();
    }

    void runReadLoop() {
        try {
            socket.setSoTimeout(Settings.HELLO_TIMEOUT_MS);
            sendHello();
            InputStream in = socket.getInputStream();
            byte[] chunk = new byte[Settings.READ_BUFFER_BYTES];
            while (!isClosed()) {
                int n = in.read(chunk);
                if (n < 0) {
                    if (framer.pendingBytes() > 0) {
                        LOG.debug("Discarding {} bytes of unterminated message from {}", framer.pendingBytes(), describe());
                    }
                    break;
                }
                if (n == 0) continue;
                for (String text : framer.feed(chunk, 0, n)) {
                    if (isClosed()) break;
                    handleText(text);
                }
            }
        } catch (JsonFramer.FramingException e) {
            LOG.warn("Framing error from {}: {}", describe(), e.getMessage());
            sendErrorAndClose(Errors.TOO_LARGE, e.getMessage());
        } catch (SocketTimeoutException e) {
            LOG.warn("No hello from {} within {} ms", describe(), Settings.HELLO_TIMEOUT_MS);
            sendErrorAndClose(Errors.BAD_MESSAGE, "No hello received");
        } catch (IOException e) {
            if (!isClosed()) {
                LOG.info("Connection to {} lost: {}", describe(), e.getMessage());
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure reading from {}", describe(), e);
        } finally {
            close();
        }
    }

    private void handleText(String text) {
        long receivedAt = System.currentTimeMillis();
        MessageEnvelope env;
        try {
            env = MessageCodec.decode(text);
        } catch (MessageCodec.DecodeException e) {
            LOG.warn("Dropping undecodable message from {}: {}", describe(), e.getMessage());
            return;
        }

        if (remotePeer == null) {
            if (MessageKind.ERROR.equals(env.kind())) {
                LOG.warn("Peer {} refused handshake: {}", describe(), env.payload());
                // Our own id on the other end: we dialed ourselves.
                if (localNodeId.equals(env.originId())) {
                    closeCode = Errors.SELF_CONNECTION;
                }
                close();
                return;
            }
            if (!MessageKind.HELLO.equals(env.kind())) {
                sendErrorAndClose(Errors.BAD_MESSAGE, "Expected hello");
                return;
            }
            handleHello(env);
            return;
        }
        if (MessageKind.HELLO.equals(env.kind())) {
            return;
        }
        if (MessageKind.ERROR.equals(env.kind())) {
            LOG.warn("Peer {} reported error: {}", describe(), env.payload());
            return;
        }
        try {
            listener.onMessage(this, new InboundMessage(env, receivedAt));
        } catch (RuntimeException e) {
            LOG.error("Handler failed for {} from {}", env.kind(), describe(), e);
        }
    }

    private void sendHello() {
        Payloads.Hello hello = new Payloads.Hello();
        hello.port = localListenPort;
        send(MessageEnvelope.create(MessageKind.HELLO, localNodeId, MessageCodec.toTree(hello)));
    }

    private void handleHello(MessageEnvelope hello) {
        Payloads.Hello payload;
        try {
            payload = MessageCodec.payloadAs(hello, Payloads.Hello.class);
        } catch (MessageCodec.DecodeException e) {
            sendErrorAndClose(Errors.BAD_MESSAGE, e.getMessage());
            return;
        }
        if (payload.port <= 0 || payload.port > 65535) {
            sendErrorAndClose(Errors.BAD_MESSAGE, "Invalid port");
            return;
        }
        if (localNodeId.equals(hello.originId())) {
            LOG.info("Dropping self-connection via {}", Net.formatRemote(socket));
            sendErrorAndClose(Errors.SELF_CONNECTION, "Connected to self");
            return;
        }

        String ip = Net.remoteIp(socket);
        this.remotePeer = new PeerInfo(hello.originId(), new PeerAddress(ip, payload.port));
        try {
            socket.setSoTimeout(0);
        } catch (IOException e) {
            LOG.debug("setSoTimeout failed for {}: {}", describe(), e.getMessage());
        }
        handshakeDone.countDown();
        LOG.info("Handshake OK: {} => {}", Net.formatRemote(socket), remotePeer);
        listener.onHandshake(this, remotePeer);
    }

    /**
     * Queues {@code env} for asynchronous write. Never blocks: when the queue is
     * full or the connection is closed the message is dropped and false returned.
     */
    @Override
    public boolean send(MessageEnvelope env) {
        Objects.requireNonNull(env, "env");
        if (isClosed()) return false;
        byte[] bytes = MessageCodec.encode(env).getBytes(StandardCharsets.UTF_8);
        if (bytes.length > Settings.MAX_MESSAGE_BYTES) {
            LOG.warn("Not sending {} to {}: {} bytes exceeds frame limit", env.kind(), describe(), bytes.length);
            return false;
        }
        if (!sendQueue.offer(bytes)) {
            LOG.warn("Send queue full for {}, dropping {}", describe(), env.kind());
            return false;
        }
        return true;
    }

    void runWriteLoop() {
        try {
            while (!isClosed()) {
                byte[] frame = sendQueue.take();
                if (frame == POISON) break;
                writeLock.lock();
                try {
                    out.write(frame);
                    out.flush();
                } finally {
                    writeLock.unlock();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!isClosed()) {
                LOG.info("Write to {} failed: {}", describe(), e.getMessage());
            }
        } finally {
            close();
        }
    }

    /**
     * Writes an error frame, then closes. Safe to call from another connection's
     * thread: if the writer is stuck on a slow peer for longer than
     * {@link Settings#ERROR_WRITE_WAIT_MS}, the frame is skipped and the socket
     * closed, which also releases the stuck writer.
     */
    public void sendErrorAndClose(String code, String message) {
        if (!isClosed()) {
            closeCode = code;
            MessageEnvelope err = Errors.buildError(localNodeId, code, message);
            byte[] bytes = MessageCodec.encode(err).getBytes(StandardCharsets.UTF_8);
            try {
                if (writeLock.tryLock(Settings.ERROR_WRITE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    try {
                        out.write(bytes);
                        out.flush();
                    } finally {
                        writeLock.unlock();
                    }
                } else {
                    LOG.debug("Writer to {} busy, closing without {}", describe(), code);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                LOG.debug("Could not deliver {} to {}: {}", code, describe(), e.getMessage());
            }
        }
        close();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        Net.safeClose(socket);
        sendQueue.clear();
        sendQueue.offer(POISON);
        handshakeDone.countDown();
        LOG.info("Connection closed: {}", describe());
        listener.onClosed(this);
    }
}
