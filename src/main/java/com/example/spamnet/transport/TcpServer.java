package com.example.spamnet.transport;

import com.example.spamnet.util.Net;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TcpServer {

    private static final Logger LOG = LoggerFactory.getLogger(TcpServer.class);

    public interface Acceptor {
        void onAccepted(Socket socket);
    }

    private final int port;
    private final ExecutorService ioPool;
    private final Acceptor acceptor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ServerSocket serverSocket;

    public TcpServer(int port, ExecutorService ioPool, Acceptor acceptor) {
        this.port = port;
        this.ioPool = ioPool;
        this.acceptor = acceptor;
    }

    /** Binds the listener; port 0 picks an ephemeral port, see {@link #localPort()}. */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) return;
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(port));
        } catch (IOException e) {
            running.set(false);
            Net.safeClose(ss);
            throw e;
        }
        serverSocket = ss;
        LOG.info("P2P listener on port {}", ss.getLocalPort());
        ioPool.submit(this::acceptLoop);
    }

    public int localPort() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    LOG.error("Accept failed, listener stopping", e);
                    running.set(false);
                }
                break;
            }
            LOG.debug("Inbound connection from {}", Net.formatRemote(socket));
            try {
                acceptor.onAccepted(socket);
            } catch (RuntimeException e) {
                LOG.error("Rejected inbound connection from {}", Net.formatRemote(socket), e);
                Net.safeClose(socket);
            }
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        Net.safeClose(serverSocket);
        LOG.info("P2P listener stopped");
    }
}
