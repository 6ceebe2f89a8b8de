package com.example.spamnet.util;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Net {

    private static final Logger LOG = LoggerFactory.getLogger(Net.class);

    private Net() {
    }

    public static void safeClose(Closeable closeable) {
        if (closeable == null) return;
        try {
            closeable.close();
        } catch (IOException e) {
            LOG.debug("close failed: {}", e.getMessage());
        }
    }

    public static String formatRemote(Socket socket) {
        if (socket == null) return "unknown";
        if (socket.getRemoteSocketAddress() instanceof InetSocketAddress a) {
            return a.getAddress().getHostAddress() + ":" + a.getPort();
        }
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    public static String remoteIp(Socket socket) {
        if (socket != null && socket.getInetAddress() != null) {
            return socket.getInetAddress().getHostAddress();
        }
        return null;
    }
}
