package com.example.spamnet.web;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import spark.Request;
import spark.Response;

public final class LocalOnlyFilter {

    private LocalOnlyFilter() {
    }

    public static void enforce(Request req, Response res) {
        if (isLocalIp(req.ip())) return;
        res.status(403);
        res.type("application/json");
        throw new LocalOnlyRejectedException();
    }

    public static boolean isLocalIp(String ip) {
        if (ip == null) return false;
        if ("127.0.0.1".equals(ip)) return true;
        if ("::1".equals(ip)) return true;
        if ("0:0:0:0:0:0:0:1".equals(ip)) return true;
        return false;
    }

    public static boolean isLocal(InetSocketAddress remote) {
        if (remote == null) return false;
        InetAddress addr = remote.getAddress();
        return addr != null ? addr.isLoopbackAddress() : isLocalIp(remote.getHostString());
    }

    public static final class LocalOnlyRejectedException extends RuntimeException {
    }
}
