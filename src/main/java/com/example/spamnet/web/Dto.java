package com.example.spamnet.web;

import com.example.spamnet.service.SpammerService.CheckResult;
import com.example.spamnet.store.SpammerDao.SpammerRecord;
import com.example.spamnet.transport.PeerInfo;
import com.google.gson.annotations.SerializedName;

public final class Dto {

    private Dto() {
    }

    public static final class ApiResponse<T> {
        public boolean ok;
        public T data;
        public String error;
    }

    public static <T> ApiResponse<T> ok(T data) {
        ApiResponse<T> r = new ApiResponse<>();
        r.ok = true;
        r.data = data;
        return r;
    }

    public static <T> ApiResponse<T> fail(String error) {
        ApiResponse<T> r = new ApiResponse<>();
        r.ok = false;
        r.error = error;
        return r;
    }

    /** Answer to a check, shared by {@code GET /check} and the WebSocket gateway. */
    public static final class CheckResponse {
        public boolean ok;
        @SerializedName("user_id")
        public String userId;
        @SerializedName("is_spammer")
        public boolean isSpammer;
        public String source;
        public RecordDto record;
    }

    public static CheckResponse check(CheckResult result) {
        CheckResponse r = new CheckResponse();
        r.ok = true;
        r.userId = result.identifier;
        r.isSpammer = result.isSpammer();
        r.source = result.source;
        r.record = result.record == null ? null : record(result.record);
        return r;
    }

    public static final class RecordDto {
        public String identifier;
        public String note;
        public long timestamp;
        @SerializedName("origin_id")
        public String originId;
        @SerializedName("updated_at")
        public Long updatedAt;
    }

    public static RecordDto record(SpammerRecord r) {
        RecordDto dto = new RecordDto();
        dto.identifier = r.identifier;
        dto.note = r.note;
        dto.timestamp = r.timestamp;
        dto.originId = r.originId;
        dto.updatedAt = r.updatedAt > 0 ? r.updatedAt : null;
        return dto;
    }

    /** Body of {@code POST /report_id}; either id field is accepted. */
    public static final class ReportRequest {
        public String identifier;
        @SerializedName("user_id")
        public String userId;
        public String note;
        public Long timestamp;

        public String id() {
            return identifier != null ? identifier : userId;
        }
    }

    public static final class ReportResult {
        public String identifier;
        public boolean changed;
    }

    public static final class RemoveResult {
        public String identifier;
        public boolean removed;
    }

    /** One WebSocket query frame. */
    public static final class QueryFrame {
        @SerializedName("user_id")
        public String userId;
        public String identifier;

        public String id() {
            return userId != null ? userId : identifier;
        }
    }

    public static final class PeerDto {
        @SerializedName("node_id")
        public String nodeId;
        public String host;
        public int port;
    }

    public static PeerDto peer(PeerInfo p) {
        PeerDto dto = new PeerDto();
        dto.nodeId = p.nodeId;
        dto.host = p.listenAddress.host();
        dto.port = p.listenAddress.port();
        return dto;
    }

    public static final class MeDto {
        @SerializedName("node_id")
        public String nodeId;
        @SerializedName("started_at")
        public long startedAt;
        @SerializedName("p2p_port")
        public int p2pPort;
        @SerializedName("http_port")
        public int httpPort;
        @SerializedName("ws_port")
        public int wsPort;
        @SerializedName("live_peers")
        public int livePeers;
        public int records;
    }
}
