package com.ryuqq.jobstore.core.document;

import java.time.Instant;

/**
 * Registration of a worker server, refreshed by heartbeats.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class ServerDocument extends BaseDocument {

    private String serverId;
    private ServerData data = new ServerData();
    private Instant lastHeartbeat;
    private Instant startedAt;

    public ServerDocument() {
    }

    public ServerDocument(String serverId) {
        setServerId(serverId);
    }

    public static String idFor(String serverId) {
        return "server:" + serverId;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.SERVER;
    }

    @Override
    public String partitionScope() {
        return null;
    }

    public String getServerId() {
        return serverId;
    }

    public void setServerId(String serverId) {
        this.serverId = serverId;
        setId(serverId == null ? null : idFor(serverId));
    }

    public ServerData getData() {
        return data;
    }

    public void setData(ServerData data) {
        this.data = data;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public void setLastHeartbeat(Instant lastHeartbeat) {
        this.lastHeartbeat = lastHeartbeat;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }
}
