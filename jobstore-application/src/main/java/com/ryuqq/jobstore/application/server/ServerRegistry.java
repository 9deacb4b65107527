package com.ryuqq.jobstore.application.server;

import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.ServerData;
import com.ryuqq.jobstore.core.document.ServerDocument;
import com.ryuqq.jobstore.core.spi.DocumentNotFoundException;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentQuery.Operator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 서버 등록/heartbeat 관리.
 *
 * <p>서버 문서는 {@code serverTimeout} 후 만료되며 heartbeat마다 만료 시각이 연장됩니다.
 * 만료 전에 정리하려면 {@link #removeTimedOutServers(Duration)}를 호출합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private final StorageContext context;

    public ServerRegistry(StorageContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /**
     * 서버 등록 (이미 있으면 덮어씀).
     *
     * @param serverId 서버 ID
     * @param serverContext 워커 수, 큐 목록
     */
    public void announce(String serverId, ServerContext serverContext) {
        requireServerId(serverId);
        if (serverContext == null) {
            throw new IllegalArgumentException("serverContext cannot be null");
        }
        Instant now = context.now();
        ServerDocument server = new ServerDocument(serverId);
        server.setData(new ServerData(serverContext.workerCount(), new ArrayList<>(serverContext.queues()), now,
            context.options().instanceName()));
        server.setStartedAt(now);
        server.setLastHeartbeat(now);
        server.setExpireAt(now.plus(context.options().serverTimeout()));
        context.upsert(server);
        log.info("Server {} announced (workers: {}, queues: {})", serverId, serverContext.workerCount(),
            serverContext.queues());
    }

    /**
     * heartbeat 기록.
     *
     * @param serverId 서버 ID
     * @throws DocumentNotFoundException 등록되지 않았거나 이미 제거된 서버
     */
    public void heartbeat(String serverId) {
        requireServerId(serverId);
        ServerDocument server = context.read(DocumentKind.SERVER, ServerDocument.class,
                ServerDocument.idFor(serverId), null)
            .orElseThrow(() -> new DocumentNotFoundException(context.resolver().collectionFor(DocumentKind.SERVER),
                ServerDocument.idFor(serverId), context.resolver().partitionKeyFor(DocumentKind.SERVER, null)));
        Instant now = context.now();
        server.setLastHeartbeat(now);
        server.setExpireAt(now.plus(context.options().serverTimeout()));
        server.setEtag(null);
        context.replace(server);
        log.debug("Heartbeat from server {}", serverId);
    }

    public void remove(String serverId) {
        requireServerId(serverId);
        ServerDocument server = new ServerDocument(serverId);
        context.resolver().assignPartitionKey(server);
        context.delete(server);
        log.info("Server {} removed", serverId);
    }

    /**
     * 마지막 heartbeat가 오래된 서버 제거.
     *
     * @param timeout 허용 경과 시간
     * @return 제거된 서버 수
     */
    public int removeTimedOutServers(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0 (current: " + timeout + ")");
        }
        Instant cutoff = context.now().minus(timeout);
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.SERVER)
            .where("lastHeartbeat", Operator.LT, cutoff.toString())
            .build();
        int removed = 0;
        for (ServerDocument server : context.queryPartition(DocumentKind.SERVER, ServerDocument.class, null, query)
                .toList()) {
            context.delete(server);
            removed++;
            log.info("Removed timed out server {} (last heartbeat: {})", server.getServerId(),
                server.getLastHeartbeat());
        }
        return removed;
    }

    public List<ServerDocument> findAll() {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.SERVER).orderBy("startedAt").build();
        return context.queryPartition(DocumentKind.SERVER, ServerDocument.class, null, query).toList();
    }

    private static void requireServerId(String serverId) {
        if (serverId == null || serverId.isBlank()) {
            throw new IllegalArgumentException("serverId cannot be null or blank");
        }
    }
}
