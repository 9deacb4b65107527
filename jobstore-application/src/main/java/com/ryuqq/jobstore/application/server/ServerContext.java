package com.ryuqq.jobstore.application.server;

import java.util.List;

/**
 * 서버 등록 정보.
 *
 * @param workerCount 워커 수
 * @param queues 처리하는 큐 목록
 * @author JobStore Team
 * @since 1.0.0
 */
public record ServerContext(int workerCount, List<String> queues) {

    public ServerContext {
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0 (current: " + workerCount + ")");
        }
        queues = queues == null ? List.of() : List.copyOf(queues);
    }
}
