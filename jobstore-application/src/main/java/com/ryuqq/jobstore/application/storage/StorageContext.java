package com.ryuqq.jobstore.application.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.DocumentMapper;
import com.ryuqq.jobstore.core.layout.CollectionResolver;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentStore;
import com.ryuqq.jobstore.core.spi.QueryResults;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 저장소 접근 컨텍스트.
 *
 * <p>엔진 구성요소가 공유하는 {@link DocumentStore}, {@link CollectionResolver}, 설정, 시계를 묶고,
 * 문서 종류에 맞는 컬렉션과 파티션 키를 적용해 저장소를 호출합니다.
 * 상태를 갖지 않으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class StorageContext {

    private final DocumentStore store;
    private final CollectionResolver resolver;
    private final JobStoreOptions options;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public StorageContext(DocumentStore store, JobStoreOptions options, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.options = options;
        this.clock = clock;
        this.resolver = options.createResolver();
        this.objectMapper = DocumentMapper.create();
    }

    public DocumentStore store() {
        return store;
    }

    public CollectionResolver resolver() {
        return resolver;
    }

    public JobStoreOptions options() {
        return options;
    }

    public Clock clock() {
        return clock;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * 문서 단건 조회.
     *
     * @param kind 문서 종류
     * @param type 문서 클래스
     * @param id 문서 ID
     * @param scope 파티션 범위 (job은 큐 이름, set/hash/list는 key, 그 외 null)
     * @param <T> 문서 타입
     * @return 문서, 없으면 empty
     */
    public <T extends BaseDocument> Optional<T> read(DocumentKind kind, Class<T> type, String id, String scope) {
        return store.get(resolver.collectionFor(kind), id, resolver.partitionKeyFor(kind, scope), type);
    }

    /**
     * 파티션 범위 쿼리 (지연 실행).
     *
     * @param kind 문서 종류
     * @param type 문서 클래스
     * @param scope 파티션 범위
     * @param query 쿼리
     * @param <T> 문서 타입
     * @return 지연 결과
     */
    public <T extends BaseDocument> QueryResults<T> queryPartition(DocumentKind kind, Class<T> type, String scope,
                                                                   DocumentQuery query) {
        return QueryResults.of(store, resolver.collectionFor(kind), query, resolver.partitionKeyFor(kind, scope),
            type, options.queryPageSize());
    }

    /**
     * 파티션 전체 쿼리 (지연 실행). 비용이 크고 일관성이 약합니다.
     *
     * @param kind 문서 종류
     * @param type 문서 클래스
     * @param query 쿼리
     * @param <T> 문서 타입
     * @return 지연 결과
     */
    public <T extends BaseDocument> QueryResults<T> queryAcrossPartitions(DocumentKind kind, Class<T> type,
                                                                          DocumentQuery query) {
        return QueryResults.of(store, resolver.collectionFor(kind), query, null, type, options.queryPageSize());
    }

    public <T extends BaseDocument> T create(T document) {
        String collection = resolver.assignPartitionKey(document);
        return store.create(collection, document);
    }

    public <T extends BaseDocument> T upsert(T document) {
        String collection = resolver.assignPartitionKey(document);
        return store.upsert(collection, document);
    }

    /**
     * 문서 교체. 문서의 etag가 있으면 버전 검사를 합니다.
     *
     * @param document 교체할 문서
     * @param <T> 문서 타입
     * @return 저장된 문서
     */
    public <T extends BaseDocument> T replace(T document) {
        String collection = resolver.assignPartitionKey(document);
        return store.replace(collection, document);
    }

    /**
     * 무조건 삭제 (없어도 성공).
     *
     * @param document 삭제할 문서 (id, 파티션 키 사용)
     */
    public void delete(BaseDocument document) {
        store.delete(resolver.collectionFor(document.kind()), document.getId(), document.getPartitionKey(), null);
    }

    /**
     * etag가 일치할 때만 삭제.
     *
     * @param document 삭제할 문서 (id, 파티션 키, etag 사용)
     */
    public void deleteIfMatch(BaseDocument document) {
        store.delete(resolver.collectionFor(document.kind()), document.getId(), document.getPartitionKey(),
            document.getEtag());
    }
}
