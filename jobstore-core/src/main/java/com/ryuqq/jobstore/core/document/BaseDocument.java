package com.ryuqq.jobstore.core.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Shape shared by every persisted document.
 *
 * <p>{@code id} is unique within its collection and partition. {@code timestamp} and
 * {@code etag} are assigned by the store on every write and must not be set by callers,
 * except that a non-null {@code etag} on a document passed to
 * {@link com.ryuqq.jobstore.core.spi.DocumentStore#replace replace} is used as the
 * expected version.</p>
 *
 * <p>{@code expireAt}, when set, is the absolute instant after which the store may delete
 * the document.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public abstract class BaseDocument {

    private String id;
    private String partitionKey;
    private Instant expireAt;

    @JsonProperty("_ts")
    private Long timestamp;

    @JsonProperty("_etag")
    private String etag;

    /**
     * Kind of this document, also written as {@code documentType}.
     *
     * @return document kind
     */
    @JsonIgnore
    public abstract DocumentKind kind();

    /**
     * Natural key from which the partition key of this document is derived, such as the
     * queue name of a job or the key of a set entry. Kinds stored under a fixed partition
     * return {@code null}.
     *
     * @return partition scope or null
     */
    @JsonIgnore
    public abstract String partitionScope();

    @JsonProperty(value = "documentType", access = JsonProperty.Access.READ_ONLY)
    public String getDocumentType() {
        return kind().getValue();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public void setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
    }

    public Instant getExpireAt() {
        return expireAt;
    }

    public void setExpireAt(Instant expireAt) {
        this.expireAt = expireAt;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public String getEtag() {
        return etag;
    }

    public void setEtag(String etag) {
        this.etag = etag;
    }

    /**
     * Whether this document has passed its {@code expireAt}.
     *
     * @param now current time
     * @return true if expired
     */
    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expireAt != null && !expireAt.isAfter(now);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', partitionKey='" + partitionKey + "'}";
    }
}
