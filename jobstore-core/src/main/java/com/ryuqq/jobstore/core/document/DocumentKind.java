package com.ryuqq.jobstore.core.document;

/**
 * Kinds of documents persisted by the job store.
 *
 * <p>The {@link #getValue() value} is written to the {@code documentType} field of every
 * document and is the discriminator used by queries and by collection resolution.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public enum DocumentKind {

    JOB("job", JobDocument.class),
    JOB_INDEX("jobIndex", JobIndexDocument.class),
    SERVER("server", ServerDocument.class),
    LOCK("lock", LockDocument.class),
    QUEUE("queue", QueueDocument.class),
    SET("set", SetDocument.class),
    HASH("hash", HashDocument.class),
    LIST("list", ListDocument.class),
    COUNTER("counter", CounterDocument.class);

    private final String value;
    private final Class<? extends BaseDocument> documentClass;

    DocumentKind(String value, Class<? extends BaseDocument> documentClass) {
        this.value = value;
        this.documentClass = documentClass;
    }

    public String getValue() {
        return value;
    }

    public Class<? extends BaseDocument> getDocumentClass() {
        return documentClass;
    }

    /**
     * Resolves a kind from its persisted {@code documentType} value.
     *
     * @param value persisted discriminator
     * @return matching kind
     * @throws IllegalArgumentException if the value is null or names no known kind
     */
    public static DocumentKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("documentType cannot be null");
        }
        for (DocumentKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown document type: '" + value + "'");
    }
}
