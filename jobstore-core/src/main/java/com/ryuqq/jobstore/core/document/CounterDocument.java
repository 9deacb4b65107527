package com.ryuqq.jobstore.core.document;

/**
 * Signed aggregate counter.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class CounterDocument extends BaseDocument {

    private String key;
    private long value;

    public CounterDocument() {
    }

    public CounterDocument(String key, long value) {
        this.key = key;
        this.value = value;
        setId(idFor(key));
    }

    public static String idFor(String key) {
        return "counter:" + key;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.COUNTER;
    }

    @Override
    public String partitionScope() {
        return null;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }
}
