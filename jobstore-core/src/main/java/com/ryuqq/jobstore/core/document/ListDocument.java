package com.ryuqq.jobstore.core.document;

/**
 * Element of a list. {@code index} is assigned at insert time and only grows within a key.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class ListDocument extends BaseDocument {

    private String key;
    private long index;
    private String value;

    public ListDocument() {
    }

    public ListDocument(String key, long index, String value) {
        this.key = key;
        this.index = index;
        this.value = value;
        setId(idFor(key, index));
    }

    public static String idFor(String key, long index) {
        return "list:" + key + ":" + index;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.LIST;
    }

    @Override
    public String partitionScope() {
        return key;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public long getIndex() {
        return index;
    }

    public void setIndex(long index) {
        this.index = index;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
