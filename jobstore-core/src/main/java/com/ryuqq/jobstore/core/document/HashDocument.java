package com.ryuqq.jobstore.core.document;

/**
 * One field of a hash. One document per (key, field).
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class HashDocument extends BaseDocument {

    private String key;
    private String field;
    private String value;

    public HashDocument() {
    }

    public HashDocument(String key, String field, String value) {
        this.key = key;
        this.field = field;
        this.value = value;
        setId(idFor(key, field));
    }

    public static String idFor(String key, String field) {
        return "hash:" + key + ":" + field;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.HASH;
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

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
