package com.ryuqq.jobstore.core.document;

/**
 * Member of a sorted set. One document per (key, value).
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class SetDocument extends BaseDocument {

    private String key;
    private String value;
    private double score;

    public SetDocument() {
    }

    public SetDocument(String key, String value, double score) {
        this.key = key;
        this.value = value;
        this.score = score;
        setId(idFor(key, value));
    }

    public static String idFor(String key, String value) {
        return "set:" + key + ":" + value;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.SET;
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

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }
}
