package edu.stanford.futuredata.tsquery.sql;

public enum MetadataType {
    DATABASE("database"),
    NAMESPACE("namespace"),
    METRIC("measurement"),
    TAG_KEY("tagKey"),
    TAG_VALUE("tagValue"),
    FIELD("field");

    private final String displayName;

    MetadataType(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
