package edu.stanford.futuredata.tsquery.series;

/** Storage type of a field, which fixes how points of the field roll up. */
public enum FieldType {
    SUM,
    MIN,
    MAX,
    LAST,
    HISTOGRAM
}
