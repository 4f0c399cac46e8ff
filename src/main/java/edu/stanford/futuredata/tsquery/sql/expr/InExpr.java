package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.List;
import java.util.Objects;

public final class InExpr implements TagFilter {

    public final String key;
    public final List<String> values;

    public InExpr(String key, List<String> values) {
        this.key = Objects.requireNonNull(key);
        this.values = List.copyOf(values);
    }

    @Override
    public String getTagKey() {
        return key;
    }

    @Override
    public boolean matches(String tagValue) {
        return values.contains(tagValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InExpr)) return false;
        InExpr that = (InExpr) o;
        return key.equals(that.key) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, values);
    }

    @Override
    public String toString() {
        return key + " in (" + String.join(",", values) + ")";
    }
}
