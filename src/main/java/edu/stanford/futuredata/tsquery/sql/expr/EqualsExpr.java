package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.Objects;

public final class EqualsExpr implements TagFilter {

    public final String key;
    public final String value;

    public EqualsExpr(String key, String value) {
        this.key = Objects.requireNonNull(key);
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public String getTagKey() {
        return key;
    }

    @Override
    public boolean matches(String tagValue) {
        return value.equals(tagValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EqualsExpr)) return false;
        EqualsExpr that = (EqualsExpr) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
