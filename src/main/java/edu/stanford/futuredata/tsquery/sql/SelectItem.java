package edu.stanford.futuredata.tsquery.sql;

import java.io.Serializable;
import java.util.Objects;

public final class SelectItem implements Serializable {

    public final String field;
    public final AggregateType aggregate;

    public SelectItem(String field, AggregateType aggregate) {
        this.field = Objects.requireNonNull(field);
        this.aggregate = Objects.requireNonNull(aggregate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectItem)) return false;
        SelectItem that = (SelectItem) o;
        return field.equals(that.field) && aggregate == that.aggregate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, aggregate);
    }

    @Override
    public String toString() {
        return aggregate.name().toLowerCase() + "(" + field + ")";
    }
}
