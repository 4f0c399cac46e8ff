package edu.stanford.futuredata.tsquery.series;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/** Field descriptor as returned by SHOW FIELDS. */
public final class FieldMeta implements Serializable {

    public final String name;
    public final FieldType type;
    public final int id;

    @JsonCreator
    public FieldMeta(@JsonProperty("name") String name, @JsonProperty("type") FieldType type,
                     @JsonProperty("id") int id) {
        this.name = Objects.requireNonNull(name);
        this.type = type;
        this.id = id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldMeta)) return false;
        FieldMeta that = (FieldMeta) o;
        return id == that.id && name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, id);
    }

    @Override
    public String toString() {
        return name + "(" + type + "," + id + ")";
    }
}
