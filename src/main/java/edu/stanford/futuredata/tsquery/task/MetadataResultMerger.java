package edu.stanford.futuredata.tsquery.task;

import com.fasterxml.jackson.core.type.TypeReference;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.series.FieldMeta;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.MetadataType;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;

import java.io.IOException;
import java.util.*;

/**
 * Unions the string lists of every leaf, sorted and bounded by the statement's limit. Field
 * lists arrive as JSON documents and are unioned by field name into one JSON document.
 */
public class MetadataResultMerger implements ResultMerger {

    private static final TypeReference<List<FieldMeta>> FIELD_LIST = new TypeReference<>() {};

    private final JobContext<List<String>> job;
    private final Metadata statement;
    private final TreeSet<String> values = new TreeSet<>();
    private final TreeMap<String, FieldMeta> fields = new TreeMap<>();
    private boolean done = false;

    public MetadataResultMerger(JobContext<List<String>> job, Metadata statement) {
        this.job = job;
        this.statement = statement;
    }

    @Override
    public void merge(TaskResponse response) throws QueryException {
        if (response.getPayload().isEmpty()) {
            return;
        }
        ArrayList<?> decoded = Utilities.byteStringToObject(response.getPayload(), ArrayList.class);
        List<String> result = new ArrayList<>();
        for (Object value : decoded) {
            if (!(value instanceof String)) {
                throw QueryException.malformedRequest("metadata value " + value);
            }
            result.add((String) value);
        }
        synchronized (this) {
            if (done) {
                return;
            }
            if (statement.type == MetadataType.FIELD) {
                for (String json : result) {
                    try {
                        for (FieldMeta f : Utilities.fromJSON(json, FIELD_LIST)) {
                            fields.putIfAbsent(f.name, f);
                        }
                    } catch (IOException e) {
                        throw QueryException.malformedRequest("field list: " + e.getMessage());
                    }
                }
            } else {
                values.addAll(result);
            }
        }
    }

    @Override
    public void complete(QueryException error) {
        List<String> result = new ArrayList<>();
        synchronized (this) {
            done = true;
            if (error != null) {
                job.fail(error);
                return;
            }
            if (statement.type == MetadataType.FIELD) {
                result.add(Utilities.toJSON(new ArrayList<>(fields.values())));
            } else {
                for (String v : values) {
                    if (result.size() >= statement.limit) {
                        break;
                    }
                    result.add(v);
                }
            }
        }
        job.emit(result);
    }
}
