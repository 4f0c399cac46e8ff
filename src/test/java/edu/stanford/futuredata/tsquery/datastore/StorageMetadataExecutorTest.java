package edu.stanford.futuredata.tsquery.datastore;

import com.fasterxml.jackson.core.type.TypeReference;
import edu.stanford.futuredata.tsquery.interfaces.*;
import edu.stanford.futuredata.tsquery.series.FieldMeta;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.Query;
import edu.stanford.futuredata.tsquery.sql.expr.EqualsExpr;
import edu.stanford.futuredata.tsquery.sql.expr.NotExpr;
import edu.stanford.futuredata.tsquery.task.RequestContext;
import edu.stanford.futuredata.tsquery.tsmockinterface.TSDatabase;
import edu.stanford.futuredata.tsquery.utilities.ErrorKind;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class StorageMetadataExecutorTest {

    private static final String ns = Query.DEFAULT_NAMESPACE;
    private TSDatabase db;

    @BeforeEach
    public void writeData() {
        db = new TSDatabase("db");
        db.write(1, ns, "cpu", Map.of("host", "a", "dc", "east"), "usage", 0, 1.0);
        db.write(1, ns, "cpu", Map.of("host", "b", "dc", "east"), "usage", 0, 1.0);
        db.write(2, ns, "cpu", Map.of("host", "c", "dc", "west"), "idle", 0, 1.0);
        db.write(2, ns, "cpu", Map.of("host", "d", "dc", "west"), "usage", 0, 1.0);
        db.write(2, ns, "cpu_load", Map.of("host", "a"), "value", 0, 1.0);
        db.write(1, "other-ns", "mem", Map.of("host", "a"), "free", 0, 1.0);
    }

    private List<String> run(Metadata statement, List<Integer> shards) throws QueryException {
        return new StorageMetadataExecutor(db, statement, shards, new RequestContext("r", 5_000)).execute();
    }

    @Test
    public void testNamespacesAndMetrics() throws QueryException {
        assertEquals(List.of("default-ns", "other-ns"), run(Metadata.showNamespaces("", 10), List.of(1, 2)));
        assertEquals(List.of("other-ns"), run(Metadata.showNamespaces("ot", 10), List.of(1, 2)));
        assertEquals(List.of("cpu", "cpu_load"), run(Metadata.showMetrics(ns, "cpu", 10), List.of(1, 2)));
        assertEquals(List.of("cpu"), run(Metadata.showMetrics(ns, "", 1), List.of(1, 2)));
    }

    @Test
    public void testTagKeys() throws QueryException {
        assertEquals(List.of("dc", "host"), run(Metadata.showTagKeys(ns, "cpu", 10), List.of(1, 2)));
        assertTrue(run(Metadata.showTagKeys(ns, "disk", 10), List.of(1, 2)).isEmpty());
    }

    @Test
    public void testTagValuesWithoutCondition() throws QueryException {
        assertEquals(List.of("a", "b", "c", "d"),
                run(Metadata.showTagValues(ns, "cpu", "host", "", null, 10), List.of(1, 2)));
        assertEquals(List.of("a", "b"), run(Metadata.showTagValues(ns, "cpu", "host", "", null, 10), List.of(1)));
        assertEquals(2, run(Metadata.showTagValues(ns, "cpu", "host", "", null, 2), List.of(1, 2)).size());
        assertTrue(run(Metadata.showTagValues(ns, "cpu", "rack", "", null, 10), List.of(1, 2)).isEmpty());
    }

    @Test
    public void testTagValuesWithCondition() throws QueryException {
        assertEquals(List.of("c", "d"),
                run(Metadata.showTagValues(ns, "cpu", "host", "", new EqualsExpr("dc", "west"), 10), List.of(1, 2)));
        assertEquals(List.of("a", "b"), run(Metadata.showTagValues(ns, "cpu", "host", "",
                new NotExpr(new EqualsExpr("dc", "west")), 10), List.of(1, 2)));
        assertTrue(run(Metadata.showTagValues(ns, "cpu", "host", "", new EqualsExpr("dc", "north"), 10),
                List.of(1, 2)).isEmpty());
    }

    @Test
    public void testFieldsAsJson() throws Exception {
        List<String> result = run(Metadata.showFields(ns, "cpu"), List.of(1, 2));
        assertEquals(1, result.size());
        List<FieldMeta> fields = Utilities.fromJSON(result.get(0), new TypeReference<List<FieldMeta>>() {});
        assertEquals(Set.of("usage", "idle"), Set.of(fields.get(0).name, fields.get(1).name));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testConditionalTagValuesHonorLimit() throws Exception {
        TSDBDatabase database = mock(TSDBDatabase.class);
        MetadataDatabase metadata = mock(MetadataDatabase.class);
        TagMetadata tagMetadata = mock(TagMetadata.class);
        Shard shard = mock(Shard.class);
        IndexDatabase index = mock(IndexDatabase.class);
        GroupingContext grouping = mock(GroupingContext.class);
        when(database.name()).thenReturn("db");
        when(database.metadataDatabase()).thenReturn(metadata);
        when(database.tagMetadata()).thenReturn(tagMetadata);
        when(database.getShard(1)).thenReturn(Optional.of(shard));
        when(shard.indexDatabase()).thenReturn(index);
        when(metadata.getTagKeyID(anyString(), anyString(), anyString())).thenReturn(Optional.of(5));
        when(metadata.getMetricID(anyString(), anyString())).thenReturn(Optional.of(1));
        when(tagMetadata.findTagValueIDsByExpr(eq(5), any())).thenReturn(RoaringBitmap.bitmapOf(12));
        when(index.getSeriesIDsByTagValueIDs(eq(5), any())).thenReturn(RoaringBitmap.bitmapOf(1, 2, 3));
        when(index.getGroupingContext(List.of(5))).thenReturn(grouping);
        when(grouping.scanTagValueIDs(any())).thenReturn(List.of(RoaringBitmap.bitmapOf(12, 13, 14, 15)));
        doAnswer(invocation -> {
            Map<Integer, String> result = invocation.getArgument(2);
            result.put(12, "a");
            result.put(13, "b");
            result.put(14, "c");
            result.put(15, "d");
            return null;
        }).when(tagMetadata).collectTagValues(eq(5), any(), any());

        Metadata statement = Metadata.showTagValues(ns, "cpu", "host", "", new EqualsExpr("host", "a"), 2);
        List<String> result = new StorageMetadataExecutor(database, statement, List.of(1),
                new RequestContext("r", 5_000)).execute();
        assertEquals(2, result.size());
        for (String value : result) {
            assertTrue(Set.of("a", "b", "c", "d").contains(value));
        }
    }

    @Test
    public void testIndexReadFailure() throws Exception {
        TSDBDatabase database = mock(TSDBDatabase.class);
        MetadataDatabase metadata = mock(MetadataDatabase.class);
        when(database.metadataDatabase()).thenReturn(metadata);
        when(metadata.suggestNamespace(anyString(), anyInt())).thenThrow(new IOException("corrupt block"));
        QueryException e = assertThrows(QueryException.class, () -> new StorageMetadataExecutor(database,
                Metadata.showNamespaces("", 10), List.of(1), new RequestContext("r", 5_000)).execute());
        assertEquals(ErrorKind.EXECUTION, e.getKind());
        assertEquals("index read error: corrupt block", e.getMessage());
    }
}
