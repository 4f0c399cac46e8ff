package edu.stanford.futuredata.tsquery.broker;

import edu.stanford.futuredata.tsquery.series.TimeSeriesEvent;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.MetadataType;
import edu.stanford.futuredata.tsquery.sql.Query;
import edu.stanford.futuredata.tsquery.sql.Statement;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** What {@code GET /query?db=...&sql=...} returns for an already parsed statement. */
public class QueryAPI {
    private static final Logger logger = LoggerFactory.getLogger(QueryAPI.class);

    public static final int OK = 200;
    public static final int INTERNAL_ERROR = 500;

    public static final class Response {
        public final int status;
        public final String body;

        Response(int status, String body) {
            this.status = status;
            this.body = body;
        }

        @Override
        public String toString() {
            return status + " " + body;
        }
    }

    private final Broker broker;

    public QueryAPI(Broker broker) {
        this.broker = broker;
    }

    public Response query(String database, Statement statement) {
        try {
            if (statement instanceof Metadata) {
                Metadata metadata = (Metadata) statement;
                if (metadata.type != MetadataType.DATABASE) {
                    requireDatabase(database);
                }
                List<String> result = broker.metadataQuery(database, metadata).await();
                if (metadata.type == MetadataType.FIELD) {
                    return new Response(OK, result.isEmpty() ? "[]" : result.get(0));
                }
                return new Response(OK, Utilities.toJSON(result));
            } else if (statement instanceof Query) {
                requireDatabase(database);
                TimeSeriesEvent event = broker.dataQuery(database, (Query) statement).await();
                return new Response(OK, Utilities.toJSON(event));
            }
            throw QueryException.unsupportedStatement(String.valueOf(statement));
        } catch (QueryException e) {
            logger.warn("Query {} on {} failed: {}", statement, database, e.getMessage());
            return new Response(INTERNAL_ERROR, e.getMessage());
        }
    }

    private static void requireDatabase(String database) throws QueryException {
        if (database == null || database.isEmpty()) {
            throw QueryException.databaseNotFound("<empty>");
        }
    }
}
