package edu.stanford.futuredata.tsquery.sql;

import java.io.Serializable;

/** A parsed statement. Parsing happens outside this module. */
public interface Statement extends Serializable {
}
