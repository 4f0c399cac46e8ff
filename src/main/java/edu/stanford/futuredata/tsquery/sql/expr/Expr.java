package edu.stanford.futuredata.tsquery.sql.expr;

import java.io.Serializable;

/** Node of a tag filter expression tree. */
public interface Expr extends Serializable {
}
