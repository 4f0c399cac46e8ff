package edu.stanford.futuredata.tsquery.sql.expr;

/** A leaf predicate over the values of one tag key. */
public interface TagFilter extends Expr {

    String getTagKey();

    /** Whether the given tag value satisfies this predicate. */
    boolean matches(String tagValue);
}
