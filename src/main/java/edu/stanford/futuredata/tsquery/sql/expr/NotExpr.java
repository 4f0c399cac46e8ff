package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.Objects;

public final class NotExpr implements Expr {

    public final Expr expr;

    public NotExpr(Expr expr) {
        this.expr = Objects.requireNonNull(expr);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NotExpr && expr.equals(((NotExpr) o).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash("not", expr);
    }

    @Override
    public String toString() {
        return "not " + expr;
    }
}
