package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.Objects;

public final class ParenExpr implements Expr {

    public final Expr expr;

    public ParenExpr(Expr expr) {
        this.expr = Objects.requireNonNull(expr);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParenExpr && expr.equals(((ParenExpr) o).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash("paren", expr);
    }

    @Override
    public String toString() {
        return "(" + expr + ")";
    }
}
