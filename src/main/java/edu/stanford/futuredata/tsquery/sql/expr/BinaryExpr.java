package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.Objects;

public final class BinaryExpr implements Expr {

    public enum Operator { AND, OR }

    public final Expr left;
    public final Operator operator;
    public final Expr right;

    public BinaryExpr(Expr left, Operator operator, Expr right) {
        this.left = Objects.requireNonNull(left);
        this.operator = Objects.requireNonNull(operator);
        this.right = Objects.requireNonNull(right);
    }

    public static BinaryExpr and(Expr left, Expr right) {
        return new BinaryExpr(left, Operator.AND, right);
    }

    public static BinaryExpr or(Expr left, Expr right) {
        return new BinaryExpr(left, Operator.OR, right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryExpr)) return false;
        BinaryExpr that = (BinaryExpr) o;
        return left.equals(that.left) && operator == that.operator && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return left + " " + operator.name().toLowerCase() + " " + right;
    }
}
