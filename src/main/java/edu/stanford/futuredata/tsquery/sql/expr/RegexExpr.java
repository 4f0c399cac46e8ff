package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.Objects;
import java.util.regex.Pattern;

public final class RegexExpr implements TagFilter {

    public final String key;
    public final String regexp;
    private transient Pattern compiled;

    public RegexExpr(String key, String regexp) {
        this.key = Objects.requireNonNull(key);
        this.regexp = Objects.requireNonNull(regexp);
    }

    @Override
    public String getTagKey() {
        return key;
    }

    @Override
    public boolean matches(String tagValue) {
        if (compiled == null) {
            compiled = Pattern.compile(regexp);
        }
        return compiled.matcher(tagValue).find();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegexExpr)) return false;
        RegexExpr that = (RegexExpr) o;
        return key.equals(that.key) && regexp.equals(that.regexp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, regexp);
    }

    @Override
    public String toString() {
        return key + "=~/" + regexp + "/";
    }
}
