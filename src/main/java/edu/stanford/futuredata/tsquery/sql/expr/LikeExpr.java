package edu.stanford.futuredata.tsquery.sql.expr;

import java.util.Objects;
import java.util.regex.Pattern;

/** {@code key like 'pattern'} where {@code *} matches any run of characters. */
public final class LikeExpr implements TagFilter {

    public final String key;
    public final String value;
    private transient Pattern compiled;

    public LikeExpr(String key, String value) {
        this.key = Objects.requireNonNull(key);
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public String getTagKey() {
        return key;
    }

    @Override
    public boolean matches(String tagValue) {
        if (compiled == null) {
            StringBuilder regex = new StringBuilder();
            for (String part : value.split("\\*", -1)) {
                if (regex.length() > 0) {
                    regex.append(".*");
                }
                regex.append(Pattern.quote(part));
            }
            compiled = Pattern.compile(regex.toString());
        }
        return compiled.matcher(tagValue).matches();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LikeExpr)) return false;
        LikeExpr that = (LikeExpr) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + " like " + value;
    }
}
