package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

import java.util.Objects;

/**
 * 데이터베이스 스키마 이름.
 */
public record Schema(String name) implements SqlFragment, Comparable<Schema> {

    public Schema {
        Objects.requireNonNull(name, "name");
    }

    public static Schema of(CharSequence name) {
        return new Schema(name.toString());
    }

    public static Schema of(SqlObject object) {
        return new Schema(object.name());
    }

    public String asString() {
        return name;
    }

    public QuotedData asQuotedData() {
        return new QuotedData(name);
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        return quoting.append(sb, name);
    }

    @Override
    public int compareTo(Schema other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return render();
    }
}
