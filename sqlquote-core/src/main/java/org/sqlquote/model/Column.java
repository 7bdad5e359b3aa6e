package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

import java.util.Objects;

/**
 * 테이블 컬럼 이름.
 */
public record Column(String name) implements SqlFragment, Comparable<Column> {

    public Column {
        Objects.requireNonNull(name, "name");
    }

    public static Column of(CharSequence name) {
        return new Column(name.toString());
    }

    public static Column of(SqlObject object) {
        return new Column(object.name());
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
    public int compareTo(Column other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return render();
    }
}
