package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

import java.util.List;
import java.util.Objects;

/**
 * 테이블 이름.
 */
public record Table(String name) implements SqlFragment, Comparable<Table> {

    public Table {
        Objects.requireNonNull(name, "name");
    }

    public static Table of(CharSequence name) {
        return new Table(name.toString());
    }

    public static Table of(SqlObject object) {
        return new Table(object.name());
    }

    public SchemaTable withSchema(Schema schema) {
        return new SchemaTable(schema, this);
    }

    public SchemaTable withSchema(String schema) {
        return withSchema(new Schema(schema));
    }

    /**
     * 테이블 이름 뒤에 접미사를 붙인 식별자. 전체가 하나의 식별자로 이스케이프됩니다.
     * <p>
     * {@code orders} + {@code _archive} → {@code orders_archive}
     */
    public ObjectConcat withPostfix(String postfix) {
        return new ObjectConcat(List.of(name, postfix));
    }

    /**
     * {@code orders} + {@code 2024} (separator {@code _}) → {@code orders_2024}
     */
    public ObjectConcat withPostfix(String postfix, String separator) {
        return new ObjectConcat(List.of(name, separator, postfix));
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
    public int compareTo(Table other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return render();
    }
}
