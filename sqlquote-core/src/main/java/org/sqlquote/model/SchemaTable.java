package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

import java.util.Comparator;
import java.util.Objects;

/**
 * 스키마로 한정된 테이블 이름. {@code <schema>.<table>} 로 출력되며 두 부분은 각각 따로 이스케이프됩니다.
 */
public record SchemaTable(Schema schema, Table table) implements SqlFragment, Comparable<SchemaTable> {

    private static final Comparator<SchemaTable> ORDER =
            Comparator.comparing(SchemaTable::schema).thenComparing(SchemaTable::table);

    public SchemaTable {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(table, "table");
    }

    public static SchemaTable of(CharSequence schema, CharSequence table) {
        return new SchemaTable(Schema.of(schema), Table.of(table));
    }

    /**
     * 테이블 부분에만 접미사를 붙입니다. 스키마는 그대로 유지됩니다.
     */
    public SchemaTable withPostfix(String postfix) {
        return new SchemaTable(schema, new Table(table.name() + postfix));
    }

    public SchemaTable withPostfix(String postfix, String separator) {
        return new SchemaTable(schema, new Table(table.name() + separator + postfix));
    }

    /** {@code schema.table} 원문을 문자열 리터럴로 */
    public QuotedData asQuotedData() {
        return new QuotedData(schema.name() + "." + table.name());
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        schema.appendTo(sb, quoting).append('.');
        return table.appendTo(sb, quoting);
    }

    @Override
    public int compareTo(SchemaTable other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return render();
    }
}
