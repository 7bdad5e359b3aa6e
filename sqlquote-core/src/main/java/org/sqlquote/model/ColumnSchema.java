package org.sqlquote.model;

import org.sqlquote.dialect.Dialect;
import org.sqlquote.escape.IdentifierQuoting;

import java.util.Objects;

/**
 * 컬럼 이름과 타입. {@code CREATE TABLE} 컬럼 정의에 쓰이며 {@code <column> <type>} 으로 출력됩니다.
 */
public record ColumnSchema<D extends Dialect>(Column column, ColumnType<D> columnType) implements SqlFragment {

    public ColumnSchema {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(columnType, "columnType");
    }

    public static <D extends Dialect> ColumnSchema<D> of(String column, ColumnType<D> columnType) {
        return new ColumnSchema<>(new Column(column), columnType);
    }

    public static <D extends Dialect> ColumnSchema<D> of(String column, D dialect, Class<?> javaType) {
        return new ColumnSchema<>(new Column(column), ColumnType.of(dialect, javaType));
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        column.appendTo(sb, quoting).append(' ');
        return columnType.appendTo(sb, quoting);
    }

    @Override
    public String toString() {
        return render();
    }
}
