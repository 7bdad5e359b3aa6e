package org.sqlquote.model;

import org.sqlquote.dialect.Dialect;
import org.sqlquote.escape.IdentifierQuoting;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 특정 방언의 컬럼 타입 이름 ({@code BIGINT}, {@code NVARCHAR(MAX)}, {@code DOUBLE PRECISION}, {@code TIMESTAMP(3) WITH TIME ZONE} ...).
 * <p>
 * 타입 이름은 대부분 예약어이므로 식별자처럼 따옴표로 감싸지 않고 그대로 출력합니다.
 * 대신 생성 시점에 형식을 검사합니다.
 *
 * @param <D> 타입이 속한 방언
 */
public record ColumnType<D extends Dialect>(String name) implements SqlFragment {

    private static final String WORDS = "[A-Za-z][A-Za-z0-9_]*( [A-Za-z][A-Za-z0-9_]*)*";

    // 단어들, 선택적 크기 인자 (숫자 또는 MAX), 선택적 후행 단어들: TIMESTAMP(3) WITH TIME ZONE
    private static final Pattern TYPE_NAME = Pattern.compile(
            WORDS + "( ?\\((\\d+(, ?\\d+)?|(?i:MAX))\\))?( " + WORDS + ")?");

    public ColumnType {
        Objects.requireNonNull(name, "name");
        if (!TYPE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL type name: '" + name + "'");
        }
    }

    public static <D extends Dialect> ColumnType<D> of(String name) {
        return new ColumnType<>(name);
    }

    /**
     * 방언의 타입 매퍼로 Java 타입을 SQL 타입으로 변환합니다.
     *
     * @throws IllegalArgumentException 방언이 해당 Java 타입을 지원하지 않을 때
     */
    public static <D extends Dialect> ColumnType<D> of(D dialect, Class<?> javaType) {
        return dialect.getSqlTypeMapper().map(javaType)
                .map(name -> new ColumnType<D>(name))
                .orElseThrow(() -> new IllegalArgumentException(
                        dialect.name() + " has no SQL type for " + javaType.getName()));
    }

    public String asString() {
        return name;
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        return sb.append(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
