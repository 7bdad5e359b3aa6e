package org.sqlquote.dialect;

/**
 * SQL 데이터베이스 방언. 구체 타입은 {@link org.sqlquote.model.ColumnType} 의 타입 인자로 쓰여
 * 컬럼 타입이 어느 방언용인지 컴파일 시점에 구분합니다.
 */
public interface Dialect {
    DatabaseType getDatabaseType();
    SqlTypeMapper getSqlTypeMapper();

    default String name() {
        return getDatabaseType().getId();
    }
}
