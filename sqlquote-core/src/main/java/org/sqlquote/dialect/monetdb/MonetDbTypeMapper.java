package org.sqlquote.dialect.monetdb;

import org.sqlquote.dialect.SqlTypeMapper;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * MonetDB 타입 매핑. float 은 매핑하지 않습니다 (REAL 정밀도 차이).
 */
class MonetDbTypeMapper implements SqlTypeMapper {

    private static final Map<Class<?>, String> TYPE_MAP = Map.ofEntries(
            entry(Boolean.class, "BOOLEAN"),
            entry(Byte.class, "TINYINT"),
            entry(Short.class, "SMALLINT"),
            entry(Integer.class, "INT"),
            entry(Long.class, "BIGINT"),
            entry(Double.class, "DOUBLE"),
            entry(String.class, "STRING"),
            entry(boolean.class, "BOOLEAN"),
            entry(byte.class, "TINYINT"),
            entry(short.class, "SMALLINT"),
            entry(int.class, "INT"),
            entry(long.class, "BIGINT"),
            entry(double.class, "DOUBLE")
    );

    @Override
    public Optional<String> map(Class<?> javaType) {
        return Optional.ofNullable(TYPE_MAP.get(javaType));
    }
}
