package org.sqlquote.dialect.sqlserver;

import org.sqlquote.dialect.SqlTypeMapper;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

class SqlServerTypeMapper implements SqlTypeMapper {

    private static final Map<Class<?>, String> TYPE_MAP = Map.ofEntries(
            // Boxed types
            entry(Boolean.class, "BIT"),
            entry(Byte.class, "TINYINT"),
            entry(Short.class, "SMALLINT"),
            entry(Integer.class, "INT"),
            entry(Long.class, "BIGINT"),
            entry(Float.class, "REAL"),
            entry(Double.class, "FLOAT"),
            entry(String.class, "NVARCHAR"),
            // Primitive types
            entry(boolean.class, "BIT"),
            entry(byte.class, "TINYINT"),
            entry(short.class, "SMALLINT"),
            entry(int.class, "INT"),
            entry(long.class, "BIGINT"),
            entry(float.class, "REAL"),
            entry(double.class, "FLOAT")
    );

    @Override
    public Optional<String> map(Class<?> javaType) {
        return Optional.ofNullable(TYPE_MAP.get(javaType));
    }
}
