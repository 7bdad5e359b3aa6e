package org.sqlquote.dialect.sqlserver;

import org.sqlquote.dialect.DatabaseType;
import org.sqlquote.dialect.Dialect;
import org.sqlquote.dialect.SqlTypeMapper;

public final class SqlServerDialect implements Dialect {

    public static final SqlServerDialect INSTANCE = new SqlServerDialect();

    private final SqlTypeMapper typeMapper = new SqlServerTypeMapper();

    private SqlServerDialect() {}

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.SQL_SERVER;
    }

    @Override
    public SqlTypeMapper getSqlTypeMapper() {
        return typeMapper;
    }

    @Override
    public String toString() {
        return "SqlServerDialect";
    }
}
