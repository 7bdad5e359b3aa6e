package org.sqlquote.dialect.monetdb;

import org.sqlquote.dialect.DatabaseType;
import org.sqlquote.dialect.Dialect;
import org.sqlquote.dialect.SqlTypeMapper;

public final class MonetDbDialect implements Dialect {

    public static final MonetDbDialect INSTANCE = new MonetDbDialect();

    private final SqlTypeMapper typeMapper = new MonetDbTypeMapper();

    private MonetDbDialect() {}

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MONETDB;
    }

    @Override
    public SqlTypeMapper getSqlTypeMapper() {
        return typeMapper;
    }

    @Override
    public String toString() {
        return "MonetDbDialect";
    }
}
