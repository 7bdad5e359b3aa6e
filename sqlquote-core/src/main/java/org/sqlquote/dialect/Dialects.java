package org.sqlquote.dialect;

import org.sqlquote.dialect.monetdb.MonetDbDialect;
import org.sqlquote.dialect.sqlserver.SqlServerDialect;

import java.util.Arrays;

/**
 * 이름으로 방언 인스턴스를 찾습니다. 대소문자는 구분하지 않습니다.
 */
public final class Dialects {

    private Dialects() {}

    public static Dialect forName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dialect name must not be blank");
        }
        DatabaseType type = Arrays.stream(DatabaseType.values())
                .filter(t -> t.matches(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported dialect: " + name));
        return forType(type);
    }

    public static Dialect forType(DatabaseType type) {
        return switch (type) {
            case SQL_SERVER -> SqlServerDialect.INSTANCE;
            case MONETDB -> MonetDbDialect.INSTANCE;
        };
    }
}
