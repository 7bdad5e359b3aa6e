package org.sqlquote.dialect;

import lombok.Getter;

import java.util.List;
import java.util.Locale;

@Getter
public enum DatabaseType {
    SQL_SERVER("sqlserver", List.of("mssql", "sql_server")),
    MONETDB("monetdb", List.of("monet"));

    private final String id;
    private final List<String> aliases;

    DatabaseType(String id, List<String> aliases) {
        this.id = id;
        this.aliases = aliases;
    }

    public boolean matches(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return id.equals(normalized) || aliases.contains(normalized);
    }
}
