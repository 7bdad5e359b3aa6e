package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

import java.util.Objects;

/**
 * 테이블, 스키마, 컬럼 등 이름 하나로 표현되는 SQL 객체.
 */
public record SqlObject(String name) implements SqlFragment, Comparable<SqlObject> {

    public SqlObject {
        Objects.requireNonNull(name, "name");
    }

    public static SqlObject of(CharSequence name) {
        return new SqlObject(name.toString());
    }

    /** 원본 값 */
    public String asString() {
        return name;
    }

    /** 이름을 문자열 리터럴로 사용 (예: information_schema 조회) */
    public QuotedData asQuotedData() {
        return new QuotedData(name);
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        return quoting.append(sb, name);
    }

    @Override
    public int compareTo(SqlObject other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return render();
    }
}
