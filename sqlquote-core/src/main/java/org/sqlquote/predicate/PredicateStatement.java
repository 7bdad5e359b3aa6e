package org.sqlquote.predicate;

import java.util.List;
import java.util.Objects;

/**
 * 조건 목록이 붙은 SQL 절. 예: {@code WHERE a = 1\nAND b = 2}
 * <p>
 * 조건이 없으면 빈 문자열로 출력됩니다.
 */
public record PredicateStatement(String keyword, List<String> predicates) {

    public static final String WHERE = "WHERE";

    static final String SEPARATOR = "\nAND ";

    public PredicateStatement {
        Objects.requireNonNull(keyword, "keyword");
        predicates = List.copyOf(predicates);
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    @Override
    public String toString() {
        if (predicates.isEmpty()) {
            return "";
        }
        return keyword + " " + String.join(SEPARATOR, predicates);
    }
}
