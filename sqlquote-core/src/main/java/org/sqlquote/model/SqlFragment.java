package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

/**
 * 이스케이프된 SQL 조각으로 출력될 수 있는 값.
 * <p>
 * 구현체의 {@code toString()} 은 {@code render(IdentifierQuoting.AS_NEEDED)} 와 같은 결과를 반환하므로
 * 문자열 연결이나 {@link String#format} 에 바로 넣을 수 있습니다.
 */
public interface SqlFragment {

    StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting);

    default String render(IdentifierQuoting quoting) {
        return appendTo(new StringBuilder(), quoting).toString();
    }

    default String render() {
        return render(IdentifierQuoting.AS_NEEDED);
    }
}
