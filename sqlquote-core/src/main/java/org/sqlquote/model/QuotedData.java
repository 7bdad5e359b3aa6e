package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;
import org.sqlquote.escape.SqlEscaper;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * 작은따옴표로 감싸 출력되는 문자열 데이터.
 * <p>
 * 항상 문자열 리터럴이 되며 NULL 이나 숫자 리터럴로 출력되지 않습니다.
 * 백슬래시는 특별히 처리하지 않습니다.
 */
public record QuotedData(String value) implements SqlFragment, Comparable<QuotedData> {

    public QuotedData {
        Objects.requireNonNull(value, "value");
    }

    public static QuotedData of(CharSequence value) {
        return new QuotedData(value.toString());
    }

    /**
     * 원본 값을 변환한 새 QuotedData. 변환 결과도 이스케이프 대상입니다.
     */
    public QuotedData map(UnaryOperator<String> mapper) {
        return new QuotedData(mapper.apply(value));
    }

    public String asString() {
        return value;
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        return SqlEscaper.appendLiteral(sb, value);
    }

    @Override
    public int compareTo(QuotedData other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return render();
    }
}
