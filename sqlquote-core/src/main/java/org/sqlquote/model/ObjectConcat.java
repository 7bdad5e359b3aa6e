package org.sqlquote.model;

import org.sqlquote.escape.IdentifierQuoting;

import java.util.List;
import java.util.Objects;

/**
 * 여러 문자열을 이어 붙여 하나의 식별자로 이스케이프합니다.
 * <p>
 * 예: {@code ["hello \"world\" foo", "_\"quix\""]} → {@code "hello ""world"" foo_""quix"""}
 */
public record ObjectConcat(List<String> parts) implements SqlFragment {

    public ObjectConcat {
        parts = List.copyOf(Objects.requireNonNull(parts, "parts"));
    }

    public static ObjectConcat of(String... parts) {
        return new ObjectConcat(List.of(parts));
    }

    public String asString() {
        return String.join("", parts);
    }

    public QuotedData asQuotedData() {
        return new QuotedData(asString());
    }

    @Override
    public StringBuilder appendTo(StringBuilder sb, IdentifierQuoting quoting) {
        return quoting.append(sb, asString());
    }

    @Override
    public String toString() {
        return render();
    }
}
