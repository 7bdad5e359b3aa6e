package org.sqlquote.escape;

import java.util.Locale;

/**
 * 식별자를 언제 큰따옴표로 감쌀지 결정하는 정책.
 */
public enum IdentifierQuoting {

    /** 항상 감싼다. {@code foo} → {@code "foo"} */
    ALWAYS {
        @Override
        public StringBuilder append(StringBuilder sb, String raw) {
            return SqlEscaper.appendIdentifier(sb, raw);
        }
    },

    /**
     * 예약어나 특수문자가 없는 단순 식별자는 그대로 둔다. {@code foo} → {@code foo}, {@code foo bar} → {@code "foo bar"}
     * <p>
     * 그대로 출력된 이름은 DB 에서 대소문자가 접히므로 대소문자를 보존하지 않는다.
     */
    AS_NEEDED {
        @Override
        public StringBuilder append(StringBuilder sb, String raw) {
            return SqlEscaper.isPlainIdentifier(raw) ? sb.append(raw) : SqlEscaper.appendIdentifier(sb, raw);
        }
    };

    public abstract StringBuilder append(StringBuilder sb, String raw);

    public String quote(String raw) {
        return append(new StringBuilder(raw.length() + 2), raw).toString();
    }

    public static IdentifierQuoting fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Identifier quoting must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (IdentifierQuoting quoting : values()) {
            if (quoting.name().equals(normalized)) {
                return quoting;
            }
        }
        throw new IllegalArgumentException("Unknown identifier quoting: " + name);
    }
}
