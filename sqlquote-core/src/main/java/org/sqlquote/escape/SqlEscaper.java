package org.sqlquote.escape;

import java.util.Objects;

/**
 * 식별자와 문자열 리터럴을 ANSI SQL 규칙으로 이스케이프합니다.
 * <p>
 * 두 알고리즘 모두 모든 입력에 대해 정의되어 있으며 예외를 던지지 않습니다.
 * 포함된 따옴표는 백슬래시가 아니라 두 번 반복해서 이스케이프합니다.
 * <ul>
 *   <li>식별자: {@code a"b} → {@code "a""b"}</li>
 *   <li>리터럴: {@code O'Brien} → {@code 'O''Brien'}</li>
 * </ul>
 */
public final class SqlEscaper {

    public static final char IDENTIFIER_QUOTE = '"';
    public static final char LITERAL_QUOTE = '\'';

    private SqlEscaper() {}

    /**
     * 큰따옴표로 감싼 식별자를 반환합니다. 빈 문자열은 {@code ""} 가 됩니다.
     */
    public static String quoteIdentifier(String raw) {
        return appendQuoted(new StringBuilder(raw.length() + 2), raw, IDENTIFIER_QUOTE).toString();
    }

    /**
     * 작은따옴표로 감싼 문자열 리터럴을 반환합니다. 빈 문자열은 {@code ''} 가 됩니다.
     */
    public static String quoteLiteral(String raw) {
        return appendQuoted(new StringBuilder(raw.length() + 2), raw, LITERAL_QUOTE).toString();
    }

    public static StringBuilder appendIdentifier(StringBuilder sb, String raw) {
        return appendQuoted(sb, raw, IDENTIFIER_QUOTE);
    }

    public static StringBuilder appendLiteral(StringBuilder sb, String raw) {
        return appendQuoted(sb, raw, LITERAL_QUOTE);
    }

    /**
     * 따옴표 없이 출력해도 안전한 식별자인지 확인합니다.
     * <p>
     * 조건: 비어 있지 않고, {@code [A-Za-z_][A-Za-z0-9_]*} 형태이며, 예약어가 아닐 것.
     * <p>
     * 대소문자는 보존하지 않습니다. 따옴표 없는 이름은 DB 가 대문자(ANSI, Oracle) 또는 소문자(PostgreSQL)로
     * 접으므로 {@code Users} 와 {@code "Users"} 는 서로 다른 객체를 가리킬 수 있습니다.
     * 대소문자가 중요한 이름에는 {@link IdentifierQuoting#ALWAYS} 를 사용하세요.
     */
    public static boolean isPlainIdentifier(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.isEmpty()) return false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
            boolean digit = c >= '0' && c <= '9';
            if (!letter && !(digit && i > 0)) {
                return false;
            }
        }
        return !SqlKeywords.isReserved(raw);
    }

    private static StringBuilder appendQuoted(StringBuilder sb, String raw, char quote) {
        Objects.requireNonNull(raw, "raw");
        sb.append(quote);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == quote) {
                sb.append(quote);
            }
            sb.append(c);
        }
        return sb.append(quote);
    }
}
