package org.sqlquote.escape;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class SqlEscaperTest {

    private static final String[] SAMPLES = {
            "", "foo", "foo bar", "a\"b", "\"", "\"\"", "'", "''", "it's", "a\u0000b",
            "tab\there", "line\nbreak", "back\\slash", "한글 컬럼", "'; DROP TABLE users; --",
            "\"; DROP TABLE users; --", "x'y\"z"
    };

    private static long count(String s, char c) {
        return s.chars().filter(ch -> ch == c).count();
    }

    /**
     * ANSI 문법으로 sql 의 start 위치부터 작은따옴표 리터럴 하나를 읽는다.
     * 반환값: [리터럴 값, 리터럴 뒤에 남은 문자열]
     */
    private static String[] parseLiteral(String sql, int start) {
        assertThat(sql.charAt(start)).isEqualTo('\'');
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (true) {
            char c = sql.charAt(i);
            if (c == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    value.append('\'');
                    i += 2;
                    continue;
                }
                return new String[]{value.toString(), sql.substring(i + 1)};
            }
            value.append(c);
            i++;
        }
    }

    @Nested @DisplayName("quoteIdentifier()")
    class QuoteIdentifier {

        @Test @DisplayName("큰따옴표로 감싼다")
        void wrapsWithDoubleQuotes() {
            assertThat(SqlEscaper.quoteIdentifier("foo bar")).isEqualTo("\"foo bar\"");
        }

        @Test @DisplayName("내부 큰따옴표는 두 번으로 Escape")
        void doublesEmbeddedQuotes() {
            assertThat(SqlEscaper.quoteIdentifier("a\"b")).isEqualTo("\"a\"\"b\"");
            assertThat(SqlEscaper.quoteIdentifier("\"")).isEqualTo("\"\"\"\"");
        }

        @Test @DisplayName("빈 문자열은 \"\"")
        void emptyString() {
            assertThat(SqlEscaper.quoteIdentifier("")).isEqualTo("\"\"");
        }

        @Test @DisplayName("작은따옴표와 백슬래시는 건드리지 않는다")
        void leavesOtherCharactersAlone() {
            assertThat(SqlEscaper.quoteIdentifier("it's\\")).isEqualTo("\"it's\\\"");
        }

        @Test @DisplayName("모든 입력에 대해 양끝이 큰따옴표이고 내부 큰따옴표 수는 원본의 두 배")
        void quoteCountProperty() {
            for (String s : SAMPLES) {
                String quoted = SqlEscaper.quoteIdentifier(s);
                assertThat(quoted).startsWith("\"").endsWith("\"");
                String inner = quoted.substring(1, quoted.length() - 1);
                assertThat(count(inner, '"')).as(s).isEqualTo(2 * count(s, '"'));
                assertThat(inner.replace("\"\"", "\"")).isEqualTo(s);
            }
        }
    }

    @Nested @DisplayName("quoteLiteral()")
    class QuoteLiteral {

        @Test @DisplayName("작은따옴표는 두 번으로 Escape")
        void doublesSingleQuotes() {
            assertThat(SqlEscaper.quoteLiteral("hello 'world' foo")).isEqualTo("'hello ''world'' foo'");
        }

        @Test @DisplayName("빈 문자열은 ''")
        void emptyString() {
            assertThat(SqlEscaper.quoteLiteral("")).isEqualTo("''");
        }

        @Test @DisplayName("백슬래시는 그대로 둔다")
        void backslashIsNotEscaped() {
            assertThat(SqlEscaper.quoteLiteral("C:\\temp")).isEqualTo("'C:\\temp'");
        }

        @Test @DisplayName("숫자 문자열도 따옴표로 감싼다")
        void numericStringIsStillQuoted() {
            assertThat(SqlEscaper.quoteLiteral("12345")).isEqualTo("'12345'");
            assertThat(SqlEscaper.quoteLiteral("NULL")).isEqualTo("'NULL'");
        }

        @Test @DisplayName("모든 입력에 대해 양끝이 작은따옴표이고 내부 작은따옴표 수는 원본의 두 배")
        void quoteCountProperty() {
            for (String s : SAMPLES) {
                String quoted = SqlEscaper.quoteLiteral(s);
                assertThat(quoted).startsWith("'").endsWith("'");
                String inner = quoted.substring(1, quoted.length() - 1);
                assertThat(count(inner, '\'')).as(s).isEqualTo(2 * count(s, '\''));
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"x' OR '1'='1", "'", "''", "'; DELETE FROM t; --", "a''b'", "plain"})
        @DisplayName("쿼리에 삽입된 리터럴을 다시 파싱하면 원본 값이 복원되고 뒤따르는 SQL 은 그대로")
        void injectionPayloadIsContained(String payload) {
            String sql = "SELECT * FROM t WHERE name = " + SqlEscaper.quoteLiteral(payload) + " AND id = 1";

            String[] parsed = parseLiteral(sql, sql.indexOf('\''));

            assertThat(parsed[0]).isEqualTo(payload);
            assertThat(parsed[1]).isEqualTo(" AND id = 1");
        }
    }

    @Nested @DisplayName("isPlainIdentifier()")
    class IsPlainIdentifier {

        @ParameterizedTest
        @ValueSource(strings = {"foo", "_bar", "baz_quix", "Users", "col1"})
        @DisplayName("영문자/숫자/밑줄로만 된 비예약어는 단순 식별자")
        void plain(String raw) {
            assertThat(SqlEscaper.isPlainIdentifier(raw)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "foo bar", "1col", "a-b", "a.b", "a\"b", "select", "Order", "é"})
        @DisplayName("그 외는 따옴표가 필요하다")
        void notPlain(String raw) {
            assertThat(SqlEscaper.isPlainIdentifier(raw)).isFalse();
        }
    }

    @Test @DisplayName("append 계열은 기존 버퍼 뒤에 이어 쓴다")
    void appendVariantsWriteIntoBuffer() {
        StringBuilder sb = new StringBuilder("x = ");
        SqlEscaper.appendIdentifier(sb, "a\"b").append(" || ");
        SqlEscaper.appendLiteral(sb, "it's");

        assertThat(sb).hasToString("x = \"a\"\"b\" || 'it''s'");
    }

    @Test @DisplayName("null 은 허용하지 않는다")
    void nullIsRejected() {
        assertThatNullPointerException().isThrownBy(() -> SqlEscaper.quoteIdentifier(null));
        assertThatNullPointerException().isThrownBy(() -> SqlEscaper.quoteLiteral(null));
    }
}
