package org.sqlquote.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sqlquote.escape.IdentifierQuoting;

import static org.assertj.core.api.Assertions.*;

class SqlFragmentRenderingTest {

    @Test
    @DisplayName("래퍼를 문자열 템플릿에 그대로 넣어 SELECT 문을 만든다")
    void buildSelect() {
        String sql = String.format("SELECT %s FROM %s WHERE %s = %s",
                Column.of("foo bar"),
                SchemaTable.of("foo", "baz").withPostfix("_quix"),
                Column.of("blah"),
                QuotedData.of("hello 'world' foo"));

        assertThat(sql).isEqualTo("SELECT \"foo bar\" FROM foo.baz_quix WHERE blah = 'hello ''world'' foo'");
    }

    @Test
    @DisplayName("기본 시나리오")
    void basicScenarios() {
        assertThat(Column.of("foo bar")).hasToString("\"foo bar\"");
        assertThat(QuotedData.of("hello 'world' foo")).hasToString("'hello ''world'' foo'");
        assertThat(SchemaTable.of("foo", "baz")).hasToString("foo.baz");
        assertThat(Column.of("a\"b")).hasToString("\"a\"\"b\"");
        assertThat(QuotedData.of("")).hasToString("''");
        assertThat(Column.of("")).hasToString("\"\"");
    }

    @Test
    @DisplayName("ALWAYS 정책에서는 모든 식별자가 큰따옴표로 감싸진다")
    void alwaysQuoting() {
        assertThat(Column.of("blah").render(IdentifierQuoting.ALWAYS)).isEqualTo("\"blah\"");
        assertThat(Table.of("orders").render(IdentifierQuoting.ALWAYS)).isEqualTo("\"orders\"");
        assertThat(Schema.of("public").render(IdentifierQuoting.ALWAYS)).isEqualTo("\"public\"");
        assertThat(SchemaTable.of("foo", "baz").render(IdentifierQuoting.ALWAYS)).isEqualTo("\"foo\".\"baz\"");
    }

    @Test
    @DisplayName("QuotedData 는 식별자 정책과 무관하다")
    void quotedDataIgnoresIdentifierPolicy() {
        QuotedData data = QuotedData.of("it's");

        assertThat(data.render(IdentifierQuoting.ALWAYS)).isEqualTo("'it''s'");
        assertThat(data.render(IdentifierQuoting.AS_NEEDED)).isEqualTo("'it''s'");
    }

    @Test
    @DisplayName("render() 와 toString() 은 같은 결과")
    void renderMatchesToString() {
        SqlFragment[] fragments = {
                SqlObject.of("x y"), Schema.of("s"), Table.of("t"), Column.of("c"),
                SchemaTable.of("s", "t t"), ObjectConcat.of("a", "b"), QuotedData.of("q")
        };
        for (SqlFragment fragment : fragments) {
            assertThat(fragment.render()).isEqualTo(fragment.toString());
        }
    }

    @Test
    @DisplayName("appendTo 는 주어진 버퍼에 이어 쓴다")
    void appendToWritesIntoBuffer() {
        StringBuilder sb = new StringBuilder("INSERT INTO ");
        Table.of("my table").appendTo(sb, IdentifierQuoting.AS_NEEDED).append(" VALUES (");
        QuotedData.of("x").appendTo(sb, IdentifierQuoting.AS_NEEDED).append(')');

        assertThat(sb).hasToString("INSERT INTO \"my table\" VALUES ('x')");
    }
}
