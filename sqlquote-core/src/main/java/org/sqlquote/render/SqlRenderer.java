package org.sqlquote.render;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlquote.dialect.Dialect;
import org.sqlquote.dialect.Dialects;
import org.sqlquote.escape.IdentifierQuoting;
import org.sqlquote.model.ColumnType;
import org.sqlquote.model.SqlFragment;
import org.sqlquote.options.SqlQuoteOptions;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code {}} 자리표시자가 있는 템플릿에 SQL 조각을 채워 넣습니다.
 * <pre>{@code
 * renderer.format("SELECT {} FROM {} WHERE {} = {}",
 *         Column.of("foo bar"), SchemaTable.of("foo", "baz"), Column.of("blah"), QuotedData.of("it's"));
 * // SELECT "foo bar" FROM foo.baz WHERE blah = 'it''s'
 * }</pre>
 * {@link SqlFragment} 인자는 설정된 {@link IdentifierQuoting} 으로, 그 외 인자는 {@link String#valueOf(Object)} 로 출력됩니다.
 * 불변 객체이며 여러 스레드에서 공유할 수 있습니다.
 */
@Getter
public final class SqlRenderer {

    private static final Logger log = LoggerFactory.getLogger(SqlRenderer.class);

    static final String PLACEHOLDER = "{}";

    private final IdentifierQuoting quoting;
    private final Optional<Dialect> dialect;

    public SqlRenderer(IdentifierQuoting quoting) {
        this(quoting, null);
    }

    public SqlRenderer(IdentifierQuoting quoting, Dialect dialect) {
        this.quoting = Objects.requireNonNull(quoting, "quoting");
        this.dialect = Optional.ofNullable(dialect);
    }

    public static SqlRenderer defaults() {
        return new SqlRenderer(IdentifierQuoting.AS_NEEDED);
    }

    /**
     * {@link org.sqlquote.config.ConfigurationLoader} 가 반환한 설정 맵으로 생성합니다.
     * 알 수 없는 정책이나 방언 이름은 경고를 남기고 기본값(AS_NEEDED, 방언 없음)으로 대체합니다.
     */
    public static SqlRenderer fromConfiguration(Map<String, String> config) {
        return new SqlRenderer(
                resolveQuoting(config.get(SqlQuoteOptions.Identifiers.QUOTING_KEY)),
                resolveDialect(config.get(SqlQuoteOptions.Dialect.KEY)));
    }

    private static IdentifierQuoting resolveQuoting(String name) {
        if (name == null || name.isBlank()) {
            return IdentifierQuoting.fromName(SqlQuoteOptions.Identifiers.QUOTING_DEFAULT);
        }
        try {
            return IdentifierQuoting.fromName(name);
        } catch (IllegalArgumentException e) {
            log.warn("{}. Falling back to {}.", e.getMessage(), SqlQuoteOptions.Identifiers.QUOTING_DEFAULT);
            return IdentifierQuoting.fromName(SqlQuoteOptions.Identifiers.QUOTING_DEFAULT);
        }
    }

    private static Dialect resolveDialect(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return Dialects.forName(name);
        } catch (IllegalArgumentException e) {
            log.warn("{}. No dialect will be used.", e.getMessage());
            return null;
        }
    }

    public String render(SqlFragment fragment) {
        return fragment.render(quoting);
    }

    /**
     * 템플릿의 {@code {}} 를 왼쪽부터 차례대로 인자로 치환합니다.
     *
     * @throws IllegalArgumentException 자리표시자 수와 인자 수가 다를 때
     */
    public String format(String pattern, Object... args) {
        Objects.requireNonNull(pattern, "pattern");
        StringBuilder sb = new StringBuilder(pattern.length() + 16 * args.length);
        int from = 0;
        int argIndex = 0;
        int at;
        while ((at = pattern.indexOf(PLACEHOLDER, from)) >= 0) {
            if (argIndex >= args.length) {
                throw new IllegalArgumentException(
                        "Too few arguments for pattern: " + args.length + " given, more placeholders remain");
            }
            sb.append(pattern, from, at);
            appendArgument(sb, args[argIndex++]);
            from = at + PLACEHOLDER.length();
        }
        if (argIndex != args.length) {
            throw new IllegalArgumentException(
                    "Too many arguments for pattern: " + args.length + " given, " + argIndex + " placeholders");
        }
        return sb.append(pattern, from, pattern.length()).toString();
    }

    /**
     * 설정된 방언으로 Java 타입의 컬럼 타입을 구합니다.
     *
     * @throws IllegalStateException 방언이 설정되지 않았을 때
     */
    public ColumnType<Dialect> columnType(Class<?> javaType) {
        Dialect d = dialect.orElseThrow(() -> new IllegalStateException("No dialect configured"));
        return ColumnType.of(d, javaType);
    }

    private void appendArgument(StringBuilder sb, Object arg) {
        if (arg instanceof SqlFragment fragment) {
            fragment.appendTo(sb, quoting);
        } else {
            sb.append(arg);
        }
    }
}
