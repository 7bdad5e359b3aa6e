package org.sqlquote.dialect;

import java.util.Optional;

public interface SqlTypeMapper {
    /**
     * Java 타입에 대응하는 SQL 타입 이름. 지원하지 않는 타입이면 empty.
     */
    Optional<String> map(Class<?> javaType);
}
