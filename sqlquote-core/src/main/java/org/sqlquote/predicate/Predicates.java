package org.sqlquote.predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * AND 로 연결될 불리언 조건 모음.
 * <p>
 * 조건은 추가 시점에 {@link String#valueOf(Object)} 로 문자열화됩니다.
 * {@link org.sqlquote.model.SqlFragment} 는 이때 이스케이프된 형태가 됩니다.
 * 스레드 안전하지 않습니다.
 */
public class Predicates implements Iterable<String> {

    private final List<String> predicates = new ArrayList<>();

    public static Predicates of(Object predicate) {
        return new Predicates().and(predicate);
    }

    public static Predicates ofAll(Iterable<?> predicates) {
        return new Predicates().andAll(predicates);
    }

    public void add(Object predicate) {
        predicates.add(String.valueOf(Objects.requireNonNull(predicate, "predicate")));
    }

    public void addAll(Iterable<?> predicates) {
        // 자기 자신을 넘겨도 되도록 먼저 복사
        List<Object> snapshot = new ArrayList<>();
        predicates.forEach(snapshot::add);
        snapshot.forEach(this::add);
    }

    public Predicates and(Object predicate) {
        add(predicate);
        return this;
    }

    public Predicates andAll(Iterable<?> predicates) {
        addAll(predicates);
        return this;
    }

    public Predicates andAll(Object... predicates) {
        return andAll(List.of(predicates));
    }

    public PredicateStatement asWhere() {
        return new PredicateStatement(PredicateStatement.WHERE, List.copyOf(predicates));
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public int size() {
        return predicates.size();
    }

    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableList(predicates).iterator();
    }
}
