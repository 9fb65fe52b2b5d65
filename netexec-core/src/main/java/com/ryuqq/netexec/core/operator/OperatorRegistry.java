package com.ryuqq.netexec.core.operator;

import com.ryuqq.netexec.core.model.OperatorDefinition;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Operator 타입 레지스트리.
 *
 * <p>전역(static) 레지스트리 대신 명시적으로 생성해 net 구성에 전달하는 객체입니다.
 * 테스트마다 독립적인 레지스트리를 사용할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperatorRegistry registry = new OperatorRegistry()
 *     .register("Sleep", SleepOperator::new);
 * Operator op = registry.create(definition);
 * </pre>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class OperatorRegistry {

    private final ConcurrentMap<String, OperatorFactory> factories = new ConcurrentHashMap<>();

    /**
     * 타입 등록.
     *
     * @param type Operator 타입
     * @param factory 생성자
     * @return this (chaining)
     * @throws IllegalArgumentException type이 비어 있거나 factory가 null인 경우
     * @throws IllegalStateException 이미 등록된 타입인 경우
     */
    public OperatorRegistry register(String type, OperatorFactory factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (factories.putIfAbsent(type, factory) != null) {
            throw new IllegalStateException("Operator type already registered: " + type);
        }
        return this;
    }

    /**
     * 타입 등록 여부 확인.
     *
     * @param type Operator 타입
     * @return 등록되어 있으면 true
     */
    public boolean isRegistered(String type) {
        return type != null && factories.containsKey(type);
    }

    /**
     * 등록된 타입 목록 (정렬).
     *
     * @return 타입 이름 집합
     */
    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * 정의로부터 Operator 생성.
     *
     * @param definition Operator 정의
     * @return 생성된 Operator
     * @throws UnknownOperatorTypeException 등록되지 않은 타입인 경우
     * @throws IllegalStateException factory가 다른 descriptor를 가진 Operator를 반환한 경우
     */
    public Operator create(OperatorDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        OperatorFactory factory = factories.get(definition.type());
        if (factory == null) {
            throw new UnknownOperatorTypeException(definition.type(), definition.name());
        }
        Operator operator = factory.create(definition);
        if (operator == null || !definition.descriptor().equals(operator.descriptor())) {
            throw new IllegalStateException(
                "Factory for type " + definition.type() + " must return an operator declaring " + definition.descriptor());
        }
        return operator;
    }

    /**
     * 정의 목록을 선언 순서대로 생성.
     *
     * @param definitions Operator 정의 목록
     * @return 생성된 Operator 목록 (같은 순서)
     */
    public List<Operator> createAll(List<OperatorDefinition> definitions) {
        return definitions.stream().map(this::create).toList();
    }
}
