package com.ryuqq.netexec.core.model;

import java.util.Map;

/**
 * Operator 정의 (descriptor + 타입 + 인자).
 *
 * <p>{@link com.ryuqq.netexec.core.operator.OperatorRegistry}가 이 정의로부터
 * 실제 Operator 인스턴스를 생성합니다.</p>
 *
 * @param descriptor Operator 선언
 * @param type Operator 타입 (레지스트리 키, 예: "Sleep")
 * @param arguments 문자열 인자 (null이면 빈 맵)
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public record OperatorDefinition(
    OperatorDescriptor descriptor,
    String type,
    Map<String, String> arguments
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException descriptor가 null이거나 type이 비어 있는 경우
     */
    public OperatorDefinition {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    /**
     * 인자 없는 정의 생성.
     *
     * @param descriptor Operator 선언
     * @param type Operator 타입
     * @return OperatorDefinition 인스턴스
     */
    public static OperatorDefinition of(OperatorDescriptor descriptor, String type) {
        return new OperatorDefinition(descriptor, type, Map.of());
    }

    /**
     * Operator 이름.
     *
     * @return descriptor의 이름
     */
    public String name() {
        return descriptor.name();
    }

    /**
     * 정수 인자 조회.
     *
     * @param key 인자 이름
     * @param defaultValue 인자가 없을 때 사용할 값
     * @return 인자 값
     * @throws IllegalArgumentException 인자가 정수가 아닌 경우
     */
    public int intArgument(String key, int defaultValue) {
        String value = arguments.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Argument '" + key + "' of operator " + name() + " is not an integer: " + value, e);
        }
    }

    /**
     * 문자열 인자 조회.
     *
     * @param key 인자 이름
     * @param defaultValue 인자가 없을 때 사용할 값
     * @return 인자 값
     */
    public String stringArgument(String key, String defaultValue) {
        return arguments.getOrDefault(key, defaultValue);
    }
}
