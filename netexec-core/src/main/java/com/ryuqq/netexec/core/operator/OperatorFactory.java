package com.ryuqq.netexec.core.operator;

import com.ryuqq.netexec.core.model.OperatorDefinition;

/**
 * Operator 타입별 생성자.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperatorFactory {

    /**
     * 정의로부터 Operator 생성.
     *
     * @param definition Operator 정의
     * @return 새 Operator 인스턴스
     * @throws IllegalArgumentException 정의의 인자가 유효하지 않은 경우
     */
    Operator create(OperatorDefinition definition);
}
