package com.ryuqq.netexec.testkit.operator;

import com.ryuqq.netexec.core.model.OperatorDefinition;
import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.OperatorRegistry;

import java.util.List;
import java.util.Map;

/**
 * 테스트 Operator 레지스트리와 정의 생성 helper.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class TestOperators {

    private TestOperators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Sleep, Compute, Fail 타입이 등록된 새 레지스트리.
     *
     * @return OperatorRegistry
     */
    public static OperatorRegistry registry() {
        return new OperatorRegistry()
            .register(SleepOperator.TYPE, SleepOperator::new)
            .register(ComputeOperator.TYPE, ComputeOperator::new)
            .register(FailingOperator.TYPE, FailingOperator::new);
    }

    /**
     * Sleep Operator 정의 (출력 0~1개).
     *
     * @param name 이름
     * @param ms sleep 시간
     * @param inputs 입력 blob
     * @param output 출력 blob (null이면 출력 없음)
     * @return OperatorDefinition
     */
    public static OperatorDefinition sleep(String name, int ms, List<String> inputs, String output) {
        return sleep(OperatorDescriptor.of(name, inputs, output == null ? List.of() : List.of(output)), ms);
    }

    public static OperatorDefinition sleep(OperatorDescriptor descriptor, int ms) {
        return new OperatorDefinition(descriptor, SleepOperator.TYPE, Map.of("ms", String.valueOf(ms)));
    }

    public static OperatorDefinition compute(OperatorDescriptor descriptor) {
        return OperatorDefinition.of(descriptor, ComputeOperator.TYPE);
    }

    public static OperatorDefinition fail(OperatorDescriptor descriptor) {
        return OperatorDefinition.of(descriptor, FailingOperator.TYPE);
    }
}
