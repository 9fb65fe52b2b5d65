package com.ryuqq.netexec.core.model;

import java.util.List;

/**
 * Net 정의 (불변 record).
 *
 * <p>Operator 정의 목록과 실행 방식(type), worker 수를 묶습니다.
 * 텍스트/바이너리 포맷 파싱은 이 라이브러리의 범위가 아니며,
 * 호출자가 직접 이 record를 구성합니다.</p>
 *
 * @param name Net 이름
 * @param type 실행 방식 (예: "dag", "simple")
 * @param numWorkers 병렬 실행 시 worker 수 (1 이상)
 * @param operators 선언 순서대로의 Operator 정의
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public record NetDefinition(
    String name,
    String type,
    int numWorkers,
    List<OperatorDefinition> operators
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public NetDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (numWorkers <= 0) {
            throw new IllegalArgumentException(
                "numWorkers must be positive (current: " + numWorkers + ")"
            );
        }
        if (operators == null) {
            throw new IllegalArgumentException("operators cannot be null");
        }
        operators = List.copyOf(operators);
    }

    /**
     * type만 변경한 새 인스턴스 생성.
     *
     * @param type 새로운 실행 방식
     * @return 새 NetDefinition 인스턴스
     */
    public NetDefinition withType(String type) {
        return new NetDefinition(name, type, numWorkers, operators);
    }

    /**
     * numWorkers만 변경한 새 인스턴스 생성.
     *
     * @param numWorkers 새로운 worker 수
     * @return 새 NetDefinition 인스턴스
     */
    public NetDefinition withNumWorkers(int numWorkers) {
        return new NetDefinition(name, type, numWorkers, operators);
    }

    /**
     * Operator 선언 목록 (선언 순서).
     *
     * @return descriptor 목록
     */
    public List<OperatorDescriptor> descriptors() {
        return operators.stream().map(OperatorDefinition::descriptor).toList();
    }
}
