package com.ryuqq.netexec.core.outcome;

import java.util.List;

/**
 * 실패 (실행 중단).
 *
 * <p>실패한 Operator 이름은 실제로 FAILED가 관측된 것만 포함합니다.
 * 중단 시점에 함께 실행 중이던 다른 Operator는 식별하지 않습니다.</p>
 *
 * @param errorCode 오류 코드 (예: OPERATOR_EXECUTION_FAILURE)
 * @param message 오류 메시지
 * @param failedOperators 실패한 Operator 이름 (관측 순서)
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    List<String> failedOperators
) implements Outcome {

    /**
     * Operator의 run()이 실패를 보고한 경우.
     */
    public static final String OPERATOR_EXECUTION_FAILURE = "OPERATOR_EXECUTION_FAILURE";

    /**
     * 실행을 조율하던 스레드가 인터럽트된 경우.
     */
    public static final String INTERRUPTED = "INTERRUPTED";

    /**
     * 실패 없이 남은 노드가 있는데 더 이상 진행할 수 없는 경우.
     */
    public static final String UNRESOLVED_DEPENDENCIES = "UNRESOLVED_DEPENDENCIES";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        failedOperators = failedOperators == null ? List.of() : List.copyOf(failedOperators);
    }

    /**
     * Operator 실행 실패 결과 생성.
     *
     * @param failedOperators 실패한 Operator 이름
     * @return Fail 인스턴스
     */
    public static Fail operatorFailure(List<String> failedOperators) {
        return new Fail(
            OPERATOR_EXECUTION_FAILURE,
            "Operator execution failed: " + failedOperators,
            failedOperators
        );
    }

    /**
     * 실패한 Operator 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, List.of());
    }
}
