package com.ryuqq.netexec.core.outcome;

/**
 * 성공 (모든 Operator 완료).
 *
 * @param completedOperators 실행 완료된 Operator 수
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public record Ok(int completedOperators) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException completedOperators가 음수인 경우
     */
    public Ok {
        if (completedOperators < 0) {
            throw new IllegalArgumentException(
                "completedOperators cannot be negative (current: " + completedOperators + ")"
            );
        }
    }

    public static Ok of(int completedOperators) {
        return new Ok(completedOperators);
    }
}
