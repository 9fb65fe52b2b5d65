package com.ryuqq.netexec.core.outcome;

/**
 * Net 실행 결과.
 *
 * <ul>
 *   <li>{@link Ok}: 모든 노드가 DONE</li>
 *   <li>{@link Fail}: 하나 이상의 Operator 실패로 중단됨</li>
 * </ul>
 *
 * <p>재시도 결과는 없습니다. 재시도 정책이 필요하면 호출자가 전체 실행을 감싸야 합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
