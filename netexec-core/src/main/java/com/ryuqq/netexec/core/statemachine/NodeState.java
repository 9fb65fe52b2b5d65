package com.ryuqq.netexec.core.statemachine;

/**
 * 실행 그래프 노드의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──(모든 선행자 DONE)──► READY ──(worker 획득)──► RUNNING
 *                                                          │
 *                                                          ├─► DONE (run() 성공)
 *                                                          │
 *                                                          └─► FAILED (run() 실패)
 * </pre>
 *
 * <p>선행자가 없는 노드는 READY로 시작합니다.
 * 중단(abort)된 실행에서 dispatch되지 못한 노드는 PENDING 또는 READY로 남습니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public enum NodeState {

    /**
     * 선행자 완료 대기 중.
     */
    PENDING,

    /**
     * 모든 선행자 완료, dispatch 가능.
     */
    READY,

    /**
     * worker에서 실행 중.
     */
    RUNNING,

    /**
     * 성공.
     */
    DONE,

    /**
     * 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
