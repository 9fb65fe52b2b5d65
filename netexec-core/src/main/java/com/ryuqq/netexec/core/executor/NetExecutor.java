package com.ryuqq.netexec.core.executor;

import com.ryuqq.netexec.core.graph.ExecutionGraph;
import com.ryuqq.netexec.core.outcome.Outcome;
import com.ryuqq.netexec.core.spi.Workspace;

/**
 * 실행 그래프 실행자.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>execute()는 모든 노드가 끝나거나 실패로 중단될 때까지 블로킹합니다.
 *       중단되더라도 실행 중인 Operator를 선점하지 않고, 끝날 때까지 기다린 뒤 반환합니다.</li>
 *   <li>Operator가 RuntimeException을 던지면 false 반환과 같은 실패로 처리합니다.
 *       Error는 실행 중인 Operator가 끝난 뒤 호출자에게 다시 던집니다.</li>
 *   <li>호출 스레드가 인터럽트되면 인터럽트 플래그를 유지한 채
 *       {@link com.ryuqq.netexec.core.outcome.Fail#INTERRUPTED}를 반환할 수 있습니다.</li>
 *   <li>성공이면 {@link com.ryuqq.netexec.core.outcome.Ok}, Operator 실패면
 *       {@link com.ryuqq.netexec.core.outcome.Fail}을 반환합니다.</li>
 *   <li>실행 그래프는 1회용입니다. 같은 인스턴스를 다시 넘기면 IllegalStateException.</li>
 *   <li>자동 재시도는 하지 않습니다.</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public interface NetExecutor {

    /**
     * 실행 그래프 실행.
     *
     * @param graph 실행 그래프 (새로 초기화된 것)
     * @param workspace blob 저장소
     * @return 실행 결과
     * @throws IllegalArgumentException graph 또는 workspace가 null인 경우
     * @throws IllegalStateException 이미 실행된 그래프인 경우
     */
    Outcome execute(ExecutionGraph graph, Workspace workspace);
}
