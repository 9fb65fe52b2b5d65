package com.ryuqq.netexec.core.graph;

import java.util.List;

/**
 * 구성된 그래프에서 사이클이 발견된 경우.
 *
 * <p>선언 순서 기반 구성 규칙상 발생할 수 없지만, 발생하면 실행 시 deadlock이 되므로
 * 내부 불변식 위반으로 보고 치명적 오류로 처리합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public class CyclicDependencyException extends GraphBuildException {

    private final List<String> unresolvedOperators;

    public CyclicDependencyException(List<String> unresolvedOperators) {
        super("Cycle detected while building dependency graph, unresolved operators: " + unresolvedOperators);
        this.unresolvedOperators = List.copyOf(unresolvedOperators);
    }

    public List<String> getUnresolvedOperators() {
        return unresolvedOperators;
    }
}
