package com.ryuqq.netexec.core.graph;

import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.statemachine.NodeState;
import com.ryuqq.netexec.core.statemachine.NodeStateTransition;

import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 그래프의 노드 (Operator 1개 + 실행 상태).
 *
 * <p>여러 worker가 동시에 접근하므로 상태와 미해결 선행자 수는 원자적으로 갱신됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>unresolvedCount는 아직 DONE이 아닌 선행자 수와 같음</li>
 *   <li>unresolvedCount는 정확히 한 번 0이 되며, 그때 PENDING → READY 전이</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class ExecutionNode {

    private final int index;
    private final Operator operator;
    private final SortedSet<Integer> predecessors;
    private final SortedSet<Integer> successors;
    private final AtomicInteger unresolvedCount;
    private final AtomicReference<NodeState> state;

    ExecutionNode(int index, Operator operator, SortedSet<Integer> predecessors, SortedSet<Integer> successors) {
        this.index = index;
        this.operator = operator;
        this.predecessors = predecessors;
        this.successors = successors;
        this.unresolvedCount = new AtomicInteger(predecessors.size());
        this.state = new AtomicReference<>(predecessors.isEmpty() ? NodeState.READY : NodeState.PENDING);
    }

    public int index() {
        return index;
    }

    public Operator operator() {
        return operator;
    }

    public String name() {
        return operator.name();
    }

    public SortedSet<Integer> predecessors() {
        return predecessors;
    }

    public SortedSet<Integer> successors() {
        return successors;
    }

    public int unresolvedCount() {
        return unresolvedCount.get();
    }

    public NodeState state() {
        return state.get();
    }

    /**
     * 선행자 하나가 DONE이 되었음을 반영.
     *
     * <p>미해결 선행자 수를 원자적으로 감소시키고, 0이 되면 PENDING → READY 전이합니다.
     * 여러 선행자의 완료가 경쟁하더라도 READY 전이는 정확히 한 번만 일어납니다.</p>
     *
     * @return 이 호출로 READY가 되었으면 true
     * @throws IllegalStateException 선행자 수보다 많이 호출된 경우
     */
    public boolean resolvePredecessor() {
        int remaining = unresolvedCount.decrementAndGet();
        if (remaining < 0) {
            throw new IllegalStateException("Node " + this + " resolved more predecessors than it has");
        }
        if (remaining == 0) {
            transition(NodeState.PENDING, NodeState.READY);
            return true;
        }
        return false;
    }

    /**
     * 상태 전이 (compare-and-set).
     *
     * @param expected 현재 기대 상태
     * @param next 전이할 상태
     * @throws IllegalStateException 전이 규칙 위반 또는 현재 상태가 expected가 아닌 경우
     */
    public void transition(NodeState expected, NodeState next) {
        NodeStateTransition.validate(expected, next);
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException(
                String.format("Node %s expected state %s but was %s (→ %s)", this, expected, state.get(), next)
            );
        }
    }

    @Override
    public String toString() {
        return "ExecutionNode{#" + index + " " + operator.name() + ", " + state.get() + '}';
    }
}
