package com.ryuqq.netexec.core.graph;

import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.statemachine.NodeState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 스케줄링 준비가 된 실행 그래프 (1회용).
 *
 * <p>{@link DependencyGraph}의 각 노드에 Operator를 묶고, 노드마다 미해결 선행자 수와
 * 상태를 부여합니다. 선행자가 없는 노드는 READY, 나머지는 PENDING으로 시작합니다.</p>
 *
 * <p>실행 중 상태가 변하므로 한 번의 실행에만 사용할 수 있습니다.
 * 다시 실행하려면 {@link #initialize}로 새로 만들어야 합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class ExecutionGraph {

    private final DependencyGraph dependencyGraph;
    private final List<ExecutionNode> nodes;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutionGraph(DependencyGraph dependencyGraph, List<ExecutionNode> nodes) {
        this.dependencyGraph = dependencyGraph;
        this.nodes = nodes;
    }

    /**
     * 실행 그래프 초기화.
     *
     * @param dependencyGraph 의존성 그래프
     * @param operators 선언 순서대로의 Operator (그래프와 같은 크기, 같은 descriptor)
     * @return 새 실행 그래프
     * @throws IllegalArgumentException 크기나 descriptor가 일치하지 않는 경우
     */
    public static ExecutionGraph initialize(DependencyGraph dependencyGraph, List<? extends Operator> operators) {
        if (dependencyGraph == null) {
            throw new IllegalArgumentException("dependencyGraph cannot be null");
        }
        if (operators == null) {
            throw new IllegalArgumentException("operators cannot be null");
        }
        if (operators.size() != dependencyGraph.size()) {
            throw new IllegalArgumentException(
                "operators size must match graph size (" + operators.size() + " != " + dependencyGraph.size() + ")"
            );
        }

        List<ExecutionNode> nodes = new ArrayList<>(operators.size());
        for (int i = 0; i < operators.size(); i++) {
            Operator operator = operators.get(i);
            OperatorDescriptor expected = dependencyGraph.descriptor(i);
            if (operator == null || !expected.equals(operator.descriptor())) {
                throw new IllegalArgumentException(
                    "Operator #" + i + " does not match graph descriptor " + expected
                );
            }
            nodes.add(new ExecutionNode(
                i, operator, dependencyGraph.predecessors(i), dependencyGraph.successors(i)
            ));
        }
        return new ExecutionGraph(dependencyGraph, List.copyOf(nodes));
    }

    public DependencyGraph dependencyGraph() {
        return dependencyGraph;
    }

    public int size() {
        return nodes.size();
    }

    public ExecutionNode node(int index) {
        return nodes.get(index);
    }

    public List<ExecutionNode> nodes() {
        return nodes;
    }

    /**
     * 초기 READY 노드 (선언 순서).
     *
     * @return READY 상태 노드 목록
     */
    public List<ExecutionNode> initiallyReady() {
        return nodes.stream().filter(node -> node.predecessors().isEmpty()).toList();
    }

    /**
     * 특정 상태의 노드 수.
     *
     * @param state 노드 상태
     * @return 해당 상태의 노드 수
     */
    public long count(NodeState state) {
        return nodes.stream().filter(node -> node.state() == state).count();
    }

    /**
     * 실행 시작 표시 (1회만 허용).
     *
     * @throws IllegalStateException 이미 실행된 그래프인 경우
     */
    public void markStarted() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("ExecutionGraph already executed; initialize a new one to run again");
        }
    }

    public boolean isStarted() {
        return started.get();
    }
}
