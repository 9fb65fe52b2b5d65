package com.ryuqq.netexec.adapter.runner;

import com.ryuqq.netexec.core.executor.NetExecutor;
import com.ryuqq.netexec.core.graph.ExecutionGraph;
import com.ryuqq.netexec.core.graph.ExecutionNode;
import com.ryuqq.netexec.core.outcome.Fail;
import com.ryuqq.netexec.core.outcome.Ok;
import com.ryuqq.netexec.core.outcome.Outcome;
import com.ryuqq.netexec.core.spi.Workspace;
import com.ryuqq.netexec.core.statemachine.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 선언 순서대로 하나씩 실행하는 직렬 실행자.
 *
 * <p>병렬 실행 결과가 비교되는 기준 동작입니다. 의존성 간선은 보지 않고 선언 순서만 따르며,
 * 첫 번째 실패에서 멈춥니다.</p>
 *
 * <p>Operator가 던진 RuntimeException은 실패로 처리하고, Error는 노드를 FAILED로 기록한 뒤
 * 호출자에게 그대로 전달합니다. 병렬 실행자와 같은 동작입니다.</p>
 *
 * <p>노드 상태는 병렬 실행자와 같은 방식으로 기록하므로, 실행 후 어떤 노드가 실행되었는지
 * {@link ExecutionGraph#count(NodeState)}로 확인할 수 있습니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class SequentialNetExecutor implements NetExecutor {

    private static final Logger log = LoggerFactory.getLogger(SequentialNetExecutor.class);

    @Override
    public Outcome execute(ExecutionGraph graph, Workspace workspace) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        graph.markStarted();
        log.info("Sequential run started: {} operators", graph.size());

        for (ExecutionNode node : graph.nodes()) {
            // 선행 노드는 모두 앞쪽에 선언되어 있으므로 차례가 오면 항상 READY
            node.transition(NodeState.READY, NodeState.RUNNING);
            if (!runOperator(node, workspace)) {
                node.transition(NodeState.RUNNING, NodeState.FAILED);
                log.warn("Sequential run stopped at operator {} (#{})", node.name(), node.index());
                return Fail.operatorFailure(List.of(node.name()));
            }
            node.transition(NodeState.RUNNING, NodeState.DONE);
            for (int successor : node.successors()) {
                graph.node(successor).resolvePredecessor();
            }
        }

        log.info("Sequential run completed: {} operators", graph.size());
        return Ok.of(graph.size());
    }

    private boolean runOperator(ExecutionNode node, Workspace workspace) {
        try {
            return node.operator().run(workspace);
        } catch (RuntimeException e) {
            log.error("Operator {} (#{}) threw an exception", node.name(), node.index(), e);
            return false;
        } catch (Error e) {
            log.error("Operator {} (#{}) threw an error, aborting run", node.name(), node.index(), e);
            node.transition(NodeState.RUNNING, NodeState.FAILED);
            throw e;
        }
    }
}
