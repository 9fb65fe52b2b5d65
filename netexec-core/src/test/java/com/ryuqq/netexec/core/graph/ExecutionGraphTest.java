package com.ryuqq.netexec.core.graph;

import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.spi.Workspace;
import com.ryuqq.netexec.core.statemachine.NodeState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutionGraph / ExecutionNode 테스트.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
class ExecutionGraphTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    private record NoOp(OperatorDescriptor descriptor) implements Operator {
        @Override
        public boolean run(Workspace workspace) {
            return true;
        }
    }

    private static List<Operator> operatorsOf(DependencyGraph graph) {
        List<Operator> operators = new ArrayList<>();
        for (OperatorDescriptor descriptor : graph.descriptors()) {
            operators.add(new NoOp(descriptor));
        }
        return operators;
    }

    private DependencyGraph diamond() {
        return builder.build(List.of(
            OperatorDescriptor.of("source", List.of(), List.of("A")),
            OperatorDescriptor.of("left", List.of("A"), List.of("B")),
            OperatorDescriptor.of("right", List.of("A"), List.of("C")),
            OperatorDescriptor.of("join", List.of("B", "C"), List.of("D"))
        ));
    }

    @Test
    void initialize_rootsStartReady_othersPending() {
        // Given
        DependencyGraph graph = diamond();

        // When
        ExecutionGraph executionGraph = ExecutionGraph.initialize(graph, operatorsOf(graph));

        // Then
        assertThat(executionGraph.node(0).state()).isEqualTo(NodeState.READY);
        assertThat(executionGraph.node(1).state()).isEqualTo(NodeState.PENDING);
        assertThat(executionGraph.node(3).unresolvedCount()).isEqualTo(2);
        assertThat(executionGraph.initiallyReady()).extracting(ExecutionNode::index).containsExactly(0);
        assertThat(executionGraph.count(NodeState.PENDING)).isEqualTo(3);
    }

    @Test
    void resolvePredecessor_readiesNodeOnlyWhenLastPredecessorResolves() {
        // Given
        DependencyGraph graph = diamond();
        ExecutionNode join = ExecutionGraph.initialize(graph, operatorsOf(graph)).node(3);

        // When & Then
        assertThat(join.resolvePredecessor()).isFalse();
        assertThat(join.state()).isEqualTo(NodeState.PENDING);
        assertThat(join.resolvePredecessor()).isTrue();
        assertThat(join.state()).isEqualTo(NodeState.READY);
        assertThat(join.unresolvedCount()).isZero();
    }

    @Test
    void resolvePredecessor_moreThanPredecessorCount_throwsException() {
        // Given
        DependencyGraph graph = diamond();
        ExecutionNode left = ExecutionGraph.initialize(graph, operatorsOf(graph)).node(1);
        left.resolvePredecessor();

        // When & Then
        assertThatThrownBy(left::resolvePredecessor)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resolvePredecessor_concurrentCompletions_readyExactlyOnce() throws Exception {
        // Given: 64개의 선행자를 가진 sink
        List<OperatorDescriptor> descriptors = new ArrayList<>();
        List<String> blobs = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            descriptors.add(OperatorDescriptor.of("p" + i, List.of(), List.of("b" + i)));
            blobs.add("b" + i);
        }
        descriptors.add(OperatorDescriptor.of("sink", blobs, List.of()));
        DependencyGraph graph = builder.build(descriptors);
        ExecutionNode sink = ExecutionGraph.initialize(graph, operatorsOf(graph)).node(64);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 64; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return sink.resolvePredecessor();
            }));
        }
        start.countDown();

        int readied = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(5, TimeUnit.SECONDS)) {
                readied++;
            }
        }
        pool.shutdown();

        // Then
        assertThat(readied).isEqualTo(1);
        assertThat(sink.state()).isEqualTo(NodeState.READY);
    }

    @Test
    void transition_wrongExpectedState_throwsException() {
        // Given
        DependencyGraph graph = diamond();
        ExecutionNode source = ExecutionGraph.initialize(graph, operatorsOf(graph)).node(0);
        source.transition(NodeState.READY, NodeState.RUNNING);

        // When & Then
        assertThatThrownBy(() -> source.transition(NodeState.READY, NodeState.RUNNING))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("RUNNING");
    }

    @Test
    void markStarted_secondCall_throwsException() {
        // Given
        DependencyGraph graph = diamond();
        ExecutionGraph executionGraph = ExecutionGraph.initialize(graph, operatorsOf(graph));

        // When
        executionGraph.markStarted();

        // Then
        assertThat(executionGraph.isStarted()).isTrue();
        assertThatThrownBy(executionGraph::markStarted)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already executed");
    }

    @Test
    void initialize_sizeMismatch_throwsException() {
        // Given
        DependencyGraph graph = diamond();

        // When & Then
        assertThatThrownBy(() -> ExecutionGraph.initialize(graph, operatorsOf(graph).subList(0, 2)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("size");
    }

    @Test
    void initialize_descriptorMismatch_throwsException() {
        // Given
        DependencyGraph graph = diamond();
        List<Operator> operators = operatorsOf(graph);
        operators.set(1, new NoOp(OperatorDescriptor.of("other", List.of(), List.of())));

        // When & Then
        assertThatThrownBy(() -> ExecutionGraph.initialize(graph, operators))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("#1");
    }

    @Test
    void dependencyGraph_canBeInitializedRepeatedly() {
        // Given
        DependencyGraph graph = diamond();
        ExecutionGraph first = ExecutionGraph.initialize(graph, operatorsOf(graph));
        first.markStarted();
        first.node(0).transition(NodeState.READY, NodeState.RUNNING);

        // When
        ExecutionGraph second = ExecutionGraph.initialize(graph, operatorsOf(graph));

        // Then
        assertThat(second.isStarted()).isFalse();
        assertThat(second.node(0).state()).isEqualTo(NodeState.READY);
    }
}
