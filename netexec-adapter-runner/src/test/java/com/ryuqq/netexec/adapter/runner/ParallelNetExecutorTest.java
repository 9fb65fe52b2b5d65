package com.ryuqq.netexec.adapter.runner;

import com.ryuqq.netexec.adapter.inmemory.workspace.InMemoryWorkspace;
import com.ryuqq.netexec.core.graph.DependencyGraphBuilder;
import com.ryuqq.netexec.core.graph.ExecutionGraph;
import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.outcome.Fail;
import com.ryuqq.netexec.core.outcome.Ok;
import com.ryuqq.netexec.core.outcome.Outcome;
import com.ryuqq.netexec.core.spi.Workspace;
import com.ryuqq.netexec.core.statemachine.NodeState;
import com.ryuqq.netexec.testkit.operator.ComputeOperator;
import com.ryuqq.netexec.testkit.operator.ExecutionLog;
import com.ryuqq.netexec.testkit.operator.FailingOperator;
import com.ryuqq.netexec.testkit.operator.SleepOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParallelNetExecutor 동시성 테스트.
 *
 * <p>계약 테스트가 다루지 않는 병렬 실행자 고유 동작을 검증합니다:</p>
 * <ul>
 *   <li>동시 실행 수는 numWorkers를 넘지 않음</li>
 *   <li>독립 Operator는 실제로 겹쳐서 실행됨</li>
 *   <li>실패 시 실행 중인 형제는 끝까지 실행되고 새 dispatch는 없음</li>
 *   <li>조율 스레드 인터럽트 시 실행 중인 Operator를 기다린 뒤 INTERRUPTED</li>
 *   <li>Operator의 Error는 실행 중인 형제가 끝난 뒤 다시 던짐</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
class ParallelNetExecutorTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();
    private InMemoryWorkspace workspace;
    private ExecutionLog log;

    @BeforeEach
    void setUp() {
        workspace = new InMemoryWorkspace();
        log = new ExecutionLog();
    }

    // ============================================================
    // 1. Worker 수 제한
    // ============================================================

    @Test
    void 동시_실행_수는_numWorkers를_넘지_않음() {
        // given
        List<Operator> operators = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            operators.add(new ComputeOperator(OperatorDescriptor.of("op" + i, List.of(), List.of("out" + i)), 30, log));
        }
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(2));

        // when
        Outcome outcome = executor.execute(graphOf(operators), workspace);

        // then
        assertThat(outcome).isEqualTo(Ok.of(8));
        assertThat(log.maxConcurrency()).isLessThanOrEqualTo(2);
        assertThat(workspace.size()).isEqualTo(8);
    }

    @Test
    void 독립_Operator는_겹쳐서_실행됨() {
        // given
        List<Operator> operators = List.of(
            new SleepOperator(OperatorDescriptor.of("left", List.of(), List.of("L")), 100, log),
            new SleepOperator(OperatorDescriptor.of("right", List.of(), List.of("R")), 100, log)
        );
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(2));

        // when
        Outcome outcome = executor.execute(graphOf(operators), workspace);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(log.interval("left").orElseThrow().overlaps(log.interval("right").orElseThrow())).isTrue();
    }

    @Test
    void numWorkers가_1이면_의존성_순서를_지키며_하나씩_실행됨() {
        // given
        workspace.putBlob("X", "x");
        List<Operator> operators = List.of(
            new ComputeOperator(OperatorDescriptor.of("a", List.of("X"), List.of("A")), 5, log),
            new ComputeOperator(OperatorDescriptor.of("b", List.of("X"), List.of("B")), 5, log),
            new ComputeOperator(OperatorDescriptor.of("c", List.of("A", "B"), List.of("C")), 5, log)
        );
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(1));

        // when
        Outcome outcome = executor.execute(graphOf(operators), workspace);

        // then
        assertThat(outcome).isEqualTo(Ok.of(3));
        assertThat(log.maxConcurrency()).isEqualTo(1);
        assertThat(workspace.getBlob("C")).isEqualTo("c(a(x),b(x))");
    }

    @Test
    void worker_스레드는_설정된_이름_접두사를_사용함() {
        // given
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        List<Operator> operators = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            operators.add(new ThreadRecordingOperator(
                OperatorDescriptor.of("op" + i, List.of(), List.of("out" + i)), threadNames));
        }
        ParallelNetExecutor executor = new ParallelNetExecutor(
            new ParallelExecutorConfig().withNumWorkers(2).withThreadNamePrefix("dag-test"));

        // when
        executor.execute(graphOf(operators), workspace);

        // then
        assertThat(threadNames).isNotEmpty().allMatch(name -> name.startsWith("dag-test-"));
        assertThat(threadNames).doesNotContain(Thread.currentThread().getName());
    }

    // ============================================================
    // 2. Fail-fast
    // ============================================================

    @Test
    void 실패시_실행_중인_형제는_완료되고_이후_노드는_dispatch되지_않음() {
        // given
        //   src(10ms) → broken(30ms, 실패) → afterBroken
        //   slow(150ms)                     → afterSlow
        List<Operator> operators = List.of(
            new ComputeOperator(OperatorDescriptor.of("src", List.of(), List.of("S")), 10, log),
            new FailingOperator(OperatorDescriptor.of("broken", List.of("S"), List.of("B")), 30,
                FailingOperator.Mode.RETURN_FALSE, log),
            new ComputeOperator(OperatorDescriptor.of("slow", List.of(), List.of("W")), 150, log),
            new ComputeOperator(OperatorDescriptor.of("afterBroken", List.of("B"), List.of("AB")), 0, log),
            new ComputeOperator(OperatorDescriptor.of("afterSlow", List.of("W"), List.of("AW")), 0, log)
        );
        ExecutionGraph graph = graphOf(operators);
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(4));

        // when
        Outcome outcome = executor.execute(graph, workspace);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail fail = (Fail) outcome;
        assertThat(fail.errorCode()).isEqualTo(Fail.OPERATOR_EXECUTION_FAILURE);
        assertThat(fail.failedOperators()).containsExactly("broken");

        assertThat(graph.node(2).state()).isEqualTo(NodeState.DONE);
        assertThat(workspace.hasBlob("W")).isTrue();
        assertThat(log.wasStarted("afterBroken")).isFalse();
        assertThat(log.wasStarted("afterSlow")).isFalse();
        assertThat(graph.node(3).state()).isEqualTo(NodeState.PENDING);
        assertThat(graph.node(4).state()).isEqualTo(NodeState.READY);
    }

    @Test
    void 동시에_실패한_Operator는_모두_보고됨() {
        // given
        List<Operator> operators = List.of(
            new FailingOperator(OperatorDescriptor.of("first", List.of(), List.of("A")), 50,
                FailingOperator.Mode.RETURN_FALSE, log),
            new FailingOperator(OperatorDescriptor.of("second", List.of(), List.of("B")), 50,
                FailingOperator.Mode.THROW, log)
        );
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(2));

        // when
        Outcome outcome = executor.execute(graphOf(operators), workspace);

        // then
        assertThat(((Fail) outcome).failedOperators()).containsExactlyInAnyOrder("first", "second");
    }

    // ============================================================
    // 3. 인터럽트
    // ============================================================

    @Test
    @Timeout(10)
    void 조율_스레드가_인터럽트되면_실행_중인_Operator가_끝난_뒤_INTERRUPTED_반환() throws Exception {
        // given
        //   busy(300ms, 인터럽트 무시) → after
        //   queued (worker 1개라 ready 큐에서 대기)
        ExecutionGraph graph = graphOf(List.of(
            new BusyOperator(OperatorDescriptor.of("busy", List.of(), List.of("A")), 300, log),
            new ComputeOperator(OperatorDescriptor.of("queued", List.of(), List.of("Q")), 0, log),
            new ComputeOperator(OperatorDescriptor.of("after", List.of("A"), List.of("B")), 0, log)
        ));
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(1));
        AtomicReference<Outcome> result = new AtomicReference<>();
        AtomicReference<Map<String, Object>> blobsAtReturn = new AtomicReference<>();
        AtomicBoolean interruptedAfter = new AtomicBoolean();

        Thread coordinator = new Thread(() -> {
            result.set(executor.execute(graph, workspace));
            blobsAtReturn.set(workspace.snapshot());
            interruptedAfter.set(Thread.currentThread().isInterrupted());
        });

        // when
        coordinator.start();
        while (!log.wasStarted("busy")) {
            Thread.sleep(5);
        }
        coordinator.interrupt();
        coordinator.join(5000);
        Thread.sleep(200);

        // then
        assertThat(coordinator.isAlive()).isFalse();
        assertThat(result.get()).isInstanceOf(Fail.class);
        assertThat(((Fail) result.get()).errorCode()).isEqualTo(Fail.INTERRUPTED);
        assertThat(interruptedAfter.get()).isTrue();

        assertThat(blobsAtReturn.get()).containsOnlyKeys("A");
        assertThat(workspace.snapshot()).isEqualTo(blobsAtReturn.get());
        assertThat(graph.node(0).state()).isEqualTo(NodeState.DONE);
        assertThat(log.wasStarted("queued")).isFalse();
        assertThat(log.wasStarted("after")).isFalse();
    }

    // ============================================================
    // 4. Error
    // ============================================================

    @Test
    void Error는_실행_중인_형제가_끝난_뒤_호출자에게_전달됨() {
        // given
        ExecutionGraph graph = graphOf(List.of(
            new FailingOperator(OperatorDescriptor.of("fatal", List.of(), List.of("F")), 10,
                FailingOperator.Mode.ERROR, log),
            new ComputeOperator(OperatorDescriptor.of("slow", List.of(), List.of("W")), 150, log),
            new ComputeOperator(OperatorDescriptor.of("afterSlow", List.of("W"), List.of("AW")), 0, log)
        ));
        ParallelNetExecutor executor = new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(2));

        // when & then
        assertThatThrownBy(() -> executor.execute(graph, workspace))
            .isInstanceOf(AssertionError.class)
            .hasMessageContaining("fatal");
        assertThat(graph.node(0).state()).isEqualTo(NodeState.FAILED);
        assertThat(graph.node(1).state()).isEqualTo(NodeState.DONE);
        assertThat(workspace.hasBlob("W")).isTrue();
        assertThat(log.wasStarted("afterSlow")).isFalse();
    }

    // ============================================================
    // Helpers
    // ============================================================

    private ExecutionGraph graphOf(List<? extends Operator> operators) {
        return ExecutionGraph.initialize(
            builder.build(operators.stream().map(Operator::descriptor).toList()),
            operators
        );
    }

    /**
     * 인터럽트와 무관하게 ms 동안 바쁘게 돈 뒤 출력을 쓰는 Operator.
     */
    private record BusyOperator(OperatorDescriptor descriptor, int ms, ExecutionLog log) implements Operator {

        @Override
        public boolean run(Workspace workspace) {
            long start = log.begin(name());
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(ms);
            while (System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            workspace.putBlob(descriptor.outputs().get(0), "done");
            log.end(name(), start);
            return true;
        }
    }

    private record ThreadRecordingOperator(OperatorDescriptor descriptor, Set<String> threadNames) implements Operator {

        @Override
        public boolean run(Workspace workspace) {
            threadNames.add(Thread.currentThread().getName());
            workspace.putBlob(descriptor.outputs().get(0), Thread.currentThread().getName());
            return true;
        }
    }
}
