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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker pool 기반 병렬 실행자.
 *
 * <p>의존성 그래프를 지키면서 서로 독립적인 Operator를 동시에 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute() 호출
 *   ↓
 * ready 큐에 초기 READY 노드 적재, worker W개 시작
 *   ↓
 * worker: ready 큐 take() → READY→RUNNING → operator.run() → DONE/FAILED
 *         → completion 큐에 완료 메시지 전송
 *   ↓
 * 조율 스레드 (execute() 호출자): completion 큐 take()
 *   - DONE   → 후행 노드 unresolvedCount 감소, 0이 되면 READY로 ready 큐에 적재
 *   - FAILED → 중단 시작: ready 큐 비우고 더 이상 dispatch 안 함
 *   ↓
 * 실행 중인 노드가 모두 끝나면 Ok / Fail 반환
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>완료 처리는 조율 스레드 하나가 메시지로 받아 수행 (콜백 재진입 없음)</li>
 *   <li>노드 상태 전이와 unresolvedCount 감소는 원자적 (CAS)</li>
 *   <li>Workspace에 대한 blob 단위 잠금은 없음 (그래프가 충돌 접근을 직렬화)</li>
 * </ul>
 *
 * <p><strong>실패 처리:</strong> fail-fast. 실행 중인 Operator는 취소하지 않고 끝날 때까지 기다린 뒤
 * {@link Fail}을 반환합니다. 중단 이후 ready 큐에서 꺼낸 노드는 실행하지 않습니다.</p>
 * <ul>
 *   <li>run()이 false 반환 또는 RuntimeException: FAILED, {@code OPERATOR_EXECUTION_FAILURE}</li>
 *   <li>run()이 Error를 던짐: FAILED로 기록하고 중단, 실행 중인 노드가 끝난 뒤 같은 Error를 다시 던짐</li>
 *   <li>조율 스레드 인터럽트: 중단 후 실행 중인 노드를 기다리고, 인터럽트 플래그를 복원한 뒤
 *       {@code INTERRUPTED} 반환. worker 스레드는 인터럽트하지 않음</li>
 * </ul>
 *
 * <p>어떤 경우든 execute()가 반환(또는 throw)한 뒤에는 이 실행의 Operator가 Workspace에 쓰지 않습니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class ParallelNetExecutor implements NetExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelNetExecutor.class);
    private static final int POISON_PILL = -1;

    private final ParallelExecutorConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public ParallelNetExecutor() {
        this(new ParallelExecutorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ParallelNetExecutor(ParallelExecutorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public ParallelExecutorConfig config() {
        return config;
    }

    @Override
    public Outcome execute(ExecutionGraph graph, Workspace workspace) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        graph.markStarted();

        if (graph.size() == 0) {
            return Ok.of(0);
        }

        long startNanos = System.nanoTime();
        log.info("Parallel run started: {} operators, {} workers", graph.size(), config.numWorkers());

        Run run = new Run(graph, workspace);
        ExecutorService workers = Executors.newFixedThreadPool(config.numWorkers(), workerThreadFactory());
        Outcome outcome;
        try {
            for (int i = 0; i < config.numWorkers(); i++) {
                workers.submit(run::work);
            }
            outcome = run.coordinate();
        } finally {
            stopWorkers(run, workers);
            if (run.interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (outcome.isOk()) {
            log.info("Parallel run completed: {} operators in {}ms", graph.size(), elapsedMs);
        } else {
            log.warn("Parallel run aborted after {}ms: {}", elapsedMs, outcome);
        }
        return outcome;
    }

    /**
     * Worker 종료.
     *
     * <p>worker마다 poison pill을 넣어 take() 대기를 풀고, graceful shutdown합니다.
     * 이 시점에는 실행 중인 Operator가 없으므로 worker는 곧바로 종료됩니다.</p>
     */
    private void stopWorkers(Run run, ExecutorService workers) {
        for (int i = 0; i < config.numWorkers(); i++) {
            run.readyQueue.offer(POISON_PILL);
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, config.threadNamePrefix() + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * worker가 조율 스레드로 보내는 완료 메시지.
     */
    private record Completion(int index, Result result) {
    }

    private enum Result {
        DONE,
        FAILED,
        SKIPPED
    }

    /**
     * 한 번의 실행 상태 (ready 큐, completion 큐, 중단 플래그).
     */
    private static final class Run {

        private final ExecutionGraph graph;
        private final Workspace workspace;
        private final BlockingQueue<Integer> readyQueue = new LinkedBlockingQueue<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final AtomicBoolean aborting = new AtomicBoolean(false);
        private final AtomicReference<Error> fatalError = new AtomicReference<>();

        // 조율 스레드 전용
        private boolean interrupted;

        private Run(ExecutionGraph graph, Workspace workspace) {
            this.graph = graph;
            this.workspace = workspace;
        }

        /**
         * 조율 루프 (호출 스레드에서 실행).
         *
         * <p>인터럽트되어도 실행 중인 노드가 모두 끝날 때까지 반환하지 않습니다.</p>
         *
         * @return 실행 결과
         * @throws Error Operator가 던진 Error (실행 중인 노드가 모두 끝난 뒤)
         */
        private Outcome coordinate() {
            int inFlight = 0;
            for (ExecutionNode node : graph.initiallyReady()) {
                readyQueue.offer(node.index());
                inFlight++;
            }

            int done = 0;
            List<String> failed = new ArrayList<>();

            while (inFlight > 0) {
                Completion completion;
                try {
                    completion = completions.take();
                } catch (InterruptedException e) {
                    if (!interrupted) {
                        interrupted = true;
                        int undispatched = abort();
                        inFlight -= undispatched;
                        log.warn("Parallel run interrupted: {} ready operators not dispatched, waiting for {} in flight",
                            undispatched, inFlight);
                    }
                    continue;
                }
                inFlight--;
                ExecutionNode node = graph.node(completion.index());

                switch (completion.result()) {
                    case DONE -> {
                        done++;
                        for (int successor : node.successors()) {
                            boolean ready = graph.node(successor).resolvePredecessor();
                            if (ready && !aborting.get()) {
                                readyQueue.offer(successor);
                                inFlight++;
                            }
                        }
                    }
                    case FAILED -> {
                        failed.add(node.name());
                        if (!aborting.get()) {
                            int undispatched = abort();
                            inFlight -= undispatched;
                            log.warn("Operator {} (#{}) failed, aborting run: {} ready operators not dispatched, {} in flight",
                                node.name(), node.index(), undispatched, inFlight);
                        }
                    }
                    case SKIPPED -> log.debug("Operator {} (#{}) skipped after abort", node.name(), node.index());
                }
            }

            Error error = fatalError.get();
            if (error != null) {
                throw error;
            }
            if (interrupted) {
                return new Fail(Fail.INTERRUPTED, "Parallel run interrupted after " + done + " operators", failed);
            }
            if (!failed.isEmpty()) {
                return Fail.operatorFailure(failed);
            }
            if (done != graph.size()) {
                return Fail.of(Fail.UNRESOLVED_DEPENDENCIES,
                    (graph.size() - done) + " operators never became ready");
            }
            return Ok.of(done);
        }

        /**
         * 중단 시작: 이후 dispatch를 막고 ready 큐를 비움.
         *
         * @return dispatch되지 않고 제거된 노드 수
         */
        private int abort() {
            aborting.set(true);
            List<Integer> undispatched = new ArrayList<>();
            readyQueue.drainTo(undispatched);
            return undispatched.size();
        }

        /**
         * Worker 루프 (pool 스레드에서 실행).
         */
        private void work() {
            while (true) {
                int index;
                try {
                    index = readyQueue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (index == POISON_PILL) {
                    return;
                }

                ExecutionNode node = graph.node(index);
                if (aborting.get()) {
                    completions.offer(new Completion(index, Result.SKIPPED));
                    continue;
                }

                node.transition(NodeState.READY, NodeState.RUNNING);
                log.debug("Operator {} (#{}) started", node.name(), index);
                Result result = Result.FAILED;
                try {
                    if (node.operator().run(workspace)) {
                        result = Result.DONE;
                    }
                } catch (RuntimeException e) {
                    log.error("Operator {} (#{}) threw an exception", node.name(), index, e);
                } catch (Error e) {
                    log.error("Operator {} (#{}) threw an error, aborting run", node.name(), index, e);
                    fatalError.compareAndSet(null, e);
                } finally {
                    node.transition(NodeState.RUNNING, result == Result.DONE ? NodeState.DONE : NodeState.FAILED);
                    completions.offer(new Completion(index, result));
                }
                log.debug("Operator {} (#{}) finished: {}", node.name(), index, result);
            }
        }
    }
}
