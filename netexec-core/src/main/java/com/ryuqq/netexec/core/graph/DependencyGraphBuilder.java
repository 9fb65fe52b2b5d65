package com.ryuqq.netexec.core.graph;

import com.ryuqq.netexec.core.model.OperatorDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Blob 접근 패턴과 control 간선으로부터 의존성 DAG를 구성합니다.
 *
 * <p><strong>구성 규칙 (선언 순서대로, Operator k마다):</strong></p>
 * <ol>
 *   <li>k 이전의 tracker 상태로 모든 입력의 RAW 의존성과 모든 출력의 WAR/WAW 의존성을 계산</li>
 *   <li>입력을 reader로 기록 ({@code recordRead})</li>
 *   <li>출력을 writer로 기록 ({@code recordWrite})</li>
 *   <li>control 선행자 p마다 {@code index(p) → k} 간선을 무조건 추가</li>
 * </ol>
 *
 * <p>같은 blob을 읽고 쓰는 Operator(in-place 갱신)는 자기 자신에 대한 간선을 만들지 않고,
 * 해당 blob의 새 lastWriter가 되며 reader 집합은 비워집니다.</p>
 *
 * <p><strong>오류:</strong></p>
 * <ul>
 *   <li>{@link UnknownOperatorReferenceException} - control 선행자가 앞선 Operator가 아님</li>
 *   <li>{@link CyclicDependencyException} - 구성 후 사이클 검사 실패 (방어적 검사)</li>
 * </ul>
 *
 * <p>단일 스레드에서 호출됩니다. 인스턴스는 상태를 갖지 않으므로 재사용 가능합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    /**
     * 의존성 그래프 구성.
     *
     * @param descriptors 선언 순서대로의 Operator 선언
     * @return 구성된 DAG
     * @throws IllegalArgumentException descriptors가 null이거나 null 원소를 포함하는 경우
     * @throws UnknownOperatorReferenceException control 선행자를 해석할 수 없는 경우
     * @throws CyclicDependencyException 사이클이 발견된 경우
     */
    public DependencyGraph build(List<OperatorDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }

        BlobAccessTracker tracker = new BlobAccessTracker();
        Map<String, Integer> latestIndexByName = new HashMap<>();
        List<Set<Integer>> predecessors = new ArrayList<>(descriptors.size());

        for (int k = 0; k < descriptors.size(); k++) {
            OperatorDescriptor descriptor = descriptors.get(k);
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptors cannot contain null (index " + k + ")");
            }

            Set<Integer> incoming = new TreeSet<>();

            // 1. k 이전 상태 기준으로 의존성 계산
            for (String blob : descriptor.inputs()) {
                incoming.addAll(tracker.dependenciesForRead(blob));
            }
            for (String blob : descriptor.outputs()) {
                incoming.addAll(tracker.dependenciesForWrite(blob));
            }

            // 2. tracker 갱신 (읽기 먼저, 쓰기 나중)
            for (String blob : descriptor.inputs()) {
                tracker.recordRead(blob, k);
            }
            for (String blob : descriptor.outputs()) {
                tracker.recordWrite(blob, k);
            }

            // 3. control 간선
            for (String reference : descriptor.controlPredecessors()) {
                Integer predecessor = latestIndexByName.get(reference);
                if (predecessor == null) {
                    throw new UnknownOperatorReferenceException(descriptor.name(), k, reference);
                }
                incoming.add(predecessor);
            }

            latestIndexByName.put(descriptor.name(), k);
            predecessors.add(incoming);
        }

        verifyAcyclic(descriptors, predecessors);

        DependencyGraph graph = new DependencyGraph(descriptors, predecessors);
        log.debug("Dependency graph built: {} operators, {} edges, {} roots",
            graph.size(), graph.edgeCount(), graph.roots().size());
        return graph;
    }

    /**
     * 사이클 검사 (Kahn 알고리즘).
     *
     * @param descriptors Operator 선언
     * @param predecessors 노드별 선행 노드
     * @throws CyclicDependencyException 위상 정렬되지 않는 노드가 남은 경우
     */
    static void verifyAcyclic(List<OperatorDescriptor> descriptors, List<? extends Set<Integer>> predecessors) {
        int size = predecessors.size();
        int[] indegree = new int[size];
        List<List<Integer>> adjacency = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (int to = 0; to < size; to++) {
            for (int from : predecessors.get(to)) {
                adjacency.get(from).add(to);
                indegree[to]++;
            }
        }

        Queue<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < size; i++) {
            if (indegree[i] == 0) {
                ready.add(i);
            }
        }

        int visited = 0;
        while (!ready.isEmpty()) {
            int current = ready.remove();
            visited++;
            for (int successor : adjacency.get(current)) {
                if (--indegree[successor] == 0) {
                    ready.add(successor);
                }
            }
        }

        if (visited != size) {
            List<String> unresolved = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                if (indegree[i] > 0) {
                    unresolved.add(descriptors.get(i).name() + "#" + i);
                }
            }
            throw new CyclicDependencyException(unresolved);
        }
    }
}
