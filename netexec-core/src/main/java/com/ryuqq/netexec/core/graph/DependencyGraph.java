package com.ryuqq.netexec.core.graph;

import com.ryuqq.netexec.core.model.OperatorDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Operator 단위 의존성 DAG (불변).
 *
 * <p>노드는 선언 순서 인덱스(0부터)로 식별됩니다. 모든 간선은 낮은 인덱스에서 높은 인덱스로 향하며,
 * 같은 쌍 사이의 중복 간선은 하나로 합쳐집니다.</p>
 *
 * <p>실행 상태는 가지지 않으므로 여러 번의 실행에서 재사용할 수 있습니다.
 * 실행할 때마다 {@link ExecutionGraph#initialize}로 새 실행 그래프를 만듭니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class DependencyGraph {

    private final List<OperatorDescriptor> descriptors;
    private final List<SortedSet<Integer>> predecessors;
    private final List<SortedSet<Integer>> successors;
    private final int edgeCount;

    DependencyGraph(List<OperatorDescriptor> descriptors, List<? extends Set<Integer>> predecessorSets) {
        if (descriptors.size() != predecessorSets.size()) {
            throw new IllegalArgumentException(
                "descriptors and predecessors must have the same size (" + descriptors.size()
                    + " != " + predecessorSets.size() + ")");
        }
        int size = descriptors.size();
        List<SortedSet<Integer>> preds = new ArrayList<>(size);
        List<SortedSet<Integer>> succs = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            succs.add(new TreeSet<>());
        }
        int edges = 0;
        for (int to = 0; to < size; to++) {
            SortedSet<Integer> incoming = new TreeSet<>(predecessorSets.get(to));
            for (int from : incoming) {
                succs.get(from).add(to);
            }
            edges += incoming.size();
            preds.add(Collections.unmodifiableSortedSet(incoming));
        }
        for (int i = 0; i < size; i++) {
            succs.set(i, Collections.unmodifiableSortedSet(succs.get(i)));
        }
        this.descriptors = List.copyOf(descriptors);
        this.predecessors = Collections.unmodifiableList(preds);
        this.successors = Collections.unmodifiableList(succs);
        this.edgeCount = edges;
    }

    /**
     * 노드(Operator) 수.
     *
     * @return 노드 수
     */
    public int size() {
        return descriptors.size();
    }

    /**
     * 간선 수 (중복 제거 후).
     *
     * @return 간선 수
     */
    public int edgeCount() {
        return edgeCount;
    }

    public OperatorDescriptor descriptor(int index) {
        return descriptors.get(index);
    }

    public List<OperatorDescriptor> descriptors() {
        return descriptors;
    }

    /**
     * 선행 노드 (이 노드보다 먼저 끝나야 하는 노드).
     *
     * @param index 노드 인덱스
     * @return 정렬된 선행 노드 인덱스
     */
    public SortedSet<Integer> predecessors(int index) {
        return predecessors.get(index);
    }

    /**
     * 후행 노드 (이 노드가 끝나야 시작할 수 있는 노드).
     *
     * @param index 노드 인덱스
     * @return 정렬된 후행 노드 인덱스
     */
    public SortedSet<Integer> successors(int index) {
        return successors.get(index);
    }

    /**
     * from → to 간선 존재 여부.
     *
     * @param from 선행 노드 인덱스
     * @param to 후행 노드 인덱스
     * @return 간선이 있으면 true
     */
    public boolean hasEdge(int from, int to) {
        return predecessors.get(to).contains(from);
    }

    /**
     * node가 ancestor에 직접 또는 전이적으로 의존하는지 확인.
     *
     * @param node 후행 노드 인덱스
     * @param ancestor 선행 노드 인덱스
     * @return ancestor에서 node로 가는 경로가 있으면 true
     */
    public boolean dependsOn(int node, int ancestor) {
        if (ancestor >= node) {
            return false;
        }
        boolean[] visited = new boolean[size()];
        List<Integer> stack = new ArrayList<>(predecessors.get(node));
        while (!stack.isEmpty()) {
            int current = stack.remove(stack.size() - 1);
            if (current == ancestor) {
                return true;
            }
            if (current > ancestor && !visited[current]) {
                visited[current] = true;
                stack.addAll(predecessors.get(current));
            }
        }
        return false;
    }

    /**
     * 선행자가 없는 노드 (선언 순서).
     *
     * @return 루트 노드 인덱스
     */
    public List<Integer> roots() {
        List<Integer> roots = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            if (predecessors.get(i).isEmpty()) {
                roots.add(i);
            }
        }
        return roots;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DependencyGraph{");
        for (int i = 0; i < size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('#').append(i).append(' ').append(descriptors.get(i).name())
                .append("<-").append(predecessors.get(i));
        }
        return sb.append('}').toString();
    }
}
