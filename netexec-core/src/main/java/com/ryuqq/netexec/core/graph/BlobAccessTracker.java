package com.ryuqq.netexec.core.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Blob별 접근 기록 (마지막 writer + 그 이후의 reader 집합).
 *
 * <p>그래프 구성 중에만 사용되는 단일 스레드 자료구조입니다.
 * "이 blob을 새로 읽거나 쓰려면 누가 먼저 끝나야 하는가"에 답합니다.</p>
 *
 * <p><strong>불변식:</strong> {@code recordWrite(b, k)} 직후
 * {@code lastWriter(b) == k}이고 b의 reader 집합은 비어 있습니다.</p>
 *
 * <p><strong>의존성 규칙:</strong></p>
 * <ul>
 *   <li>RAW: 읽기는 마지막 writer를 기다림</li>
 *   <li>WAR: 쓰기는 마지막 쓰기 이후의 모든 reader를 기다림</li>
 *   <li>WAW: 쓰기는 마지막 writer를 기다림</li>
 *   <li>RAR: 읽기끼리는 서로 기다리지 않음</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
final class BlobAccessTracker {

    private final Map<String, BlobAccessState> states = new HashMap<>();

    /**
     * 읽기 기록. lastWriter는 변경하지 않습니다.
     *
     * @param blob blob 이름
     * @param opIndex Operator 인덱스
     */
    void recordRead(String blob, int opIndex) {
        state(blob).readersSinceLastWrite.add(opIndex);
    }

    /**
     * 쓰기 기록. lastWriter를 교체하고 reader 집합을 비웁니다.
     *
     * @param blob blob 이름
     * @param opIndex Operator 인덱스
     */
    void recordWrite(String blob, int opIndex) {
        BlobAccessState state = state(blob);
        state.lastWriter = opIndex;
        state.readersSinceLastWrite.clear();
    }

    /**
     * 읽기 전에 끝나야 하는 Operator (RAW).
     *
     * @param blob blob 이름
     * @return {lastWriter} 또는 빈 집합
     */
    Set<Integer> dependenciesForRead(String blob) {
        Set<Integer> dependencies = new TreeSet<>();
        BlobAccessState state = states.get(blob);
        if (state != null && state.lastWriter != null) {
            dependencies.add(state.lastWriter);
        }
        return dependencies;
    }

    /**
     * 쓰기 전에 끝나야 하는 Operator (WAR + WAW).
     *
     * @param blob blob 이름
     * @return readersSinceLastWrite ∪ {lastWriter}
     */
    Set<Integer> dependenciesForWrite(String blob) {
        Set<Integer> dependencies = dependenciesForRead(blob);
        BlobAccessState state = states.get(blob);
        if (state != null) {
            dependencies.addAll(state.readersSinceLastWrite);
        }
        return dependencies;
    }

    private BlobAccessState state(String blob) {
        return states.computeIfAbsent(blob, k -> new BlobAccessState());
    }

    private static final class BlobAccessState {
        private Integer lastWriter;
        private final Set<Integer> readersSinceLastWrite = new TreeSet<>();
    }
}
