package com.ryuqq.netexec.testkit.operator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operator 실행 구간 기록 (thread-safe).
 *
 * <p>테스트 Operator가 run() 시작과 종료 시각을 기록합니다.
 * 의존 관계가 있는 Operator 사이의 순서와 최대 동시 실행 수를 검증하는 데 사용합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class ExecutionLog {

    private final ConcurrentLinkedQueue<Interval> intervals = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<String> started = new ConcurrentLinkedQueue<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxConcurrency = new AtomicInteger();

    /**
     * 한 Operator의 실행 구간.
     *
     * @param operator Operator 이름
     * @param startNanos 시작 시각 (System.nanoTime)
     * @param endNanos 종료 시각 (System.nanoTime)
     */
    public record Interval(String operator, long startNanos, long endNanos) {

        /**
         * 이 구간이 other 구간이 끝난 뒤에 시작했는지 확인.
         *
         * @param other 비교 구간
         * @return other 종료 이후 시작했으면 true
         */
        public boolean startedAfter(Interval other) {
            return startNanos >= other.endNanos;
        }

        /**
         * 두 구간이 겹치는지 확인.
         *
         * @param other 비교 구간
         * @return 겹치면 true
         */
        public boolean overlaps(Interval other) {
            return startNanos < other.endNanos && other.startNanos < endNanos;
        }
    }

    /**
     * 실행 시작 기록.
     *
     * @param operator Operator 이름
     * @return 시작 시각
     */
    public long begin(String operator) {
        started.add(operator);
        maxConcurrency.accumulateAndGet(running.incrementAndGet(), Math::max);
        return System.nanoTime();
    }

    /**
     * 실행 종료 기록.
     *
     * @param operator Operator 이름
     * @param startNanos begin()이 반환한 시작 시각
     */
    public void end(String operator, long startNanos) {
        intervals.add(new Interval(operator, startNanos, System.nanoTime()));
        running.decrementAndGet();
    }

    /**
     * 시작된 Operator 이름 (시작 순서).
     *
     * @return Operator 이름 목록
     */
    public List<String> startedOperators() {
        return new ArrayList<>(started);
    }

    /**
     * 종료된 구간 (시작 시각 순).
     *
     * @return 실행 구간 목록
     */
    public List<Interval> intervals() {
        List<Interval> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparingLong(Interval::startNanos));
        return sorted;
    }

    /**
     * 이름으로 실행 구간 조회 (첫 번째).
     *
     * @param operator Operator 이름
     * @return 실행 구간
     */
    public Optional<Interval> interval(String operator) {
        return intervals().stream().filter(i -> i.operator().equals(operator)).findFirst();
    }

    public boolean wasStarted(String operator) {
        return started.contains(operator);
    }

    public int maxConcurrency() {
        return maxConcurrency.get();
    }

    public void clear() {
        intervals.clear();
        started.clear();
        running.set(0);
        maxConcurrency.set(0);
    }
}
