package com.ryuqq.netexec.adapter.runner;

/**
 * ParallelNetExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>numWorkers: worker 스레드 수 (기본 4)</li>
 *   <li>threadNamePrefix: worker 스레드 이름 접두사 (기본 "net-worker")</li>
 *   <li>shutdownTimeoutMs: 실행 종료 후 worker 종료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>CPU 위주 Operator: numWorkers = 코어 수</li>
 *   <li>I/O 대기가 긴 Operator: numWorkers를 그래프의 최대 폭까지 증가</li>
 *   <li>numWorkers = 1이면 의존성 순서를 지키는 직렬 실행과 같음</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 * @param numWorkers worker 스레드 수 (1 이상이어야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (비어 있으면 안 됨)
 * @param shutdownTimeoutMs worker 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record ParallelExecutorConfig(
    int numWorkers,
    String threadNamePrefix,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: numWorkers=4, threadNamePrefix="net-worker", shutdownTimeoutMs=60000ms</p>
     */
    public ParallelExecutorConfig() {
        this(4, "net-worker", 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParallelExecutorConfig {
        if (numWorkers <= 0) {
            throw new IllegalArgumentException(
                "numWorkers must be positive (current: " + numWorkers + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * numWorkers만 변경한 새 인스턴스 생성.
     */
    public ParallelExecutorConfig withNumWorkers(int numWorkers) {
        return new ParallelExecutorConfig(numWorkers, threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public ParallelExecutorConfig withThreadNamePrefix(String threadNamePrefix) {
        return new ParallelExecutorConfig(numWorkers, threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ParallelExecutorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new ParallelExecutorConfig(numWorkers, threadNamePrefix, shutdownTimeoutMs);
    }
}
