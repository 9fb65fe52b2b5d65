package com.ryuqq.netexec.testkit.operator;

import com.ryuqq.netexec.core.model.OperatorDefinition;
import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.spi.Workspace;

/**
 * 지정된 시간 동안 sleep하는 Operator.
 *
 * <p>입력은 몇 개든 허용하고 출력은 최대 1개입니다. 출력이 있으면
 * {@code long[]{startNanos, endNanos}}를 기록합니다. 타이밍 시나리오에서
 * 병렬성 자체를 측정하는 데 사용합니다.</p>
 *
 * <p>인자: {@code ms} (기본 1000, 0 초과 1시간 미만)</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class SleepOperator implements Operator {

    public static final String TYPE = "Sleep";
    static final int DEFAULT_MS = 1000;
    private static final int MAX_MS = 3600 * 1000;

    private final OperatorDescriptor descriptor;
    private final int ms;
    private final ExecutionLog log;

    /**
     * 정의로부터 생성 ({@link com.ryuqq.netexec.core.operator.OperatorFactory} 용).
     *
     * @param definition Operator 정의
     */
    public SleepOperator(OperatorDefinition definition) {
        this(definition.descriptor(), definition.intArgument("ms", DEFAULT_MS), null);
    }

    /**
     * 생성자.
     *
     * @param descriptor Operator 선언 (출력 최대 1개)
     * @param ms sleep 시간 (밀리초)
     * @param log 실행 기록 (null 허용)
     * @throws IllegalArgumentException 출력이 2개 이상이거나 ms가 범위를 벗어난 경우
     */
    public SleepOperator(OperatorDescriptor descriptor, int ms, ExecutionLog log) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (descriptor.outputs().size() > 1) {
            throw new IllegalArgumentException(
                "Sleep operator accepts at most one output (current: " + descriptor.outputs().size() + ")"
            );
        }
        if (ms <= 0 || ms >= MAX_MS) {
            throw new IllegalArgumentException("ms must be in (0, " + MAX_MS + ") (current: " + ms + ")");
        }
        this.descriptor = descriptor;
        this.ms = ms;
        this.log = log;
    }

    @Override
    public OperatorDescriptor descriptor() {
        return descriptor;
    }

    public int ms() {
        return ms;
    }

    @Override
    public boolean run(Workspace workspace) {
        long logStart = log != null ? log.begin(name()) : 0L;
        long start = System.nanoTime();
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            if (log != null) {
                log.end(name(), logStart);
            }
        }
        long end = System.nanoTime();
        if (!descriptor.outputs().isEmpty()) {
            workspace.putBlob(descriptor.outputs().get(0), new long[] {start, end});
        }
        return true;
    }
}
