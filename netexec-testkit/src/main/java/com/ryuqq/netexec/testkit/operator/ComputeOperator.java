package com.ryuqq.netexec.testkit.operator;

import com.ryuqq.netexec.core.model.OperatorDefinition;
import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.spi.Workspace;

import java.util.StringJoiner;

/**
 * 입력 blob 내용으로부터 결정적인 출력을 만드는 Operator.
 *
 * <p>각 출력 blob에 {@code name(input1,input2,...)} 형태의 문자열을 씁니다.
 * 아직 쓰이지 않은 입력은 {@code _}로 표기합니다. 출력 값이 입력 값에 의존하므로
 * 실행 순서가 의존성을 어기면 최종 workspace 내용이 달라집니다.</p>
 *
 * <p>인자: {@code ms} (기본 0, 출력 전 대기 시간)</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class ComputeOperator implements Operator {

    public static final String TYPE = "Compute";
    static final String MISSING = "_";

    private final OperatorDescriptor descriptor;
    private final int ms;
    private final ExecutionLog log;

    public ComputeOperator(OperatorDefinition definition) {
        this(definition.descriptor(), definition.intArgument("ms", 0), null);
    }

    public ComputeOperator(OperatorDescriptor descriptor) {
        this(descriptor, 0, null);
    }

    /**
     * 생성자.
     *
     * @param descriptor Operator 선언
     * @param ms 출력 전 대기 시간 (0 이상)
     * @param log 실행 기록 (null 허용)
     */
    public ComputeOperator(OperatorDescriptor descriptor, int ms, ExecutionLog log) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (ms < 0) {
            throw new IllegalArgumentException("ms cannot be negative (current: " + ms + ")");
        }
        this.descriptor = descriptor;
        this.ms = ms;
        this.log = log;
    }

    @Override
    public OperatorDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean run(Workspace workspace) {
        long start = log != null ? log.begin(name()) : 0L;
        try {
            StringJoiner values = new StringJoiner(",", name() + "(", ")");
            for (String input : descriptor.inputs()) {
                values.add(workspace.hasBlob(input) ? String.valueOf(workspace.getBlob(input)) : MISSING);
            }
            if (ms > 0) {
                Thread.sleep(ms);
            }
            String result = values.toString();
            for (String output : descriptor.outputs()) {
                workspace.putBlob(output, result);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            if (log != null) {
                log.end(name(), start);
            }
        }
    }
}
