package com.ryuqq.netexec.testkit.operator;

import com.ryuqq.netexec.core.model.OperatorDefinition;
import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.spi.Workspace;

/**
 * 실패를 보고하는 Operator.
 *
 * <p>인자: {@code ms} (기본 0, 실패 전 대기 시간), {@code mode}
 * ({@code return}이면 false 반환, {@code throw}면 IllegalStateException 발생,
 * {@code error}면 AssertionError 발생, 기본 {@code return})</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class FailingOperator implements Operator {

    public static final String TYPE = "Fail";

    /**
     * 실패 방식.
     */
    public enum Mode {
        RETURN_FALSE,
        THROW,
        ERROR;

        static Mode parse(String value) {
            if ("throw".equalsIgnoreCase(value)) {
                return THROW;
            }
            if ("error".equalsIgnoreCase(value)) {
                return ERROR;
            }
            return RETURN_FALSE;
        }
    }

    private final OperatorDescriptor descriptor;
    private final int ms;
    private final Mode mode;
    private final ExecutionLog log;

    public FailingOperator(OperatorDefinition definition) {
        this(
            definition.descriptor(),
            definition.intArgument("ms", 0),
            Mode.parse(definition.stringArgument("mode", "return")),
            null
        );
    }

    public FailingOperator(OperatorDescriptor descriptor, int ms, Mode mode, ExecutionLog log) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        this.descriptor = descriptor;
        this.ms = ms;
        this.mode = mode;
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
            if (ms > 0) {
                Thread.sleep(ms);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (log != null) {
                log.end(name(), start);
            }
        }
        if (mode == Mode.THROW) {
            throw new IllegalStateException("Operator " + name() + " failed on purpose");
        }
        if (mode == Mode.ERROR) {
            throw new AssertionError("Operator " + name() + " raised an error on purpose");
        }
        return false;
    }
}
