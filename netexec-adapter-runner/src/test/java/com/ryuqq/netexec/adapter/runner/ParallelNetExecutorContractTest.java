package com.ryuqq.netexec.adapter.runner;

import com.ryuqq.netexec.core.executor.NetExecutor;
import com.ryuqq.netexec.testkit.contract.AbstractNetExecutorContractTest;

/**
 * ParallelNetExecutor 계약 테스트.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
class ParallelNetExecutorContractTest extends AbstractNetExecutorContractTest {

    @Override
    protected NetExecutor createExecutor() {
        return new ParallelNetExecutor(new ParallelExecutorConfig().withNumWorkers(4));
    }
}
