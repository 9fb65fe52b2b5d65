package com.ryuqq.netexec.application.net;

import com.ryuqq.netexec.core.executor.NetExecutor;
import com.ryuqq.netexec.core.model.NetDefinition;

/**
 * Creates the executor for one net definition.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NetExecutorProvider {

    NetExecutor create(NetDefinition definition);
}
