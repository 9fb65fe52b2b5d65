package com.ryuqq.netexec.adapter.runner;

import com.ryuqq.netexec.application.net.NetFactory;
import com.ryuqq.netexec.core.operator.OperatorRegistry;

/**
 * 기본 제공 net 타입과 실행자 연결.
 *
 * <ul>
 *   <li>{@value #DAG}: {@link ParallelNetExecutor} (worker 수는 NetDefinition의 numWorkers)</li>
 *   <li>{@value #SIMPLE}: {@link SequentialNetExecutor}</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class NetTypes {

    public static final String DAG = "dag";
    public static final String SIMPLE = "simple";

    private NetTypes() {
    }

    /**
     * 기본 net 타입이 등록된 NetFactory 생성.
     *
     * @param registry Operator 레지스트리
     * @param baseConfig dag 실행자의 기본 설정 (numWorkers는 NetDefinition 값으로 덮어씀)
     * @return NetFactory
     */
    public static NetFactory newNetFactory(OperatorRegistry registry, ParallelExecutorConfig baseConfig) {
        if (baseConfig == null) {
            throw new IllegalArgumentException("baseConfig cannot be null");
        }
        return new NetFactory(registry)
            .registerExecutor(DAG, definition ->
                new ParallelNetExecutor(baseConfig.withNumWorkers(definition.numWorkers())))
            .registerExecutor(SIMPLE, definition -> new SequentialNetExecutor());
    }

    /**
     * 기본 설정으로 NetFactory 생성.
     */
    public static NetFactory newNetFactory(OperatorRegistry registry) {
        return newNetFactory(registry, new ParallelExecutorConfig());
    }
}
