package com.ryuqq.netexec.application.net;

import com.ryuqq.netexec.core.executor.NetExecutor;
import com.ryuqq.netexec.core.graph.DependencyGraph;
import com.ryuqq.netexec.core.graph.ExecutionGraph;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.outcome.Outcome;
import com.ryuqq.netexec.core.spi.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default {@link Net} implementation created by {@link NetFactory}.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
final class DefaultNet implements Net {

    private static final Logger log = LoggerFactory.getLogger(DefaultNet.class);

    private final String name;
    private final String type;
    private final DependencyGraph dependencyGraph;
    private final List<Operator> operators;
    private final NetExecutor executor;
    private final Workspace workspace;

    DefaultNet(
        String name,
        String type,
        DependencyGraph dependencyGraph,
        List<Operator> operators,
        NetExecutor executor,
        Workspace workspace
    ) {
        this.name = name;
        this.type = type;
        this.dependencyGraph = dependencyGraph;
        this.operators = List.copyOf(operators);
        this.executor = executor;
        this.workspace = workspace;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public DependencyGraph dependencyGraph() {
        return dependencyGraph;
    }

    @Override
    public Outcome run() {
        ExecutionGraph executionGraph = ExecutionGraph.initialize(dependencyGraph, operators);
        log.debug("Running net {} ({}): {} operators, {} ready",
            name, type, executionGraph.size(), executionGraph.initiallyReady().size());

        Outcome outcome = executor.execute(executionGraph, workspace);

        if (outcome.isOk()) {
            log.info("Net {} completed", name);
        } else {
            log.warn("Net {} failed: {}", name, outcome);
        }
        return outcome;
    }

    @Override
    public String toString() {
        return "Net{name=" + name + ", type=" + type + ", operators=" + operators.size() + "}";
    }
}
