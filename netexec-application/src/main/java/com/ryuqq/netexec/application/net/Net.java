package com.ryuqq.netexec.application.net;

import com.ryuqq.netexec.core.graph.DependencyGraph;
import com.ryuqq.netexec.core.outcome.Outcome;

/**
 * Runnable network of operators.
 *
 * <p>A Net binds an immutable dependency graph, one operator per node, a workspace
 * and the executor selected by the net type. It can be run any number of times;
 * every {@link #run()} starts from a freshly initialized execution graph.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * NetFactory factory = NetTypes.newNetFactory(registry);
 * Net net = factory.create(definition, workspace);
 * Outcome outcome = net.run();
 * if (outcome.isFail()) {
 *     Fail fail = (Fail) outcome;
 *     log.warn("Net {} failed: {}", net.name(), fail.failedOperators());
 * }
 * </pre>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public interface Net {

    /**
     * @return net name from its definition
     */
    String name();

    /**
     * @return net type the executor was chosen by
     */
    String type();

    /**
     * @return dependency graph shared by every run
     */
    DependencyGraph dependencyGraph();

    /**
     * Executes every operator once, blocking until the run completes or aborts.
     *
     * @return Ok when every operator succeeded, Fail otherwise
     */
    Outcome run();
}
