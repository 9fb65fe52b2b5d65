package com.ryuqq.netexec.application.net;

import com.ryuqq.netexec.core.executor.NetExecutor;
import com.ryuqq.netexec.core.graph.DependencyGraph;
import com.ryuqq.netexec.core.graph.DependencyGraphBuilder;
import com.ryuqq.netexec.core.model.NetDefinition;
import com.ryuqq.netexec.core.operator.Operator;
import com.ryuqq.netexec.core.operator.OperatorRegistry;
import com.ryuqq.netexec.core.spi.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assembles {@link Net} instances from definitions.
 *
 * <p><strong>Assembly Flow:</strong></p>
 * <pre>
 * create(definition, workspace)
 *   ↓
 * 1. Resolve executor provider by net type (unknown → IllegalArgumentException)
 * 2. Create operators through OperatorRegistry
 * 3. Build dependency graph (GraphBuildException on invalid control references)
 * 4. Create executor and bind everything into a Net
 * </pre>
 *
 * <p>Executor providers are registered explicitly per factory instance; there is
 * no global registry.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class NetFactory {

    private static final Logger log = LoggerFactory.getLogger(NetFactory.class);

    private final OperatorRegistry operatorRegistry;
    private final DependencyGraphBuilder graphBuilder;
    private final Map<String, NetExecutorProvider> executorProviders = new ConcurrentHashMap<>();

    /**
     * Constructor.
     *
     * @param operatorRegistry registry used to create operators
     * @throws IllegalArgumentException if operatorRegistry is null
     */
    public NetFactory(OperatorRegistry operatorRegistry) {
        this(operatorRegistry, new DependencyGraphBuilder());
    }

    /**
     * Constructor.
     *
     * @param operatorRegistry registry used to create operators
     * @param graphBuilder dependency graph builder
     * @throws IllegalArgumentException if any parameter is null
     */
    public NetFactory(OperatorRegistry operatorRegistry, DependencyGraphBuilder graphBuilder) {
        if (operatorRegistry == null) {
            throw new IllegalArgumentException("operatorRegistry cannot be null");
        }
        if (graphBuilder == null) {
            throw new IllegalArgumentException("graphBuilder cannot be null");
        }
        this.operatorRegistry = operatorRegistry;
        this.graphBuilder = graphBuilder;
    }

    /**
     * Registers the executor provider for a net type.
     *
     * @param type net type (e.g. "dag", "simple")
     * @param provider executor provider
     * @return this factory
     * @throws IllegalArgumentException if type is blank or provider is null
     * @throws IllegalStateException if the type is already registered
     */
    public NetFactory registerExecutor(String type, NetExecutorProvider provider) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (executorProviders.putIfAbsent(type, provider) != null) {
            throw new IllegalStateException("Net type already registered: " + type);
        }
        return this;
    }

    public boolean supports(String type) {
        return type != null && executorProviders.containsKey(type);
    }

    public Set<String> supportedTypes() {
        return new TreeSet<>(executorProviders.keySet());
    }

    /**
     * Creates a runnable net.
     *
     * @param definition net definition
     * @param workspace workspace the net reads and writes
     * @return net bound to the executor for definition.type()
     * @throws IllegalArgumentException if a parameter is null or the net type is unknown
     * @throws com.ryuqq.netexec.core.operator.UnknownOperatorTypeException if an operator type is unknown
     * @throws com.ryuqq.netexec.core.graph.GraphBuildException if the dependency graph cannot be built
     */
    public Net create(NetDefinition definition, Workspace workspace) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        NetExecutorProvider provider = executorProviders.get(definition.type());
        if (provider == null) {
            throw new IllegalArgumentException(
                "Unknown net type: " + definition.type() + " (supported: " + supportedTypes() + ")"
            );
        }

        List<Operator> operators = operatorRegistry.createAll(definition.operators());
        DependencyGraph graph = graphBuilder.build(definition.descriptors());
        NetExecutor executor = provider.create(definition);
        if (executor == null) {
            throw new IllegalStateException("Executor provider returned null for net type: " + definition.type());
        }

        log.debug("Created net {} ({}): {} operators, {} edges",
            definition.name(), definition.type(), graph.size(), graph.edgeCount());
        return new DefaultNet(definition.name(), definition.type(), graph, operators, executor, workspace);
    }
}
