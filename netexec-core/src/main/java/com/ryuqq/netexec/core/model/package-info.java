/**
 * Net and operator declarations.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.netexec.core.model.OperatorDescriptor} - name, input/output blobs, control predecessors</li>
 *   <li>{@link com.ryuqq.netexec.core.model.OperatorDefinition} - descriptor plus operator type and arguments</li>
 *   <li>{@link com.ryuqq.netexec.core.model.NetDefinition} - ordered operator definitions, net type, worker count</li>
 * </ul>
 *
 * <p>All types are immutable records validated in their compact constructors.</p>
 *
 * @since 1.0.0
 * @author NetExec Team
 */
package com.ryuqq.netexec.core.model;
