/**
 * Net assembly.
 *
 * <p>{@link com.ryuqq.netexec.application.net.NetFactory} turns a
 * {@link com.ryuqq.netexec.core.model.NetDefinition} into a runnable
 * {@link com.ryuqq.netexec.application.net.Net}: operators come from the
 * {@link com.ryuqq.netexec.core.operator.OperatorRegistry}, the executor from the provider
 * registered for the net type.</p>
 */
package com.ryuqq.netexec.application.net;
