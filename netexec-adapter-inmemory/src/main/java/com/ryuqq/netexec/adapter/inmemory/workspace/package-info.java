/**
 * In-memory workspace adapter.
 *
 * <p>{@link com.ryuqq.netexec.adapter.inmemory.workspace.InMemoryWorkspace} is the reference
 * {@link com.ryuqq.netexec.core.spi.Workspace} used by tests and single-process deployments.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
package com.ryuqq.netexec.adapter.inmemory.workspace;
