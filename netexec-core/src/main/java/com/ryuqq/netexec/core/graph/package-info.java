/**
 * Dependency inference and execution graphs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@code BlobAccessTracker} - last writer and readers-since-last-write per blob (build time only)</li>
 *   <li>{@link com.ryuqq.netexec.core.graph.DependencyGraphBuilder} - RAW/WAR/WAW and control edges, in declaration order</li>
 *   <li>{@link com.ryuqq.netexec.core.graph.DependencyGraph} - immutable, reusable DAG over operator indexes</li>
 *   <li>{@link com.ryuqq.netexec.core.graph.ExecutionGraph} - single-use graph with per-node state and unresolved counts</li>
 * </ul>
 *
 * <h2>Edge Rules</h2>
 * <pre>
 * read  b : lastWriter(b) → k                              (RAW)
 * write b : readersSinceLastWrite(b) ∪ lastWriter(b) → k   (WAR, WAW)
 * control p : index(p) → k
 * read after read: no edge
 * </pre>
 *
 * @since 1.0.0
 * @author NetExec Team
 */
package com.ryuqq.netexec.core.graph;
