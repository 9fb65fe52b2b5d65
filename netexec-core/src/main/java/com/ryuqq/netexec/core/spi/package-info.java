/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.netexec.core.spi.Workspace} - named blob storage shared by all operators of a run</li>
 * </ul>
 *
 * @since 1.0.0
 * @author NetExec Team
 */
package com.ryuqq.netexec.core.spi;
