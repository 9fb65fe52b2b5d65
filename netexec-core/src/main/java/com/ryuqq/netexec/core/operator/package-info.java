/**
 * Operator contract and the explicit operator-type registry.
 *
 * <ul>
 *   <li>{@link com.ryuqq.netexec.core.operator.Operator} - opaque unit: descriptor plus a blocking run action</li>
 *   <li>{@link com.ryuqq.netexec.core.operator.OperatorFactory} - creates an operator from its definition</li>
 *   <li>{@link com.ryuqq.netexec.core.operator.OperatorRegistry} - type name to factory mapping, passed around explicitly</li>
 * </ul>
 *
 * @since 1.0.0
 * @author NetExec Team
 */
package com.ryuqq.netexec.core.operator;
