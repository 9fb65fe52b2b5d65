package com.ryuqq.netexec.core.statemachine;

/**
 * 노드 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → READY</li>
 *   <li>READY → RUNNING</li>
 *   <li>RUNNING → DONE</li>
 *   <li>RUNNING → FAILED</li>
 * </ul>
 *
 * <p>종료 상태(DONE, FAILED)에서는 어떤 상태로도 전이할 수 없고, 역방향 전이도 불가합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public final class NodeStateTransition {

    private NodeStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(NodeState from, NodeState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == NodeState.READY;
            case READY -> to == NodeState.RUNNING;
            case RUNNING -> to == NodeState.DONE || to == NodeState.FAILED;
            case DONE, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 가능 여부 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이면 true, 둘 중 하나라도 null이면 false
     */
    public static boolean isAllowed(NodeState from, NodeState to) {
        if (from == null || to == null) {
            return false;
        }
        try {
            validate(from, to);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }
}
