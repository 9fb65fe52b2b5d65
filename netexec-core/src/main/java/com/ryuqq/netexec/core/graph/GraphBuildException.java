package com.ryuqq.netexec.core.graph;

/**
 * 의존성 그래프 구성 실패.
 *
 * <p>구성 오류가 발생하면 부분 그래프는 반환되지 않습니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public class GraphBuildException extends RuntimeException {

    public GraphBuildException(String message) {
        super(message);
    }
}
