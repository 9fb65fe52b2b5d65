package com.ryuqq.netexec.core.operator;

import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.spi.Workspace;

/**
 * 실행 단위 (opaque operator).
 *
 * <p>스케줄러는 Operator의 {@link #descriptor()}와 {@link #run(Workspace)} 결과만 봅니다.
 * 실제 계산 내용은 구현체의 책임입니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>run()은 동기(blocking)로 수행되며 반드시 종료되어야 합니다.</li>
 *   <li>선언한 입력만 읽고, 선언한 출력만 써야 합니다.</li>
 *   <li>취소 hook은 없습니다. 시작된 run()은 끝까지 수행됩니다.</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public interface Operator {

    /**
     * Operator 선언 조회.
     *
     * @return 이름, 입력, 출력, control 선행자
     */
    OperatorDescriptor descriptor();

    /**
     * Operator 실행.
     *
     * @param workspace blob 저장소
     * @return 성공이면 true, 실패면 false
     */
    boolean run(Workspace workspace);

    /**
     * Operator 이름.
     *
     * @return descriptor의 이름
     */
    default String name() {
        return descriptor().name();
    }
}
