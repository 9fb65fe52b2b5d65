package com.ryuqq.netexec.core.spi;

import java.util.Set;

/**
 * Blob 저장소 SPI.
 *
 * <p>Workspace는 이름으로 식별되는 blob을 보관하며, 한 번의 실행(run)보다 오래 살아있습니다.
 * Operator는 실행 중 자신이 선언한 입력 blob을 읽고 출력 blob을 씁니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>구현체는 서로 다른 blob에 대한 동시 접근을 허용해야 합니다.</li>
 *   <li>동일 blob에 대한 경쟁 접근은 의존성 그래프가 직렬화하므로 blob 단위 잠금은 필요 없습니다.</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public interface Workspace {

    /**
     * Blob 존재 여부 확인.
     *
     * @param name blob 이름
     * @return 존재하면 true
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    boolean hasBlob(String name);

    /**
     * Blob 조회.
     *
     * @param name blob 이름
     * @return blob 내용
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     * @throws IllegalStateException blob이 존재하지 않는 경우
     */
    Object getBlob(String name);

    /**
     * 타입을 지정한 Blob 조회.
     *
     * @param name blob 이름
     * @param type 기대 타입
     * @param <T> blob 타입
     * @return blob 내용
     * @throws IllegalStateException blob이 존재하지 않거나 타입이 다른 경우
     */
    <T> T getBlob(String name, Class<T> type);

    /**
     * Blob 저장 (없으면 생성, 있으면 교체).
     *
     * @param name blob 이름
     * @param content blob 내용 (null 불가)
     * @throws IllegalArgumentException name 또는 content가 null인 경우
     */
    void putBlob(String name, Object content);

    /**
     * Blob 삭제.
     *
     * @param name blob 이름
     * @return 삭제되었으면 true
     */
    boolean removeBlob(String name);

    /**
     * 현재 보관 중인 blob 이름 (스냅샷).
     *
     * @return blob 이름 집합
     */
    Set<String> blobNames();

    /**
     * 모든 blob 삭제.
     */
    void clear();
}
