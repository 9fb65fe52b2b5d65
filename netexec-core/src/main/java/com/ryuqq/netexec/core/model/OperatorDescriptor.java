package com.ryuqq.netexec.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator의 정적 선언 (불변 record).
 *
 * <p>Operator가 읽는 blob, 쓰는 blob, 명시적 control 선행자를 선언합니다.
 * 의존성 그래프는 이 선언만 보고 구성되며, Operator의 실제 동작은 보지 않습니다.</p>
 *
 * <p><strong>식별 규칙:</strong></p>
 * <ul>
 *   <li>식별자는 선언 순서(위치) + 이름</li>
 *   <li>동일 이름의 Operator를 여러 개 선언할 수 있으며 서로 alias되지 않음</li>
 *   <li>control 선행자 이름은 그 이름을 가진 가장 최근의 앞선 Operator로 해석됨</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 선언한 입출력과 실제 접근이 다르면 병렬 실행의 정확성이 깨집니다.
 * 이는 호출자의 책임이며 런타임에 검증되지 않습니다.</p>
 *
 * @param name Operator 이름 (null 또는 빈 문자열 불가)
 * @param inputs 읽는 blob 이름 목록 (선언 순서 유지)
 * @param outputs 쓰는 blob 이름 목록 (선언 순서 유지)
 * @param controlPredecessors 명시적 control 선행 Operator 이름 (선언 순서 유지, 중복 제거)
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public record OperatorDescriptor(
    String name,
    List<String> inputs,
    List<String> outputs,
    Set<String> controlPredecessors
) {

    /**
     * Compact Constructor.
     *
     * <p>컬렉션은 방어적으로 복사되어 불변으로 보관됩니다.</p>
     *
     * @throws IllegalArgumentException name이 비어 있거나 blob 이름이 유효하지 않은 경우
     */
    public OperatorDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        inputs = copyBlobNames(inputs, "inputs");
        outputs = copyBlobNames(outputs, "outputs");
        controlPredecessors = copyNames(controlPredecessors);
    }

    /**
     * 입출력만 가진 Descriptor 생성.
     *
     * @param name Operator 이름
     * @param inputs 입력 blob 목록
     * @param outputs 출력 blob 목록
     * @return OperatorDescriptor 인스턴스
     */
    public static OperatorDescriptor of(String name, List<String> inputs, List<String> outputs) {
        return new OperatorDescriptor(name, inputs, outputs, Set.of());
    }

    /**
     * Builder 생성.
     *
     * @param name Operator 이름
     * @return Builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static List<String> copyBlobNames(List<String> names, String field) {
        if (names == null) {
            return List.of();
        }
        for (String blob : names) {
            if (blob == null || blob.isBlank()) {
                throw new IllegalArgumentException(field + " cannot contain null or blank blob names");
            }
        }
        return List.copyOf(names);
    }

    private static Set<String> copyNames(Set<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        for (String predecessor : names) {
            if (predecessor == null || predecessor.isBlank()) {
                throw new IllegalArgumentException("controlPredecessors cannot contain null or blank names");
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    /**
     * OperatorDescriptor Builder.
     */
    public static final class Builder {

        private final String name;
        private final List<String> inputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private final Set<String> controlPredecessors = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder input(String blob) {
            inputs.add(blob);
            return this;
        }

        public Builder inputs(String... blobs) {
            inputs.addAll(List.of(blobs));
            return this;
        }

        public Builder output(String blob) {
            outputs.add(blob);
            return this;
        }

        public Builder outputs(String... blobs) {
            outputs.addAll(List.of(blobs));
            return this;
        }

        public Builder controlPredecessor(String operatorName) {
            controlPredecessors.add(operatorName);
            return this;
        }

        public OperatorDescriptor build() {
            return new OperatorDescriptor(name, inputs, outputs, controlPredecessors);
        }
    }
}
