package com.ryuqq.netexec.core.graph;

/**
 * control 선행자 이름이 앞서 선언된 Operator로 해석되지 않는 경우.
 *
 * <p>아직 선언되지 않은 이름(뒤에 선언되는 이름 포함)을 가리키면 발생합니다.
 * 같은 이름의 앞선 Operator가 없다면 자기 이름을 가리키는 경우도 해당합니다.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public class UnknownOperatorReferenceException extends GraphBuildException {

    private final String operatorName;
    private final String reference;

    public UnknownOperatorReferenceException(String operatorName, int operatorIndex, String reference) {
        super(String.format(
            "Operator %s (#%d) declares control predecessor '%s' which is not an earlier operator",
            operatorName, operatorIndex, reference));
        this.operatorName = operatorName;
        this.reference = reference;
    }

    public String getOperatorName() {
        return operatorName;
    }

    public String getReference() {
        return reference;
    }
}
