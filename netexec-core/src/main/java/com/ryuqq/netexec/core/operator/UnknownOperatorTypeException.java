package com.ryuqq.netexec.core.operator;

/**
 * 등록되지 않은 Operator 타입을 요청한 경우.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public class UnknownOperatorTypeException extends RuntimeException {

    private final String type;

    public UnknownOperatorTypeException(String type, String operatorName) {
        super("Operator " + operatorName + " has unregistered type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
