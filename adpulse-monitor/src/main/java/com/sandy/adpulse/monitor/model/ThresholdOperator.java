package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied by an alert threshold to an incoming metric value.
 */
public enum ThresholdOperator {
    GT("gt"),
    LT("lt"),
    EQ("eq"),
    NEQ("neq"),
    BETWEEN("between");

    private final String code;

    ThresholdOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @param current   observed metric value
     * @param value     threshold value (lower bound for BETWEEN)
     * @param maxValue  upper bound, only read for BETWEEN; null makes BETWEEN fail closed
     * @param tolerance absolute tolerance used by EQ / NEQ
     */
    public boolean matches(double current, double value, Double maxValue, double tolerance) {
        switch (this) {
            case GT:
                return current > value;
            case LT:
                return current < value;
            case EQ:
                return Math.abs(current - value) < tolerance;
            case NEQ:
                return Math.abs(current - value) >= tolerance;
            case BETWEEN:
                return maxValue != null && current >= value && current <= maxValue;
            default:
                return false;
        }
    }

    @JsonCreator
    public static ThresholdOperator fromCode(String code) {
        for (ThresholdOperator op : values()) {
            if (op.code.equalsIgnoreCase(code) || op.name().equalsIgnoreCase(code)) return op;
        }
        // long forms used by older clients
        switch (code == null ? "" : code.toLowerCase()) {
            case "greater_than": return GT;
            case "less_than": return LT;
            case "equals": return EQ;
            case "not_equals": return NEQ;
            default: throw new IllegalArgumentException("Unknown operator: " + code);
        }
    }
}
