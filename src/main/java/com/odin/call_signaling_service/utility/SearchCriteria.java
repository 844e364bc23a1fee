package com.odin.call_signaling_service.utility;

/**
 * One filter of a core profile search; {@code condition} joins it to the
 * previous one ("AND", "OR").
 */
public class SearchCriteria {
    private String key;
    private String operation;
    private Object value;
    private String condition;

    public SearchCriteria(String key, String operation, Object value, String condition) {
        this.key = key;
        this.operation = operation;
        this.value = value;
        this.condition = condition;
    }

    public String getKey() {
        return key;
    }

    public String getOperation() {
        return operation;
    }

    public Object getValue() {
        return value;
    }

    public String getCondition() {
        return condition;
    }
}
