package org.lupenghan.query.models;

import lombok.Value;

@Value
public class ExecutionResult {
    boolean success;
    ErrorKind errorKind;    // 成功时为 null
    String message;

    public static ExecutionResult success(String message) {
        return new ExecutionResult(true, null, message);
    }

    public static ExecutionResult failure(ErrorKind kind, String message) {
        return new ExecutionResult(false, kind, message);
    }
}
