package org.lupenghan.query.models;

import lombok.Getter;

/**
 * DDL 执行中可恢复的失败，由执行器捕获并回滚
 */
@Getter
public class DdlException extends Exception {
    private final ErrorKind kind;

    public DdlException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static DdlException validation(String message) {
        return new DdlException(ErrorKind.VALIDATION, message);
    }

    public static DdlException conflict(String message) {
        return new DdlException(ErrorKind.CONFLICT, message);
    }

    public static DdlException resource(String message) {
        return new DdlException(ErrorKind.RESOURCE, message);
    }
}
