package org.lupenghan.catalogdb.catalog.models;

import lombok.Getter;

/**
 * 物理值类型及其定长字节数。
 * VARCHAR / VARBINARY 行内只存引用，实际长度取声明的变长长度。
 */
@Getter
public enum ValueType {
    TINYINT(1),
    SMALLINT(2),
    INTEGER(4),
    BIGINT(8),
    DOUBLE(8),
    TIMESTAMP(8),
    DECIMAL(16),
    VARCHAR(8),
    VARBINARY(8);

    private final int size;

    ValueType(int size) {
        this.size = size;
    }

    public boolean isVariableLength() {
        return this == VARCHAR || this == VARBINARY;
    }
}
