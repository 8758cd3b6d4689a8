package org.lupenghan.parser.statement;

import lombok.Getter;
import org.lupenghan.catalogdb.catalog.models.ValueType;

/**
 * 语句中声明的列类型
 */
@Getter
public enum DataType {
    TINYINT(ValueType.TINYINT),
    SMALLINT(ValueType.SMALLINT),
    INT(ValueType.INTEGER),
    BIGINT(ValueType.BIGINT),
    DOUBLE(ValueType.DOUBLE),
    DECIMAL(ValueType.DECIMAL),
    TIMESTAMP(ValueType.TIMESTAMP),
    CHAR(ValueType.VARCHAR),       // 定长 1
    VARCHAR(ValueType.VARCHAR),
    VARBINARY(ValueType.VARBINARY);

    private final ValueType valueType;

    DataType(ValueType valueType) {
        this.valueType = valueType;
    }

    public static DataType fromName(String name) {
        String upper = name.toUpperCase();
        if (upper.equals("INTEGER")) {
            return INT;
        }
        for (DataType type : values()) {
            if (type.name().equals(upper)) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的数据类型: " + name);
    }
}
