package org.lupenghan.catalogdb.catalog.models;

import lombok.Value;

/**
 * 列定义（值对象），由所属 Table 持有
 */
@Value
public class Column {
    String name;            // 列名
    ValueType type;         // 值类型
    int offset;             // 在表中的序号，从 0 开始严格递增
    int length;             // 字节长度
    boolean notNull;        // 是否 NOT NULL
}
