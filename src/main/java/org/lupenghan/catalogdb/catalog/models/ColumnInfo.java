package org.lupenghan.catalogdb.catalog.models;

import lombok.Value;

/**
 * 物理行布局中的一列
 */
@Value
public class ColumnInfo {
    ValueType type;
    int length;
    String name;
    boolean nullable;
    boolean variableLength;
}
