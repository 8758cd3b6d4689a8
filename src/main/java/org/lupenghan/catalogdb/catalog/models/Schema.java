package org.lupenghan.catalogdb.catalog.models;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 物理行布局：有序的 ColumnInfo 列表，创建后不可变。
 */
@ToString
@EqualsAndHashCode
public class Schema {
    private final List<ColumnInfo> columns;

    public Schema(List<ColumnInfo> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * 按给定下标投影出一个新的 Schema，顺序与 keyAttrs 一致（用于索引键）。
     */
    public static Schema copySchema(Schema schema, List<Integer> keyAttrs) {
        List<ColumnInfo> projected = new ArrayList<>(keyAttrs.size());
        for (int attr : keyAttrs) {
            if (attr < 0 || attr >= schema.getColumnCount()) {
                throw new IndexOutOfBoundsException("column offset " + attr + " out of schema range " + schema.getColumnCount());
            }
            projected.add(schema.getColumn(attr));
        }
        return new Schema(projected);
    }

    public List<ColumnInfo> getColumns() {
        return columns;
    }

    public ColumnInfo getColumn(int offset) {
        return columns.get(offset);
    }

    public int getColumnCount() {
        return columns.size();
    }

    // 所有列的行内长度之和
    public int getLength() {
        int length = 0;
        for (ColumnInfo column : columns) {
            length += column.getLength();
        }
        return length;
    }
}
