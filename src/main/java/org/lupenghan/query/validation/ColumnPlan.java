package org.lupenghan.query.validation;

import lombok.Value;
import org.lupenghan.catalogdb.catalog.models.ValueType;

/**
 * 普通列：已经算好物理长度
 */
@Value
public class ColumnPlan implements TablePlan.Step {
    String name;
    ValueType type;
    int length;
    boolean notNull;
    boolean variableLength;
}
