package org.lupenghan.catalogdb.catalog.models;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 主键 / 外键约束。
 * PRIMARY：index 非空，referencedTable 为空，sinkColumns 为空。
 * FOREIGN：index 为空，referencedTable 非空。
 */
@Getter
public class Constraint {
    private final String name;
    private final ConstraintType type;
    private final Index index;
    private final Table referencedTable;
    private final List<Column> sourceColumns;
    private final List<Column> sinkColumns;

    public Constraint(String name, ConstraintType type, Index index, Table referencedTable,
                      List<Column> sourceColumns, List<Column> sinkColumns) {
        this.name = name;
        this.type = type;
        this.index = index;
        this.referencedTable = referencedTable;
        this.sourceColumns = Collections.unmodifiableList(new ArrayList<>(sourceColumns));
        this.sinkColumns = Collections.unmodifiableList(new ArrayList<>(sinkColumns));
    }

    public static Constraint primary(String name, Index index) {
        return new Constraint(name, ConstraintType.PRIMARY, index, null, index.getKeyColumns(), List.of());
    }

    public static Constraint foreign(String name, Table referencedTable, List<Column> sourceColumns, List<Column> sinkColumns) {
        return new Constraint(name, ConstraintType.FOREIGN, null, referencedTable, sourceColumns, sinkColumns);
    }
}
