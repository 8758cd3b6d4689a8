package org.lupenghan.catalogdb.catalog.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.Constraint;
import org.lupenghan.catalogdb.catalog.models.Index;
import org.lupenghan.catalogdb.catalog.models.Table;
import org.lupenghan.catalogdb.storage.models.PhysicalTable;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableSnapshot {
    private String name;
    private List<ColumnSnapshot> columns;
    private List<ConstraintSnapshot> constraints;
    private List<IndexSnapshot> indexes;
    private long physicalTableId;       // 未绑定时为 -1

    public static TableSnapshot of(Table table) {
        List<ColumnSnapshot> columns = new ArrayList<>();
        for (Column column : table.getColumns()) {
            columns.add(ColumnSnapshot.of(column));
        }
        List<ConstraintSnapshot> constraints = new ArrayList<>();
        for (Constraint constraint : table.getConstraints()) {
            constraints.add(ConstraintSnapshot.of(constraint));
        }
        List<IndexSnapshot> indexes = new ArrayList<>();
        for (Index index : table.getIndexes()) {
            indexes.add(IndexSnapshot.of(index));
        }
        PhysicalTable physical = table.getPhysicalTable();
        return TableSnapshot.builder()
                .name(table.getName())
                .columns(columns)
                .constraints(constraints)
                .indexes(indexes)
                .physicalTableId(physical == null ? -1 : physical.getTableId())
                .build();
    }
}
