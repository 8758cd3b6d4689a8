package org.lupenghan.catalogdb.catalog.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.Constraint;
import org.lupenghan.catalogdb.catalog.models.ConstraintType;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintSnapshot {
    private String name;
    private ConstraintType type;
    private String indexName;           // 仅 PRIMARY
    private String referencedTable;     // 仅 FOREIGN
    private List<String> sourceColumns;
    private List<String> sinkColumns;

    public static ConstraintSnapshot of(Constraint constraint) {
        return ConstraintSnapshot.builder()
                .name(constraint.getName())
                .type(constraint.getType())
                .indexName(constraint.getIndex() == null ? null : constraint.getIndex().getName())
                .referencedTable(constraint.getReferencedTable() == null ? null : constraint.getReferencedTable().getName())
                .sourceColumns(names(constraint.getSourceColumns()))
                .sinkColumns(names(constraint.getSinkColumns()))
                .build();
    }

    private static List<String> names(List<Column> columns) {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.getName());
        }
        return names;
    }
}
