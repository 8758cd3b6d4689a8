package org.lupenghan.catalogdb.catalog.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.ValueType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnSnapshot {
    private String name;
    private ValueType type;
    private int offset;
    private int length;
    private boolean notNull;

    public static ColumnSnapshot of(Column column) {
        return new ColumnSnapshot(column.getName(), column.getType(), column.getOffset(),
                column.getLength(), column.isNotNull());
    }
}
