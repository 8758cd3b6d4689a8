package org.lupenghan.catalogdb.catalog.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.catalogdb.catalog.models.Database;
import org.lupenghan.catalogdb.catalog.models.Table;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseSnapshot {
    private int id;
    private String name;
    private List<TableSnapshot> tables;

    public static DatabaseSnapshot of(Database database) {
        List<TableSnapshot> tables = new ArrayList<>();
        for (Table table : database.getTables()) {
            tables.add(TableSnapshot.of(table));
        }
        return DatabaseSnapshot.builder()
                .id(database.getId())
                .name(database.getName())
                .tables(tables)
                .build();
    }
}
