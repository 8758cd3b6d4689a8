package org.lupenghan.catalogdb.catalog.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.catalogdb.catalog.models.Index;
import org.lupenghan.catalogdb.catalog.models.IndexState;
import org.lupenghan.catalogdb.catalog.models.IndexType;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexSnapshot {
    private String name;
    private IndexType indexType;
    private boolean unique;
    private List<String> keyColumns;
    private IndexState state;

    public static IndexSnapshot of(Index index) {
        return IndexSnapshot.builder()
                .name(index.getName())
                .indexType(index.getIndexType())
                .unique(index.isUnique())
                .keyColumns(index.getKeyColumnNames())
                .state(index.getState())
                .build();
    }
}
