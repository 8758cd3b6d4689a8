package org.lupenghan.catalogdb.catalog.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 目录的只读快照（用于导出 / 持久化 / 比较）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogSnapshot {
    private List<DatabaseSnapshot> databases;   // 按创建顺序
}
