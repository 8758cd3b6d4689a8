package org.lupenghan.catalogdb.storage.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.catalog.models.Schema;
import org.lupenghan.catalogdb.storage.interfaces.StorageManager;
import org.lupenghan.catalogdb.storage.models.PhysicalTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存中的物理表分配器：只分配句柄并记录，不落盘。
 */
@Slf4j
public class StorageManagerImpl implements StorageManager {
    private final AtomicLong nextTableId = new AtomicLong(1);
    private final Map<Long, PhysicalTable> allocated = new ConcurrentHashMap<>();

    @Override
    public PhysicalTable createPhysicalTable(int databaseId, Schema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        long tableId = nextTableId.getAndIncrement();
        PhysicalTable table = new PhysicalTable(tableId, databaseId, schema, () -> allocated.remove(tableId));
        allocated.put(tableId, table);
        log.debug("分配物理表 {}，数据库 {}，{} 列", table.getTableId(), databaseId, schema.getColumnCount());
        return table;
    }

    /**
     * 尚未释放的物理表，释放后即从登记中移除
     */
    public List<PhysicalTable> getLiveTables() {
        return new ArrayList<>(allocated.values());
    }
}
