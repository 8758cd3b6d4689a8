package org.lupenghan.catalogdb.storage.interfaces;

import org.lupenghan.catalogdb.catalog.models.Schema;
import org.lupenghan.catalogdb.storage.models.PhysicalTable;

/**
 * 物理表存储。给定合法 Schema 时总能返回句柄。
 */
public interface StorageManager {
    PhysicalTable createPhysicalTable(int databaseId, Schema schema);
}
