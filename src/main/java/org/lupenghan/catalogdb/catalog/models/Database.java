package org.lupenghan.catalogdb.catalog.models;

import lombok.AccessLevel;
import lombok.Getter;
import org.lupenghan.catalogdb.lock.models.CatalogLock;
import org.lupenghan.catalogdb.lock.models.LockGuard;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据库：表名 -> 表。表一旦加入即归本库所有。
 */
@Getter
public class Database {
    private final int id;
    private final String name;
    private final CatalogLock lock;
    @Getter(AccessLevel.NONE)
    private final Map<String, Table> tables = new LinkedHashMap<>();

    public Database(int id, String name) {
        this.id = id;
        this.name = name;
        this.lock = new CatalogLock("database:" + name);
    }

    /**
     * 加入一张表，同名表已存在时返回 false。调用方需持有写锁。
     */
    public boolean addTable(Table table) {
        lock.checkWriteHeld();
        if (tables.containsKey(table.getName())) {
            return false;
        }
        tables.put(table.getName(), table);
        return true;
    }

    public Table getTable(String tableName) {
        try (LockGuard ignored = lock.read()) {
            return tables.get(tableName);
        }
    }

    public List<Table> getTables() {
        try (LockGuard ignored = lock.read()) {
            return new ArrayList<>(tables.values());
        }
    }

    public int getTableCount() {
        try (LockGuard ignored = lock.read()) {
            return tables.size();
        }
    }

    public void destroy() {
        List<Table> owned;
        try (LockGuard ignored = lock.write()) {
            owned = new ArrayList<>(tables.values());
            tables.clear();
        }
        for (Table table : owned) {
            table.destroy();
        }
    }
}
