package org.lupenghan.catalogdb.catalog.models;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.lock.models.CatalogLock;
import org.lupenghan.catalogdb.lock.models.LockGuard;
import org.lupenghan.catalogdb.storage.models.PhysicalTable;

import java.util.ArrayList;
import java.util.List;

/**
 * 表：逻辑列、约束、索引，以及绑定的物理表。
 *
 * 表独占它的 Column / Constraint / Index。所有 add 方法都要求调用方
 * 已持有本表的写锁；读方法自行获取读锁。
 * {@link #destroy()} 是唯一的删除路径，回滚时调用。
 */
@Slf4j
public class Table {
    @Getter
    private final String name;
    @Getter
    private final CatalogLock lock;
    private final List<Column> columns = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final List<Index> indexes = new ArrayList<>();
    private PhysicalTable physicalTable;

    public Table(String name) {
        this.name = name;
        this.lock = new CatalogLock("table:" + name);
    }

    //===------------------------------------------------------------===//
    // 写操作（需持有写锁）
    //===------------------------------------------------------------===//

    public boolean addColumn(Column column) {
        lock.checkWriteHeld();
        if (findColumn(column.getName()) != null) {
            return false;
        }
        columns.add(column);
        return true;
    }

    public boolean addConstraint(Constraint constraint) {
        lock.checkWriteHeld();
        for (Constraint c : constraints) {
            if (c.getName().equals(constraint.getName())) {
                return false;
            }
        }
        constraints.add(constraint);
        return true;
    }

    public boolean addIndex(Index index) {
        lock.checkWriteHeld();
        if (findIndex(index.getName()) != null) {
            return false;
        }
        indexes.add(index);
        return true;
    }

    public void setPhysicalTable(PhysicalTable physicalTable) {
        lock.checkWriteHeld();
        if (this.physicalTable != null) {
            throw new IllegalStateException("physical table already bound: " + name);
        }
        this.physicalTable = physicalTable;
    }

    //===------------------------------------------------------------===//
    // 读操作
    //===------------------------------------------------------------===//

    public Column getColumn(String columnName) {
        try (LockGuard ignored = lock.read()) {
            return findColumn(columnName);
        }
    }

    public Index getIndex(String indexName) {
        try (LockGuard ignored = lock.read()) {
            return findIndex(indexName);
        }
    }

    public Constraint getConstraint(String constraintName) {
        try (LockGuard ignored = lock.read()) {
            for (Constraint c : constraints) {
                if (c.getName().equals(constraintName)) {
                    return c;
                }
            }
            return null;
        }
    }

    public List<Column> getColumns() {
        try (LockGuard ignored = lock.read()) {
            return new ArrayList<>(columns);
        }
    }

    public List<Constraint> getConstraints() {
        try (LockGuard ignored = lock.read()) {
            return new ArrayList<>(constraints);
        }
    }

    public List<Index> getIndexes() {
        try (LockGuard ignored = lock.read()) {
            return new ArrayList<>(indexes);
        }
    }

    public PhysicalTable getPhysicalTable() {
        try (LockGuard ignored = lock.read()) {
            return physicalTable;
        }
    }

    // 物理表尚未绑定时为 null
    public Schema getSchema() {
        PhysicalTable table = getPhysicalTable();
        return table == null ? null : table.getSchema();
    }

    /**
     * 释放本表拥有的全部对象及物理句柄
     */
    public void destroy() {
        try (LockGuard ignored = lock.write()) {
            for (Index index : indexes) {
                index.destroy();
            }
            if (physicalTable != null) {
                physicalTable.release();
                physicalTable = null;
            }
            indexes.clear();
            constraints.clear();
            columns.clear();
        }
        log.debug("表 {} 已销毁", name);
    }

    private Column findColumn(String columnName) {
        for (Column column : columns) {
            if (column.getName().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    private Index findIndex(String indexName) {
        for (Index index : indexes) {
            if (index.getName().equals(indexName)) {
                return index;
            }
        }
        return null;
    }
}
