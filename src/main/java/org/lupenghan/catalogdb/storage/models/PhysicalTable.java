package org.lupenghan.catalogdb.storage.models;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.lupenghan.catalogdb.catalog.models.Schema;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 存储层返回的物理表句柄。目录层只关心它的 Schema 和生命周期。
 */
@Getter
@ToString(exclude = {"released", "onRelease"})
public class PhysicalTable {
    private final long tableId;       // 存储层分配的表ID
    private final int databaseId;     // 所属数据库ID
    private final Schema schema;      // 行布局
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final Runnable onRelease; // 释放时通知分配方

    public PhysicalTable(long tableId, int databaseId, Schema schema) {
        this(tableId, databaseId, schema, () -> { });
    }

    public PhysicalTable(long tableId, int databaseId, Schema schema, Runnable onRelease) {
        this.tableId = tableId;
        this.databaseId = databaseId;
        this.schema = schema;
        this.onRelease = onRelease;
    }

    /**
     * 释放句柄，重复调用无副作用
     * @return 本次调用是否真正释放
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        onRelease.run();
        return true;
    }

    public boolean isReleased() {
        return released.get();
    }
}
