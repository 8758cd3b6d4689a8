package org.lupenghan.catalogdb.catalog.models;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.index.models.PhysicalIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 逻辑索引：键列 + 可选的物理索引句柄。
 * 物理句柄只能绑定一次，未绑定时状态为 {@link IndexState#PENDING_BIND}。
 */
@Slf4j
public class Index {
    @Getter
    private final String name;
    @Getter
    private final IndexType indexType;
    @Getter
    private final boolean unique;
    @Getter
    private final List<Column> keyColumns;
    private volatile PhysicalIndex physicalIndex;

    public Index(String name, IndexType indexType, boolean unique, List<Column> keyColumns) {
        this.name = name;
        this.indexType = indexType;
        this.unique = unique;
        this.keyColumns = Collections.unmodifiableList(new ArrayList<>(keyColumns));
    }

    public synchronized void bindPhysicalIndex(PhysicalIndex physicalIndex) {
        if (physicalIndex == null) {
            throw new IllegalArgumentException("physical index must not be null for " + name);
        }
        if (this.physicalIndex != null) {
            throw new IllegalStateException("index already bound: " + name);
        }
        this.physicalIndex = physicalIndex;
        log.debug("索引 {} 绑定物理索引 {}", name, physicalIndex.getIndexId());
    }

    public IndexState getState() {
        return physicalIndex == null ? IndexState.PENDING_BIND : IndexState.BOUND;
    }

    // 未绑定时为 null
    public PhysicalIndex getPhysicalIndex() {
        return physicalIndex;
    }

    public List<String> getKeyColumnNames() {
        List<String> names = new ArrayList<>(keyColumns.size());
        for (Column column : keyColumns) {
            names.add(column.getName());
        }
        return names;
    }

    /**
     * 销毁索引，释放已绑定的物理句柄
     */
    public synchronized void destroy() {
        if (physicalIndex != null) {
            physicalIndex.release();
            physicalIndex = null;
        }
    }
}
