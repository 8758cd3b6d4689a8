package org.lupenghan.catalogdb.index.Impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.index.interfaces.IndexFactory;
import org.lupenghan.catalogdb.index.models.IndexMetadata;
import org.lupenghan.catalogdb.index.models.PhysicalIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存索引引擎。enabled 为 false 时不构建任何物理索引。
 */
@Slf4j
public class IndexFactoryImpl implements IndexFactory {
    @Getter
    private final boolean enabled;
    private final AtomicLong nextIndexId = new AtomicLong(1);
    private final Map<Long, PhysicalIndex> allocated = new ConcurrentHashMap<>();

    public IndexFactoryImpl(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public Optional<PhysicalIndex> createPhysicalIndex(IndexMetadata metadata) {
        if (!enabled) {
            log.debug("索引引擎未启用，索引 {} 暂不构建", metadata.getName());
            return Optional.empty();
        }
        if (metadata.getKeySchema().getColumnCount() == 0) {
            throw new IllegalArgumentException("empty key schema for index " + metadata.getName());
        }
        long indexId = nextIndexId.getAndIncrement();
        PhysicalIndex index = new PhysicalIndex(indexId, metadata, () -> allocated.remove(indexId));
        allocated.put(indexId, index);
        return Optional.of(index);
    }

    public List<PhysicalIndex> getLiveIndexes() {
        return new ArrayList<>(allocated.values());
    }
}
