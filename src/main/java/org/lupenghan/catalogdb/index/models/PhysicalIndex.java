package org.lupenghan.catalogdb.index.models;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 索引引擎返回的物理索引句柄
 */
@Getter
@ToString(exclude = {"released", "onRelease"})
public class PhysicalIndex {
    private final long indexId;
    private final IndexMetadata metadata;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final Runnable onRelease;

    public PhysicalIndex(long indexId, IndexMetadata metadata) {
        this(indexId, metadata, () -> { });
    }

    public PhysicalIndex(long indexId, IndexMetadata metadata, Runnable onRelease) {
        this.indexId = indexId;
        this.metadata = metadata;
        this.onRelease = onRelease;
    }

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
