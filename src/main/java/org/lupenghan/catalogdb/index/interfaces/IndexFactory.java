package org.lupenghan.catalogdb.index.interfaces;

import org.lupenghan.catalogdb.index.models.IndexMetadata;
import org.lupenghan.catalogdb.index.models.PhysicalIndex;

import java.util.Optional;

/**
 * 索引引擎。返回空表示暂时无法构建物理索引，逻辑索引仍可注册为待绑定状态。
 */
public interface IndexFactory {
    Optional<PhysicalIndex> createPhysicalIndex(IndexMetadata metadata);
}
