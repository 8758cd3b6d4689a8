package org.lupenghan.catalogdb.catalog.models;

/**
 * 逻辑索引与物理索引的绑定状态。
 * PENDING_BIND 是合法的已提交状态：索引引擎暂未提供物理句柄，之后可通过
 * {@link Index#bindPhysicalIndex} 补齐。
 */
public enum IndexState {
    BOUND,
    PENDING_BIND
}
