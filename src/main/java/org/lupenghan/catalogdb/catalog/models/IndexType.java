package org.lupenghan.catalogdb.catalog.models;

/**
 * 索引种类。目前 DDL 只会创建有序多值映射。
 */
public enum IndexType {
    BTREE_MULTIMAP,
    HASH
}
