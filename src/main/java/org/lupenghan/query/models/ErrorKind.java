package org.lupenghan.query.models;

/**
 * 可恢复的 DDL 失败种类。程序契约被破坏时直接抛 IllegalStateException，不在此列。
 */
public enum ErrorKind {
    // 引用了不存在的列/表、重复列名、缺少索引列、空键列表
    VALIDATION,
    // 目标名字已存在，或加入容器时重名
    CONFLICT,
    // 无法从存储层 / 索引引擎拿到物理句柄
    RESOURCE
}
