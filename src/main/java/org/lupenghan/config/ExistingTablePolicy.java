package org.lupenghan.config;

/**
 * CREATE TABLE 遇到同名表时的处理策略。两种策略都不会覆盖已有表。
 */
public enum ExistingTablePolicy {
    /**
     * 沿用旧行为：只有语句带 IF NOT EXISTS 时才在存在性检查处拒绝；
     * 不带时照常构建，最终在加入数据库时因重名被拒绝并回滚。
     */
    REJECT_IF_NOT_EXISTS,

    /**
     * 标准 SQL：带 IF NOT EXISTS 时直接返回成功且不做任何修改，不带时报冲突。
     */
    STANDARD_SQL;

    public static ExistingTablePolicy fromName(String name) {
        for (ExistingTablePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name.trim().replace('-', '_'))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown existing-table policy: " + name);
    }
}
