package org.lupenghan.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CatalogConfig {
    public static final String DEFAULT_DB_NAME = "default";

    @Builder.Default
    String defaultDatabaseName = DEFAULT_DB_NAME;

    @Builder.Default
    ExistingTablePolicy existingTablePolicy = ExistingTablePolicy.REJECT_IF_NOT_EXISTS;

    // 为 true 时，索引引擎不给物理句柄就拒绝建索引
    @Builder.Default
    boolean requirePhysicalIndex = false;

    @Builder.Default
    boolean indexEngineEnabled = false;

    @Builder.Default
    String catalogDir = "data/catalog/";

    public static CatalogConfig defaults() {
        return CatalogConfig.builder().build();
    }

    public void validate() {
        if (defaultDatabaseName == null || defaultDatabaseName.isBlank()) {
            throw new IllegalArgumentException("default database name must not be blank");
        }
        if (catalogDir == null || catalogDir.isBlank()) {
            throw new IllegalArgumentException("catalog dir must not be blank");
        }
        if (requirePhysicalIndex && !indexEngineEnabled) {
            throw new IllegalArgumentException("require-physical-index needs the index engine to be enabled");
        }
    }

    public String getConfigurationSummary() {
        return String.format("defaultDatabase=%s, existingTablePolicy=%s, requirePhysicalIndex=%s, indexEngineEnabled=%s, catalogDir=%s",
                defaultDatabaseName, existingTablePolicy, requirePhysicalIndex, indexEngineEnabled, catalogDir);
    }
}
