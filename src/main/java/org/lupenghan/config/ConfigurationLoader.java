package org.lupenghan.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 按 命令行参数 > 环境变量 > 默认值 的顺序加载 {@link CatalogConfig}
 */
@Slf4j
public class ConfigurationLoader {
    static final String ENV_DEFAULT_DATABASE = "CATALOGDB_DEFAULT_DATABASE";
    static final String ENV_EXISTING_TABLE_POLICY = "CATALOGDB_EXISTING_TABLE_POLICY";
    static final String ENV_REQUIRE_PHYSICAL_INDEX = "CATALOGDB_REQUIRE_PHYSICAL_INDEX";
    static final String ENV_INDEX_ENGINE_ENABLED = "CATALOGDB_INDEX_ENGINE_ENABLED";
    static final String ENV_CATALOG_DIR = "CATALOGDB_CATALOG_DIR";

    private final Map<String, String> env;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> env) {
        this.env = env;
    }

    public CatalogConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        CatalogConfig.CatalogConfigBuilder builder = CatalogConfig.builder();
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        CatalogConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(CatalogConfig.CatalogConfigBuilder builder) {
        if (env.containsKey(ENV_DEFAULT_DATABASE)) {
            builder.defaultDatabaseName(env.get(ENV_DEFAULT_DATABASE));
        }
        if (env.containsKey(ENV_EXISTING_TABLE_POLICY)) {
            builder.existingTablePolicy(ExistingTablePolicy.fromName(env.get(ENV_EXISTING_TABLE_POLICY)));
        }
        if (env.containsKey(ENV_REQUIRE_PHYSICAL_INDEX)) {
            builder.requirePhysicalIndex(Boolean.parseBoolean(env.get(ENV_REQUIRE_PHYSICAL_INDEX)));
        }
        if (env.containsKey(ENV_INDEX_ENGINE_ENABLED)) {
            builder.indexEngineEnabled(Boolean.parseBoolean(env.get(ENV_INDEX_ENGINE_ENABLED)));
        }
        if (env.containsKey(ENV_CATALOG_DIR)) {
            builder.catalogDir(env.get(ENV_CATALOG_DIR));
        }
    }

    private void applyCLIArguments(CatalogConfig.CatalogConfigBuilder builder, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--catalog.")) {
                continue;
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            String value = args[++i];
            switch (arg) {
                case "--catalog.default-database" -> builder.defaultDatabaseName(value);
                case "--catalog.existing-table-policy" -> builder.existingTablePolicy(ExistingTablePolicy.fromName(value));
                case "--catalog.require-physical-index" -> builder.requirePhysicalIndex(Boolean.parseBoolean(value));
                case "--catalog.index-engine-enabled" -> builder.indexEngineEnabled(Boolean.parseBoolean(value));
                case "--catalog.dir" -> builder.catalogDir(value);
                default -> {
                    log.warn("Unknown configuration argument: {}", arg);
                }
            }
        }
    }
}
