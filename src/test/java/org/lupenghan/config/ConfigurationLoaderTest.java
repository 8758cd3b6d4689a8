package org.lupenghan.config;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ConfigurationLoaderTest {

    @Test
    public void testDefaults() {
        CatalogConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(new String[0]);
        assertEquals("default", config.getDefaultDatabaseName());
        assertEquals(ExistingTablePolicy.REJECT_IF_NOT_EXISTS, config.getExistingTablePolicy());
        assertFalse(config.isRequirePhysicalIndex());
        assertFalse(config.isIndexEngineEnabled());
        assertEquals("data/catalog/", config.getCatalogDir());
    }

    @Test
    public void testArgsOverrideEnvironment() {
        Map<String, String> env = Map.of(
                ConfigurationLoader.ENV_DEFAULT_DATABASE, "from_env",
                ConfigurationLoader.ENV_EXISTING_TABLE_POLICY, "standard-sql",
                ConfigurationLoader.ENV_INDEX_ENGINE_ENABLED, "true");
        String[] args = {"--catalog.default-database", "from_args", "--catalog.require-physical-index", "true"};

        CatalogConfig config = new ConfigurationLoader(env).loadConfiguration(args);

        assertEquals("from_args", config.getDefaultDatabaseName());
        assertEquals(ExistingTablePolicy.STANDARD_SQL, config.getExistingTablePolicy());
        assertTrue(config.isIndexEngineEnabled());
        assertTrue(config.isRequirePhysicalIndex());
    }

    @Test
    public void testInvalidConfiguration() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        assertThrows(IllegalArgumentException.class,
                () -> loader.loadConfiguration(new String[]{"--catalog.default-database", " "}));
        assertThrows(IllegalArgumentException.class,
                () -> loader.loadConfiguration(new String[]{"--catalog.require-physical-index", "true"}));
        assertThrows(IllegalArgumentException.class,
                () -> loader.loadConfiguration(new String[]{"--catalog.existing-table-policy", "overwrite"}));
        assertThrows(IllegalArgumentException.class,
                () -> loader.loadConfiguration(new String[]{"--catalog.dir"}));
    }
}
