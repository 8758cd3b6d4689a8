package org.lupenghan.catalogdb.catalog.Impl;

import org.junit.Test;
import org.lupenghan.catalogdb.catalog.models.Database;
import org.lupenghan.catalogdb.catalog.snapshot.CatalogSnapshot;
import org.lupenghan.catalogdb.lock.models.LockGuard;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class CatalogImplTest {

    @Test
    public void testBootstrapRegistersDefaultDatabase() {
        CatalogImpl catalog = CatalogImpl.bootstrap("main");
        Database main = catalog.getDatabase("main");
        assertNotNull(main);
        assertEquals(0, main.getId());
        assertEquals(1, catalog.getDatabases().size());
        assertNull(catalog.getDatabase("default"));
    }

    @Test
    public void testAddDatabase() {
        CatalogImpl catalog = CatalogImpl.bootstrap("main");
        Database sales = new Database(catalog.allocateDatabaseId(), "sales");

        assertThrows(IllegalStateException.class, () -> catalog.addDatabase(sales));
        try (LockGuard ignored = catalog.getLock().write()) {
            assertTrue(catalog.addDatabase(sales));
            assertFalse(catalog.addDatabase(new Database(catalog.allocateDatabaseId(), "sales")));
        }
        assertEquals(2, catalog.getDatabases().size());
    }

    @Test
    public void testSnapshotAndShutdown() {
        CatalogImpl catalog = CatalogImpl.bootstrap("main");
        CatalogSnapshot snapshot = catalog.snapshot();
        assertEquals(1, snapshot.getDatabases().size());
        assertEquals("main", snapshot.getDatabases().get(0).getName());
        assertTrue(snapshot.getDatabases().get(0).getTables().isEmpty());

        catalog.shutdown();
        assertTrue(catalog.getDatabases().isEmpty());
    }
}
