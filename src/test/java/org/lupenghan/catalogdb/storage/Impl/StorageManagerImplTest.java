package org.lupenghan.catalogdb.storage.Impl;

import org.junit.Test;
import org.lupenghan.catalogdb.catalog.models.ColumnInfo;
import org.lupenghan.catalogdb.catalog.models.Schema;
import org.lupenghan.catalogdb.catalog.models.ValueType;
import org.lupenghan.catalogdb.storage.models.PhysicalTable;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class StorageManagerImplTest {
    private final Schema schema = new Schema(List.of(new ColumnInfo(ValueType.INTEGER, 4, "id", true, false)));

    @Test
    public void testReleasedTablesAreForgotten() {
        StorageManagerImpl storageManager = new StorageManagerImpl();
        PhysicalTable first = storageManager.createPhysicalTable(0, schema);
        PhysicalTable second = storageManager.createPhysicalTable(0, schema);
        assertEquals(2, storageManager.getLiveTables().size());

        assertTrue(first.release());
        assertFalse(first.release());

        assertEquals(1, storageManager.getLiveTables().size());
        assertSame(second, storageManager.getLiveTables().get(0));

        // 反复分配再释放不会累积
        for (int i = 0; i < 100; i++) {
            storageManager.createPhysicalTable(0, schema).release();
        }
        assertEquals(1, storageManager.getLiveTables().size());
    }

    @Test
    public void testNullSchemaRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StorageManagerImpl().createPhysicalTable(0, null));
    }
}
