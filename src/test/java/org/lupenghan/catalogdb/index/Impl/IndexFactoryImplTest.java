package org.lupenghan.catalogdb.index.Impl;

import org.junit.Test;
import org.lupenghan.catalogdb.catalog.models.ColumnInfo;
import org.lupenghan.catalogdb.catalog.models.IndexType;
import org.lupenghan.catalogdb.catalog.models.Schema;
import org.lupenghan.catalogdb.catalog.models.ValueType;
import org.lupenghan.catalogdb.index.models.IndexMetadata;
import org.lupenghan.catalogdb.index.models.PhysicalIndex;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class IndexFactoryImplTest {
    private final Schema schema = new Schema(List.of(new ColumnInfo(ValueType.INTEGER, 4, "id", true, false)));
    private final IndexMetadata metadata = new IndexMetadata("idx", IndexType.BTREE_MULTIMAP, schema, schema, false);

    @Test
    public void testReleasedIndexesAreForgotten() {
        IndexFactoryImpl factory = new IndexFactoryImpl(true);
        PhysicalIndex index = factory.createPhysicalIndex(metadata).orElseThrow();
        assertEquals(1, factory.getLiveIndexes().size());

        index.release();
        assertTrue(factory.getLiveIndexes().isEmpty());

        for (int i = 0; i < 100; i++) {
            factory.createPhysicalIndex(metadata).orElseThrow().release();
        }
        assertTrue(factory.getLiveIndexes().isEmpty());
    }

    @Test
    public void testDisabledEngineWithholdsHandle() {
        IndexFactoryImpl factory = new IndexFactoryImpl(false);
        assertFalse(factory.createPhysicalIndex(metadata).isPresent());
        assertTrue(factory.getLiveIndexes().isEmpty());
    }
}
