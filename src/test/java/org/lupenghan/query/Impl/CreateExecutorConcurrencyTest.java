package org.lupenghan.query.Impl;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.lupenghan.catalogdb.catalog.Impl.CatalogImpl;
import org.lupenghan.catalogdb.catalog.models.Table;
import org.lupenghan.catalogdb.index.Impl.IndexFactoryImpl;
import org.lupenghan.catalogdb.storage.Impl.StorageManagerImpl;
import org.lupenghan.config.CatalogConfig;
import org.lupenghan.parser.statement.ColumnDefinition;
import org.lupenghan.parser.statement.CreateStatement;
import org.lupenghan.parser.statement.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class CreateExecutorConcurrencyTest {
    private static final int THREADS = 8;

    private CatalogImpl catalog;
    private StorageManagerImpl storageManager;
    private CreateExecutorImpl executor;
    private ExecutorService pool;

    @Before
    public void setUp() {
        CatalogConfig config = CatalogConfig.builder().indexEngineEnabled(true).build();
        catalog = CatalogImpl.bootstrap(config.getDefaultDatabaseName());
        storageManager = new StorageManagerImpl();
        executor = new CreateExecutorImpl(catalog, storageManager, new IndexFactoryImpl(true), config);
        pool = Executors.newFixedThreadPool(THREADS);
    }

    @After
    public void tearDown() throws Exception {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
        catalog.shutdown();
    }

    private int runConcurrently(List<CreateStatement> statements) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (CreateStatement statement : statements) {
            Callable<Boolean> task = () -> {
                start.await();
                return executor.execute(statement);
            };
            futures.add(pool.submit(task));
        }
        start.countDown();
        int succeeded = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        return succeeded;
    }

    private static CreateStatement table(String name) {
        return CreateStatement.table(name, List.of(
                ColumnDefinition.column("id", DataType.BIGINT),
                ColumnDefinition.column("v", DataType.INT),
                ColumnDefinition.primaryKey(true, "id")));
    }

    @Test
    public void testSameTableNameExactlyOneWins() throws Exception {
        List<CreateStatement> statements = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            statements.add(table("orders"));
        }

        assertEquals(1, runConcurrently(statements));
        assertEquals(1, catalog.getDatabase(CatalogConfig.DEFAULT_DB_NAME).getTableCount());
        // 失败者的物理表都已释放
        assertEquals(1, storageManager.getLiveTables().size());
    }

    @Test
    public void testSameDatabaseNameExactlyOneWins() throws Exception {
        List<CreateStatement> statements = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            statements.add(CreateStatement.database("sales"));
        }

        assertEquals(1, runConcurrently(statements));
        assertEquals(2, catalog.getDatabases().size());
    }

    @Test
    public void testDistinctTablesAllSucceed() throws Exception {
        List<CreateStatement> statements = new ArrayList<>();
        for (int i = 0; i < THREADS * 4; i++) {
            statements.add(table("t" + i));
        }

        assertEquals(THREADS * 4, runConcurrently(statements));
        assertEquals(THREADS * 4, catalog.getDatabase(CatalogConfig.DEFAULT_DB_NAME).getTableCount());
    }

    @Test
    public void testConcurrentIndexesOnOneTable() throws Exception {
        assertTrue(executor.execute(table("orders")));
        List<CreateStatement> statements = new ArrayList<>();
        for (int i = 0; i < THREADS * 2; i++) {
            statements.add(CreateStatement.index("idx_" + i, "orders", false, List.of("v")));
        }
        // 与已有名字重复的一条应失败
        statements.add(CreateStatement.index("idx_0", "orders", false, List.of("id")));

        assertEquals(THREADS * 2, runConcurrently(statements));
        Table orders = catalog.getDatabase(CatalogConfig.DEFAULT_DB_NAME).getTable("orders");
        assertEquals(THREADS * 2 + 1, orders.getIndexes().size());
        for (int i = 0; i < THREADS * 2; i++) {
            assertNotNull(orders.getIndex("idx_" + i));
        }
    }
}
