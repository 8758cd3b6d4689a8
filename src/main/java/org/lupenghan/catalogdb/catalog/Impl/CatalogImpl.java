package org.lupenghan.catalogdb.catalog.Impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.catalog.interfaces.Catalog;
import org.lupenghan.catalogdb.catalog.models.Database;
import org.lupenghan.catalogdb.catalog.snapshot.CatalogSnapshot;
import org.lupenghan.catalogdb.catalog.snapshot.DatabaseSnapshot;
import org.lupenghan.catalogdb.lock.models.CatalogLock;
import org.lupenghan.catalogdb.lock.models.LockGuard;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 进程级目录。进程启动时创建一次并传给执行器，退出时 {@link #shutdown()}。
 */
@Slf4j
public class CatalogImpl implements Catalog {
    private final Map<String, Database> databases = new LinkedHashMap<>();
    private final AtomicInteger nextDatabaseId = new AtomicInteger(0);
    @Getter
    private final CatalogLock lock = new CatalogLock("catalog");

    /**
     * 创建目录并注册默认数据库
     */
    public static CatalogImpl bootstrap(String defaultDatabaseName) {
        CatalogImpl catalog = new CatalogImpl();
        Database database = new Database(catalog.allocateDatabaseId(), defaultDatabaseName);
        try (LockGuard ignored = catalog.getLock().write()) {
            catalog.addDatabase(database);
        }
        log.info("目录初始化完成，默认数据库: {}", defaultDatabaseName);
        return catalog;
    }

    @Override
    public boolean addDatabase(Database database) {
        lock.checkWriteHeld();
        if (databases.containsKey(database.getName())) {
            return false;
        }
        databases.put(database.getName(), database);
        return true;
    }

    @Override
    public Database getDatabase(String name) {
        try (LockGuard ignored = lock.read()) {
            return databases.get(name);
        }
    }

    @Override
    public List<Database> getDatabases() {
        try (LockGuard ignored = lock.read()) {
            return new ArrayList<>(databases.values());
        }
    }

    @Override
    public int allocateDatabaseId() {
        return nextDatabaseId.getAndIncrement();
    }

    @Override
    public CatalogSnapshot snapshot() {
        List<DatabaseSnapshot> result = new ArrayList<>();
        for (Database database : getDatabases()) {
            result.add(DatabaseSnapshot.of(database));
        }
        return new CatalogSnapshot(result);
    }

    @Override
    public void shutdown() {
        List<Database> owned;
        try (LockGuard ignored = lock.write()) {
            owned = new ArrayList<>(databases.values());
            databases.clear();
        }
        for (Database database : owned) {
            database.destroy();
        }
        log.info("目录已关闭，释放 {} 个数据库", owned.size());
    }
}
