package org.lupenghan.catalogdb.catalog.interfaces;

import org.lupenghan.catalogdb.catalog.models.Database;
import org.lupenghan.catalogdb.catalog.snapshot.CatalogSnapshot;
import org.lupenghan.catalogdb.lock.models.CatalogLock;

import java.util.List;

/**
 * 目录根：数据库名 -> 数据库。
 */
public interface Catalog {
    /**
     * 加入数据库，同名已存在时返回 false。调用方需持有 {@link #getLock()} 的写锁。
     */
    boolean addDatabase(Database database);

    Database getDatabase(String name);

    List<Database> getDatabases();

    int allocateDatabaseId();

    CatalogLock getLock();

    CatalogSnapshot snapshot();

    /**
     * 进程退出时调用，销毁所有数据库
     */
    void shutdown();
}
