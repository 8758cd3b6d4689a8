package org.lupenghan.catalogdb.lock.models;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 目录对象上的读写锁。每个 Catalog / Database / Table 各持有一把，
 * 只保护该对象自己的容器（库名表、表名表、列/约束/索引列表）。
 *
 * 获取方式统一为 try-with-resources：
 * <pre>
 * try (LockGuard guard = lock.write()) {
 *     database.addTable(table);
 * }
 * </pre>
 */
@Slf4j
public class CatalogLock {
    @Getter
    private final String owner;                   // 锁所属对象，仅用于日志
    private final ReentrantReadWriteLock lock;

    public CatalogLock(String owner) {
        this.owner = owner;
        this.lock = new ReentrantReadWriteLock();
    }

    public LockGuard read() {
        lock.readLock().lock();
        return () -> lock.readLock().unlock();
    }

    public LockGuard write() {
        lock.writeLock().lock();
        log.debug("write lock acquired: {}", owner);
        return () -> {
            lock.writeLock().unlock();
            log.debug("write lock released: {}", owner);
        };
    }

    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    /**
     * add 类方法的前置检查：调用方必须已持有写锁。
     */
    public void checkWriteHeld() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("write lock not held on " + owner);
        }
    }
}
