package org.lupenghan.catalogdb.lock.models;

/**
 * 已持有的锁，close 时释放。不抛受检异常，便于 try-with-resources。
 */
@FunctionalInterface
public interface LockGuard extends AutoCloseable {
    @Override
    void close();
}
