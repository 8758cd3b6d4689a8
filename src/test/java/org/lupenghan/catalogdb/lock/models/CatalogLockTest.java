package org.lupenghan.catalogdb.lock.models;

import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class CatalogLockTest {

    @Test
    public void testWriteGuardReleasedOnExit() {
        CatalogLock lock = new CatalogLock("t");
        try (LockGuard ignored = lock.write()) {
            assertTrue(lock.isWriteLockedByCurrentThread());
            lock.checkWriteHeld();
        }
        assertFalse(lock.isWriteLockedByCurrentThread());
        assertThrows(IllegalStateException.class, lock::checkWriteHeld);
    }

    @Test
    public void testWriteGuardReleasedOnException() {
        CatalogLock lock = new CatalogLock("t");
        assertThrows(RuntimeException.class, () -> {
            try (LockGuard ignored = lock.write()) {
                throw new RuntimeException("boom");
            }
        });
        assertFalse(lock.isWriteLockedByCurrentThread());
    }

    @Test
    public void testWriterBlocksOtherThreads() throws Exception {
        CatalogLock lock = new CatalogLock("t");
        CountDownLatch attempted = new CountDownLatch(1);
        CountDownLatch acquired = new CountDownLatch(1);
        AtomicBoolean entered = new AtomicBoolean(false);

        Thread other;
        try (LockGuard ignored = lock.write()) {
            other = new Thread(() -> {
                attempted.countDown();
                try (LockGuard g = lock.write()) {
                    entered.set(true);
                    acquired.countDown();
                }
            });
            other.start();
            assertTrue(attempted.await(5, TimeUnit.SECONDS));
            assertFalse(acquired.await(100, TimeUnit.MILLISECONDS));
            assertFalse(entered.get());
        }
        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        other.join();
        assertTrue(entered.get());
    }
}
