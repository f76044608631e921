package com.arccatalog.service.backup;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Allows one backup or restore at a time. A second caller fails immediately instead of waiting.
 */
public class ArchiveOperationLock {
    private final Semaphore semaphore = new Semaphore(1);
    private volatile String currentOperation;

    /**
     * @throws BackupException if another archive operation is running
     */
    public Permit acquire(String operation) throws BackupException {
        if (!semaphore.tryAcquire()) {
            throw new BackupException("Another archive operation is in progress: " + currentOperation);
        }
        currentOperation = operation;
        return new Permit();
    }

    public boolean isHeld() {
        return semaphore.availablePermits() == 0;
    }

    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                currentOperation = null;
                semaphore.release();
            }
        }
    }
}
