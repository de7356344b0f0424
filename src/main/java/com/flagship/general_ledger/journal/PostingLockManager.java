package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.exception.PostingLockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes ledger writes per tenant.
 *
 * Each tenant has one fair lock; writers for different tenants never contend.
 * A writer that cannot enter within the configured timeout is rejected before
 * it has touched anything. The lock is reentrant, so a reversal can post its
 * mirror entry from inside its own section.
 */
@Slf4j
@Component
public class PostingLockManager {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LedgerProperties properties;

    public PostingLockManager(LedgerProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs {@code action} while holding the tenant's posting lock.
     *
     * @throws PostingLockTimeoutException if the lock is not acquired in time
     */
    public <T> T withTenantLock(String tenantId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(tenantId, id -> new ReentrantLock(true));
        Duration timeout = properties.getPosting().getLockTimeout();

        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PostingLockTimeoutException(
                "Interrupted while waiting for the posting lock of tenant " + tenantId);
        }
        if (!acquired) {
            log.warn("Posting lock wait timed out: tenantId={}, timeoutMs={}, queued={}",
                tenantId, timeout.toMillis(), lock.getQueueLength());
            throw new PostingLockTimeoutException(String.format(
                "Tenant %s is busy; posting lock not acquired within %d ms", tenantId, timeout.toMillis()));
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithTenantLock(String tenantId, Runnable action) {
        withTenantLock(tenantId, () -> {
            action.run();
            return null;
        });
    }
}
