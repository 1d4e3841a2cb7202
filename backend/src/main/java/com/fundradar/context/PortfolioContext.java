package com.fundradar.context;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Per-portfolio context passed explicitly to every service call: portfolio id, base currency and the
 * single-writer gate. Ledger mutations, fee calculations and cash-flow appends run under {@link #write};
 * read models under {@link #read}.
 */
public final class PortfolioContext {

    private final String portfolioId;
    private final String baseCurrency;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public PortfolioContext(String portfolioId, String baseCurrency) {
        if (portfolioId == null || portfolioId.isBlank()) {
            throw new IllegalArgumentException("portfolioId is required");
        }
        this.portfolioId = portfolioId;
        this.baseCurrency = Objects.requireNonNull(baseCurrency, "baseCurrency").toUpperCase();
    }

    public String portfolioId() {
        return portfolioId;
    }

    public String baseCurrency() {
        return baseCurrency;
    }

    public <T> T write(Supplier<T> action) {
        return locked(lock.writeLock(), action);
    }

    public void write(Runnable action) {
        locked(lock.writeLock(), () -> {
            action.run();
            return null;
        });
    }

    /**
     * Read under the shared lock. A thread already holding the write lock may read (downgrade is allowed
     * by ReentrantReadWriteLock).
     */
    public <T> T read(Supplier<T> action) {
        return locked(lock.readLock(), action);
    }

    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    private static <T> T locked(Lock l, Supplier<T> action) {
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }

    @Override
    public String toString() {
        return "PortfolioContext{" + portfolioId + ", " + baseCurrency + "}";
    }
}
