package com.memo.core;

/**
 * Birleşik önbellek işlemlerini saran kritik bölge stratejisi. Strateji
 * kurulumda bir kez seçilir; işlem başına dallanma yapılmaz.
 */
public interface ConcurrencyGuard
{
    <T, X extends Throwable> T execute(Section<T, X> section) throws X;

    default void run(Runnable action)
    {
        execute(() -> {
            action.run();
            return null;
        });
    }

    boolean threadSafe();

    static ConcurrencyGuard forThreadSafety(boolean threadSafe)
    {
        return threadSafe ? new MutexGuard() : NoOpGuard.INSTANCE;
    }

    @FunctionalInterface
    interface Section<T, X extends Throwable>
    {
        T run() throws X;
    }
}
