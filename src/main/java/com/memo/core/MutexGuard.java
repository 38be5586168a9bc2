package com.memo.core;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Tüm bölgeyi tek bir kilitle koruyan kaba taneli strateji. Aynı anahtar için
 * hesaplama yalnızca bir kez çalışır; farklı anahtarların hesaplamaları da
 * sıraya girer. Kilit yeniden girilebilir, böylece özyinelemeli bir hesaplama
 * kendi önbelleğini çağırabilir.
 */
final class MutexGuard implements ConcurrencyGuard
{
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public <T, X extends Throwable> T execute(Section<T, X> section) throws X
    {
        lock.lock();
        try {
            return section.run();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean threadSafe() { return true; }

    boolean isHeldByCurrentThread() { return lock.isHeldByCurrentThread(); }
}
