package com.memo.core;

/**
 * Hiç kilitlemeyen strateji. Yalnızca tek thread'li ya da dışarıdan senkronize
 * edilen kullanım için güvenlidir; eşzamanlı ıskalamalar hesaplamayı birden
 * fazla kez çalıştırabilir ve son yazan kazanır.
 */
final class NoOpGuard implements ConcurrencyGuard
{
    static final NoOpGuard INSTANCE = new NoOpGuard();

    private NoOpGuard() {}

    @Override
    public <T, X extends Throwable> T execute(Section<T, X> section) throws X
    {
        return section.run();
    }

    @Override
    public boolean threadSafe() { return false; }
}
