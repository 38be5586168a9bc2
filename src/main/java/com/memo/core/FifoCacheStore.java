package com.memo.core;

/**
 * İlk giren ilk çıkar. Okumalar sırayı değiştirmez; kurban en eski eklenen
 * girdidir. Kapasite verilmezse hiç tahliye yapmayan sınırsız depo olarak
 * kullanılır.
 */
final class FifoCacheStore<V> extends LinkedCacheStore<V>
{
    FifoCacheStore(Integer capacity)
    {
        super(capacity, false);
    }

    static <V> FifoCacheStore<V> unbounded()
    {
        return new FifoCacheStore<>(null);
    }
}
