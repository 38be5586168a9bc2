package com.memo.core;

/**
 * Klasik en uzun süredir kullanılmayan ilk çıkar yaklaşımı. Kapasite dolduğunda
 * en eski erişilen girdiyi kurban seçer.
 */
final class LruCacheStore<V> extends LinkedCacheStore<V>
{
    LruCacheStore(int capacity)
    {
        super(capacity, true);
    }
}
