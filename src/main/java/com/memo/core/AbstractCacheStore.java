package com.memo.core;

import com.memo.core.model.CallArguments;

import java.util.Objects;

/**
 * Üç politikanın ortak iskeleti: indeks yönetimi, kapasite kontrolü ve tahliye
 * akışı burada; sıralama yapısı alt sınıflara bırakılır.
 */
abstract class AbstractCacheStore<V> implements CacheStore<V>
{
    private final KeyIndex<V> index = new KeyIndex<>();
    private final Integer capacity;
    private long sequence;

    AbstractCacheStore(Integer capacity)
    {
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /** Yeni girdiyi sıralama yapısına bağlar. */
    abstract void link(CacheEntry<V> entry);

    /** Girdiyi sıralama yapısından ayırır. */
    abstract void unlink(CacheEntry<V> entry);

    /** İsabet sonrası sıralama güncellemesi; erişim sayacı zaten artırılmıştır. */
    abstract void onAccess(CacheEntry<V> entry);

    /** Bir sonraki kurban; depo boşsa {@code null}. */
    abstract CacheEntry<V> victim();

    abstract void unlinkAll();

    @Override
    public CacheEntry<V> get(CacheKey key)
    {
        CacheEntry<V> entry = index.get(key);
        if (entry != null) {
            entry.recordAccess();
            onAccess(entry);
        }
        return entry;
    }

    @Override
    public CacheEntry<V> peek(CacheKey key)
    {
        return index.get(key);
    }

    @Override
    public CacheEntry<V> put(CacheKey key, CallArguments arguments, V value)
    {
        Objects.requireNonNull(key, "key");
        CacheEntry<V> existing = index.get(key);
        if (existing != null) {
            existing.value(value);
            existing.recordAccess();
            onAccess(existing);
            return null;
        }

        CacheEntry<V> evicted = null;
        if (capacity != null && index.size() >= capacity) {
            CacheEntry<V> victim = victim();
            if (victim == null) {
                throw new IllegalStateException("Store reports size " + index.size() + " but has no eviction candidate");
            }
            unlink(victim);
            index.remove(victim.key());
            evicted = victim;
        }

        CacheEntry<V> entry = new CacheEntry<>(key, arguments, value, ++sequence);
        index.put(entry);
        link(entry);
        if (capacity != null && index.size() > capacity) {
            throw new IllegalStateException("Store size " + index.size() + " exceeds max size " + capacity);
        }
        return evicted;
    }

    @Override
    public CacheEntry<V> remove(CacheKey key)
    {
        CacheEntry<V> entry = index.remove(key);
        if (entry != null) unlink(entry);
        return entry;
    }

    @Override
    public int size() { return index.size(); }

    @Override
    public Integer maxSize() { return capacity; }

    @Override
    public void clear()
    {
        index.clear();
        unlinkAll();
    }
}
