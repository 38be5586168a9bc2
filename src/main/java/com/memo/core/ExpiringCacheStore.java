package com.memo.core;

import com.memo.core.model.CallArguments;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Bir depoyu TTL ile saran dekoratör. Her girdinin bitiş anı ekleme anı artı
 * TTL'dir; süresi dolan girdi mantıksal olarak yoktur ve ona dokunan ilk
 * işlemde depodan silinir.
 * <p>
 * TTL depo boyunca sabit olduğundan bitiş sırası yazma sırasıyla aynıdır.
 * Girdiler bu sırayla ayrı bir bağlı listede de tutulur; temizlik yalnızca
 * listenin başındaki süresi dolmuş girdileri söker ve ilk canlı girdide durur.
 */
final class ExpiringCacheStore<V> implements CacheStore<V>
{
    private static final Logger LOG = Logger.getLogger(ExpiringCacheStore.class);

    // keeps now + ttl within the range where nanoTime differences stay meaningful
    private static final long MAX_TTL_NANOS = Long.MAX_VALUE >> 1;

    private final CacheStore<V> delegate;
    private final long ttlNanos;
    private final LongSupplier ticker;

    private CacheEntry<V> oldest;
    private CacheEntry<V> newest;

    ExpiringCacheStore(CacheStore<V> delegate, Duration ttl, LongSupplier ticker)
    {
        this.delegate = Objects.requireNonNull(delegate);
        this.ticker = Objects.requireNonNull(ticker);
        this.ttlNanos = toNanos(Objects.requireNonNull(ttl));
    }

    private static long toNanos(Duration ttl)
    {
        try {
            return Math.min(ttl.toNanos(), MAX_TTL_NANOS);
        } catch (ArithmeticException ex) {
            return MAX_TTL_NANOS;
        }
    }

    @Override
    public CacheEntry<V> get(CacheKey key)
    {
        if (dropIfExpired(key)) return null;
        return delegate.get(key);
    }

    @Override
    public CacheEntry<V> peek(CacheKey key)
    {
        if (dropIfExpired(key)) return null;
        return delegate.peek(key);
    }

    @Override
    public CacheEntry<V> put(CacheKey key, CallArguments arguments, V value)
    {
        if (delegate.isFull() && peek(key) == null) {
            purgeExpired();
        }
        CacheEntry<V> evicted = delegate.put(key, arguments, value);
        if (evicted != null) dequeue(evicted);
        CacheEntry<V> entry = delegate.peek(key);
        if (entry == null) {
            throw new IllegalStateException("Entry for " + key + " missing right after insertion");
        }
        entry.expiresAt(ticker.getAsLong() + ttlNanos);
        dequeue(entry);
        enqueue(entry);
        return evicted;
    }

    @Override
    public CacheEntry<V> remove(CacheKey key)
    {
        CacheEntry<V> entry = delegate.remove(key);
        if (entry != null) dequeue(entry);
        return entry;
    }

    @Override
    public int size()
    {
        purgeExpired();
        return delegate.size();
    }

    @Override
    public Integer maxSize() { return delegate.maxSize(); }

    @Override
    public boolean isFull()
    {
        Integer max = maxSize();
        return max != null && size() >= max;
    }

    @Override
    public void clear()
    {
        delegate.clear();
        for (CacheEntry<V> e = oldest; e != null; ) {
            CacheEntry<V> next = e.newerByExpiry;
            e.olderByExpiry = null;
            e.newerByExpiry = null;
            e.queuedForExpiry = false;
            e = next;
        }
        oldest = newest = null;
    }

    @Override
    public void forEach(Consumer<CacheEntry<V>> action)
    {
        purgeExpired();
        delegate.forEach(action);
    }

    /** @return silinen girdi sayısı */
    int purgeExpired()
    {
        long now = ticker.getAsLong();
        int purged = 0;
        while (oldest != null && oldest.expired(now)) {
            CacheEntry<V> entry = oldest;
            dequeue(entry);
            delegate.remove(entry.key());
            purged++;
        }
        if (purged > 0) {
            LOG.tracef("Purged %d expired entries", purged);
        }
        return purged;
    }

    private boolean dropIfExpired(CacheKey key)
    {
        CacheEntry<V> entry = delegate.peek(key);
        if (entry == null || !entry.expired(ticker.getAsLong())) return false;
        delegate.remove(key);
        dequeue(entry);
        LOG.tracef("Entry %s expired", key);
        return true;
    }

    private void enqueue(CacheEntry<V> entry)
    {
        entry.olderByExpiry = newest;
        entry.newerByExpiry = null;
        if (newest != null) newest.newerByExpiry = entry;
        else oldest = entry;
        newest = entry;
        entry.queuedForExpiry = true;
    }

    private void dequeue(CacheEntry<V> entry)
    {
        if (!entry.queuedForExpiry) return;
        if (entry.olderByExpiry != null) entry.olderByExpiry.newerByExpiry = entry.newerByExpiry;
        else oldest = entry.newerByExpiry;
        if (entry.newerByExpiry != null) entry.newerByExpiry.olderByExpiry = entry.olderByExpiry;
        else newest = entry.olderByExpiry;
        entry.olderByExpiry = null;
        entry.newerByExpiry = null;
        entry.queuedForExpiry = false;
    }
}
